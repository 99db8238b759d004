package workpipe.queue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Single-process {@link WorkQueue} keeping the backlog and claim records in memory.
 *
 * <p>All operations synchronize on the queue, so the claim predicate ("no record, or an
 * expired pending claim, or a failure older than the retry interval") is evaluated and
 * committed atomically. Items are ordered by the time they were added.
 *
 * <p>Create instances via {@link #builder(Function)}.
 *
 * @param <T> item type
 */
public final class InMemoryWorkQueue<T> implements WorkQueue<T> {
    private static final Logger logger = Logger.getLogger(InMemoryWorkQueue.class.getName());

    public static final Duration DEFAULT_CLAIM_EXPIRY = Duration.ofMinutes(90);

    private enum Status { PENDING, COMPLETE, FAILED }

    private record ClaimKey(String workType, String itemKey, int version) {
    }

    private static final class ClaimRecord {
        Status status;
        String owner;
        String token;
        Instant claimedAt;
        Instant failedAt;
        String lastError;
        int attempts;
    }

    private record Entry<T>(T item, long sequence, Instant createdAt) {
    }

    private final Function<T, String> keyFunction;
    private final Function<T, String> sourceIdFunction;
    private final Function<T, String> mimeTypeFunction;
    private final Duration claimExpiry;
    private final Clock clock;
    private final String ownerId;

    private final Map<String, Entry<T>> backlog = new LinkedHashMap<>();
    private final Map<ClaimKey, ClaimRecord> claims = new HashMap<>();
    private long nextSequence;

    private InMemoryWorkQueue(Builder<T> builder) {
        this.keyFunction = Objects.requireNonNull(builder.keyFunction, "keyFunction");
        this.sourceIdFunction = builder.sourceIdFunction;
        this.mimeTypeFunction = builder.mimeTypeFunction;
        this.claimExpiry = Objects.requireNonNull(builder.claimExpiry, "claimExpiry");
        if (claimExpiry.isNegative() || claimExpiry.isZero()) {
            throw new IllegalArgumentException("claimExpiry must be > 0");
        }
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.ownerId = builder.ownerId != null ? builder.ownerId : "worker-" + UUID.randomUUID();
    }

    /**
     * @param keyFunction extracts the unique item key
     */
    public static <T> Builder<T> builder(Function<T, String> keyFunction) {
        return new Builder<T>().keyFunction(keyFunction);
    }

    /**
     * Adds an item to the backlog. Re-adding a known key is a no-op.
     *
     * @return {@code true} if the item was added
     */
    public synchronized boolean add(T item) {
        Objects.requireNonNull(item, "item");
        String key = keyFunction.apply(item);
        if (backlog.containsKey(key)) {
            return false;
        }
        backlog.put(key, new Entry<>(item, nextSequence++, clock.instant()));
        return true;
    }

    public synchronized void addAll(Iterable<? extends T> items) {
        for (T item : items) {
            add(item);
        }
    }

    @Override
    public synchronized long count(WorkFilter filter) {
        Objects.requireNonNull(filter, "filter");
        Instant now = clock.instant();
        long count = 0;
        for (Entry<T> entry : backlog.values()) {
            if (eligible(entry, filter, now)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public synchronized List<T> fetchBatch(WorkFilter filter, int limit, String cursor) {
        Objects.requireNonNull(filter, "filter");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        long after = parseCursor(cursor);
        Instant now = clock.instant();
        List<T> batch = new ArrayList<>(Math.min(limit, 64));
        for (Entry<T> entry : backlog.values()) {
            if (entry.sequence() <= after || !eligible(entry, filter, now)) {
                continue;
            }
            batch.add(entry.item());
            if (batch.size() >= limit) {
                break;
            }
        }
        return batch;
    }

    @Override
    public synchronized WorkHandle<T> claim(T item, WorkFilter filter) {
        Objects.requireNonNull(filter, "filter");
        String key = keyFunction.apply(item);
        Entry<T> entry = backlog.get(key);
        if (entry == null) {
            throw WorkQueueException.notFound("Unknown item: " + key);
        }
        Instant now = clock.instant();
        if (!claimable(claims.get(claimKey(filter, key)), filter, now)) {
            throw WorkQueueException.alreadyClaimed(key);
        }
        ClaimRecord record = claims.computeIfAbsent(claimKey(filter, key), k -> new ClaimRecord());
        record.status = Status.PENDING;
        record.owner = ownerId;
        record.token = ClaimId.PendingClaim.newToken();
        record.claimedAt = now;
        record.failedAt = null;
        return new WorkHandle<>(item,
                new ClaimId.PendingClaim(filter.workType(), key, filter.version(), ownerId, record.token));
    }

    @Override
    public synchronized void complete(WorkHandle<T> handle) {
        ClaimRecord record = recordFor(handle);
        handle.consume();
        record.status = Status.COMPLETE;
        record.owner = null;
        record.token = null;
    }

    @Override
    public synchronized void fail(WorkHandle<T> handle, String error, boolean requeue) {
        ClaimRecord record = recordFor(handle);
        handle.consume();
        ClaimId.PendingClaim claim = (ClaimId.PendingClaim) handle.claimId();
        if (record.status != Status.PENDING || !claim.token().equals(record.token)) {
            logger.fine("Claim on " + claim.itemKey() + " for " + claim.workType()
                    + " is no longer held by this handle (" + record.status + "); failure not recorded");
            return;
        }
        record.status = Status.FAILED;
        record.owner = null;
        record.token = null;
        record.failedAt = clock.instant();
        record.lastError = error;
        record.attempts++;
    }

    @Override
    public synchronized String cursorOf(T item) {
        Entry<T> entry = backlog.get(keyFunction.apply(item));
        return entry == null ? null : Long.toString(entry.sequence());
    }

    /**
     * Returns the last recorded error for an item, or {@code null}.
     */
    public synchronized String lastError(String itemKey, WorkFilter filter) {
        ClaimRecord record = claims.get(claimKey(filter, itemKey));
        return record == null ? null : record.lastError;
    }

    /**
     * Returns how many times an item has failed for the given filter.
     */
    public synchronized int attempts(String itemKey, WorkFilter filter) {
        ClaimRecord record = claims.get(claimKey(filter, itemKey));
        return record == null ? 0 : record.attempts;
    }

    private ClaimRecord recordFor(WorkHandle<T> handle) {
        Objects.requireNonNull(handle, "handle");
        if (!(handle.claimId() instanceof ClaimId.PendingClaim pending)) {
            throw new IllegalArgumentException("Not a claim issued by this queue: " + handle.claimId());
        }
        ClaimRecord record = claims.get(new ClaimKey(pending.workType(), pending.itemKey(), pending.version()));
        if (record == null) {
            throw WorkQueueException.notFound("No claim for " + pending.itemKey());
        }
        return record;
    }

    private boolean eligible(Entry<T> entry, WorkFilter filter, Instant now) {
        String key = keyFunction.apply(entry.item());
        if (filter.sourceId() != null
                && (sourceIdFunction == null || !filter.sourceId().equals(sourceIdFunction.apply(entry.item())))) {
            return false;
        }
        if (filter.mimeType() != null
                && (mimeTypeFunction == null || !filter.mimeType().equals(mimeTypeFunction.apply(entry.item())))) {
            return false;
        }
        if (filter.prerequisite() != null && !completedAnyVersion(filter.prerequisite(), key)) {
            return false;
        }
        return claimable(claims.get(claimKey(filter, key)), filter, now);
    }

    private boolean claimable(ClaimRecord record, WorkFilter filter, Instant now) {
        if (record == null) {
            return true;
        }
        return switch (record.status) {
            case PENDING -> !record.claimedAt.plus(claimExpiry).isAfter(now);
            case FAILED -> !record.failedAt.plus(filter.retryInterval()).isAfter(now);
            case COMPLETE -> false;
        };
    }

    private boolean completedAnyVersion(String workType, String itemKey) {
        for (Map.Entry<ClaimKey, ClaimRecord> e : claims.entrySet()) {
            ClaimKey k = e.getKey();
            if (k.workType().equals(workType) && k.itemKey().equals(itemKey)
                    && e.getValue().status == Status.COMPLETE) {
                return true;
            }
        }
        return false;
    }

    private static ClaimKey claimKey(WorkFilter filter, String itemKey) {
        return new ClaimKey(filter.workType(), itemKey, filter.version());
    }

    private static long parseCursor(String cursor) {
        if (cursor == null || cursor.isEmpty()) {
            return -1L;
        }
        try {
            return Long.parseLong(cursor);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid cursor: " + cursor, e);
        }
    }

    /**
     * Builder for {@link InMemoryWorkQueue}.
     *
     * @param <T> item type
     */
    public static final class Builder<T> {
        private Function<T, String> keyFunction;
        private Function<T, String> sourceIdFunction;
        private Function<T, String> mimeTypeFunction;
        private Duration claimExpiry = DEFAULT_CLAIM_EXPIRY;
        private Clock clock;
        private String ownerId;

        private Builder() {
        }

        public Builder<T> keyFunction(Function<T, String> keyFunction) {
            this.keyFunction = keyFunction;
            return this;
        }

        /** Extracts the source id matched against {@link WorkFilter#sourceId()}. */
        public Builder<T> sourceIdFunction(Function<T, String> sourceIdFunction) {
            this.sourceIdFunction = sourceIdFunction;
            return this;
        }

        /** Extracts the mime type matched against {@link WorkFilter#mimeType()}. */
        public Builder<T> mimeTypeFunction(Function<T, String> mimeTypeFunction) {
            this.mimeTypeFunction = mimeTypeFunction;
            return this;
        }

        public Builder<T> claimExpiry(Duration claimExpiry) {
            this.claimExpiry = claimExpiry;
            return this;
        }

        public Builder<T> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder<T> ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public InMemoryWorkQueue<T> build() {
            return new InMemoryWorkQueue<>(this);
        }
    }
}

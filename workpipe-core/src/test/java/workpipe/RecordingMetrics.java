package workpipe;

import workpipe.spi.MetricsExporter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsExporter} that keeps every call in memory for assertions.
 */
public final class RecordingMetrics implements MetricsExporter {
    private final Map<String, AtomicLong> succeeded = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> failed = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> skipped = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> rateLimitHits = new ConcurrentHashMap<>();
    private final Map<String, Long> backlog = new ConcurrentHashMap<>();
    private final Map<String, Long> domainDelays = new ConcurrentHashMap<>();
    private final AtomicLong eventsDropped = new AtomicLong();

    @Override
    public void incrementItemSucceeded(String stage) {
        succeeded.computeIfAbsent(stage, s -> new AtomicLong()).incrementAndGet();
    }

    @Override
    public void incrementItemFailed(String stage) {
        failed.computeIfAbsent(stage, s -> new AtomicLong()).incrementAndGet();
    }

    @Override
    public void incrementItemSkipped(String stage) {
        skipped.computeIfAbsent(stage, s -> new AtomicLong()).incrementAndGet();
    }

    @Override
    public void incrementEventsDropped() {
        eventsDropped.incrementAndGet();
    }

    @Override
    public void recordBacklog(String stage, long value) {
        backlog.put(stage, value);
    }

    @Override
    public void incrementRateLimitHit(String domain) {
        rateLimitHits.computeIfAbsent(domain, d -> new AtomicLong()).incrementAndGet();
    }

    @Override
    public void recordDomainDelayMs(String domain, long delayMs) {
        domainDelays.put(domain, delayMs);
    }

    public long succeeded(String stage) {
        return get(succeeded, stage);
    }

    public long failed(String stage) {
        return get(failed, stage);
    }

    public long skipped(String stage) {
        return get(skipped, stage);
    }

    public long rateLimitHits(String domain) {
        return get(rateLimitHits, domain);
    }

    public Long backlog(String stage) {
        return backlog.get(stage);
    }

    public Long domainDelayMs(String domain) {
        return domainDelays.get(domain);
    }

    public long eventsDropped() {
        return eventsDropped.get();
    }

    private static long get(Map<String, AtomicLong> map, String key) {
        AtomicLong value = map.get(key);
        return value == null ? 0L : value.get();
    }
}

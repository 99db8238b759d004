package workpipe.queue;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable selection criteria for a work queue.
 *
 * <p>{@code workType} names the kind of work (e.g. {@code "ocr"}, {@code "annotate:summary"});
 * claims are tracked per {@code (workType, itemKey, version)}, so bumping {@code version}
 * makes every item eligible again for the same work type. {@code sourceId} and
 * {@code mimeType} narrow the backlog when set. {@code prerequisite}, when set, restricts
 * the backlog to items that have completed that other work type.
 *
 * @param workType           kind of work, never blank
 * @param sourceId           optional source restriction
 * @param mimeType           optional mime type restriction
 * @param version            work version, {@code >= 1}
 * @param retryIntervalHours hours a failed item waits before it is claimable again
 * @param prerequisite       optional work type that must be complete first
 */
public record WorkFilter(
        String workType,
        String sourceId,
        String mimeType,
        int version,
        int retryIntervalHours,
        String prerequisite) {

    public static final int DEFAULT_VERSION = 1;
    public static final int DEFAULT_RETRY_INTERVAL_HOURS = 12;

    public WorkFilter {
        Objects.requireNonNull(workType, "workType");
        if (workType.isBlank()) {
            throw new IllegalArgumentException("workType must not be blank");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1, got: " + version);
        }
        if (retryIntervalHours < 0) {
            throw new IllegalArgumentException("retryIntervalHours must be >= 0, got: " + retryIntervalHours);
        }
    }

    /**
     * Creates a filter for {@code workType} with the default version and retry interval.
     */
    public static WorkFilter of(String workType) {
        return new WorkFilter(workType, null, null, DEFAULT_VERSION, DEFAULT_RETRY_INTERVAL_HOURS, null);
    }

    public WorkFilter withSourceId(String sourceId) {
        return new WorkFilter(workType, sourceId, mimeType, version, retryIntervalHours, prerequisite);
    }

    public WorkFilter withMimeType(String mimeType) {
        return new WorkFilter(workType, sourceId, mimeType, version, retryIntervalHours, prerequisite);
    }

    public WorkFilter withVersion(int version) {
        return new WorkFilter(workType, sourceId, mimeType, version, retryIntervalHours, prerequisite);
    }

    public WorkFilter withRetryIntervalHours(int retryIntervalHours) {
        return new WorkFilter(workType, sourceId, mimeType, version, retryIntervalHours, prerequisite);
    }

    public WorkFilter withPrerequisite(String prerequisite) {
        return new WorkFilter(workType, sourceId, mimeType, version, retryIntervalHours, prerequisite);
    }

    public Duration retryInterval() {
        return Duration.ofHours(retryIntervalHours);
    }
}

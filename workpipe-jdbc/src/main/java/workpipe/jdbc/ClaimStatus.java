package workpipe.jdbc;

/**
 * Lifecycle states of a claim row. Stored as integer codes in {@code work_claim.status}.
 *
 * <p>Transitions: {@code PENDING → COMPLETE} (terminal), {@code PENDING → FAILED}, and
 * back to {@code PENDING} when an expired or retryable claim is taken again.
 */
public enum ClaimStatus {
  /**
   * Claimed and in progress.
   */
  PENDING(0),
  /**
   * Processed successfully; never claimed again.
   */
  COMPLETE(1),
  /**
   * Processing failed; claimable again after the filter's retry interval.
   */
  FAILED(2);

  private final int code;

  ClaimStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static ClaimStatus fromCode(int code) {
    for (ClaimStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown claim status code: " + code);
  }
}

package workpipe.ratelimit;

/**
 * Unchecked exception thrown when a {@link RateLimitBackend} cannot read or write its state.
 *
 * <p>{@link RateLimiter} never propagates it: requests fall back to the base delay.
 */
public class RateLimitBackendException extends RuntimeException {
  public RateLimitBackendException(String message) {
    super(message);
  }

  public RateLimitBackendException(String message, Throwable cause) {
    super(message, cause);
  }
}

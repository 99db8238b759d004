package workpipe.ratelimit;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Storage for per-domain throttling state and recent 403 responses.
 *
 * <p>{@link #update} must be atomic relative to reads of the same domain, including
 * callers in other processes for durable backends. All methods throw
 * {@link RateLimitBackendException} when the store is unavailable.
 *
 * @see InMemoryRateLimitBackend
 */
public interface RateLimitBackend {

  /**
   * Returns the state for {@code domain}, creating it with {@code baseDelayMs} if absent.
   */
  DomainRateState getOrCreate(String domain, long baseDelayMs);

  /**
   * Atomically applies {@code mutation} to the domain's state and stores the result.
   * The mutation may run more than once under contention and must be side-effect free.
   *
   * @return the stored state
   */
  DomainRateState update(String domain, long baseDelayMs, UnaryOperator<DomainRateState> mutation);

  /**
   * Reserves the next request slot for {@code domain} and counts the request.
   *
   * @return milliseconds the caller must wait before sending
   */
  default long acquire(String domain, long baseDelayMs, long nowMs) {
    long[] wait = new long[1];
    update(domain, baseDelayMs, state -> {
      long w = state.waitTimeMs(nowMs);
      wait[0] = w;
      return state.withRequestAt(nowMs + w);
    });
    return wait[0];
  }

  /** Records a 403 response for {@code url} at {@code atMs}. */
  void record403(String domain, String url, long atMs);

  /** Counts distinct URLs that answered 403 at or after {@code sinceMs}. */
  int count403(String domain, long sinceMs);

  /** Forgets all recorded 403 responses for {@code domain}. */
  void clear403s(String domain);

  /**
   * Deletes 403 records older than {@code beforeMs} for every domain.
   *
   * @return number of records removed
   */
  int cleanupExpired403s(long beforeMs);

  /** Returns the state of every tracked domain. */
  List<DomainRateState> snapshot();
}

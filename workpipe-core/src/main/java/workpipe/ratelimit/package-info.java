/**
 * Adaptive per-domain rate limiting for calls to external services.
 *
 * <p>{@link workpipe.ratelimit.RateLimiter} holds the backoff and recovery policy,
 * {@link workpipe.ratelimit.RateLimitBackend} stores per-domain state, and
 * {@link workpipe.ratelimit.RateLimitGate} wraps individual calls with slot reservation
 * and inline retries.
 */
package workpipe.ratelimit;

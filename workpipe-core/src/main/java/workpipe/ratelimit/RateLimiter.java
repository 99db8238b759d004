package workpipe.ratelimit;

import workpipe.spi.MetricsExporter;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Adaptive per-domain rate limiter.
 *
 * <p>Each domain starts at the base delay. A rate-limit signal (HTTP 429/503, a
 * {@code Retry-After} header, or a burst of 403s on distinct URLs) multiplies the delay by
 * the backoff multiplier, capped at the max delay, and puts the domain in backoff. While in
 * backoff, every {@code recoveryThreshold} consecutive successes multiply the delay by the
 * recovery multiplier, floored at the min delay; backoff ends once the delay is back at or
 * below the base delay. Any failure resets the success counter.
 *
 * <p>State lives in a {@link RateLimitBackend}. When the backend fails, the limiter logs a
 * warning and falls back to the base delay; it never fails the caller's request.
 *
 * <p>This class is thread-safe.
 */
public final class RateLimiter {
  private static final Logger logger = Logger.getLogger(RateLimiter.class.getName());

  private static final double SERVER_ERROR_MULTIPLIER = 1.5;
  private static final int CLEANUP_EVERY_403S = 100;

  private final RateLimitBackend backend;
  private final RateLimitConfig config;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final AtomicLong forbiddenSeen = new AtomicLong();

  public RateLimiter(RateLimitBackend backend) {
    this(backend, RateLimitConfig.defaults());
  }

  public RateLimiter(RateLimitBackend backend, RateLimitConfig config) {
    this(backend, config, Clock.systemUTC(), MetricsExporter.NOOP);
  }

  public RateLimiter(RateLimitBackend backend, RateLimitConfig config, Clock clock, MetricsExporter metrics) {
    this.backend = Objects.requireNonNull(backend, "backend");
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  public RateLimitConfig config() {
    return config;
  }

  public RateLimitBackend backend() {
    return backend;
  }

  /**
   * Returns the current delay between requests to {@code domain}.
   */
  public Duration getDelay(String domain) {
    try {
      return Duration.ofMillis(backend.getOrCreate(domain, config.baseDelayMs()).currentDelayMs());
    } catch (RateLimitBackendException e) {
      warnFallback("read state", domain, e);
      return config.baseDelay();
    }
  }

  /**
   * Reserves the next request slot for {@code domain} without waiting.
   *
   * @return how long the caller must wait before sending
   */
  public Duration reserve(String domain) {
    try {
      return Duration.ofMillis(backend.acquire(domain, config.baseDelayMs(), clock.millis()));
    } catch (RateLimitBackendException e) {
      warnFallback("reserve a request slot", domain, e);
      return config.baseDelay();
    }
  }

  /**
   * Reserves the next request slot for {@code domain} and blocks until it arrives.
   *
   * @return the time spent waiting
   * @throws InterruptedException if interrupted while waiting
   */
  public Duration acquire(String domain) throws InterruptedException {
    Duration wait = reserve(domain);
    if (!wait.isZero()) {
      Thread.sleep(wait.toMillis());
    }
    return wait;
  }

  /**
   * Counts a request made without {@link #acquire}.
   */
  public void recordRequest(String domain) {
    long now = clock.millis();
    update(domain, "record request", s -> s.withRequestAt(Math.max(now, s.lastRequestAtMs())));
  }

  /**
   * Records a successful response. Clears tracked 403s and, while in backoff, applies one
   * recovery step every {@code recoveryThreshold} consecutive successes.
   */
  public void recordSuccess(String domain) {
    clear403s(domain);
    boolean[] recovered = new boolean[1];
    DomainRateState state = update(domain, "record success", s -> {
      int successes = s.consecutiveSuccesses() + 1;
      recovered[0] = false;
      if (s.inBackoff() && successes >= config.recoveryThreshold()) {
        long delay = Math.max((long) (s.currentDelayMs() * config.recoveryMultiplier()), config.minDelayMs());
        recovered[0] = true;
        return s.withDelay(delay, delay > config.baseDelayMs()).withConsecutiveSuccesses(0);
      }
      return s.withConsecutiveSuccesses(successes);
    });
    if (state != null && recovered[0]) {
      metrics.recordDomainDelayMs(domain, state.currentDelayMs());
      logger.info("Recovering " + domain + ": delay reduced to " + state.currentDelayMs() + "ms"
          + (state.inBackoff() ? "" : ", backoff ended"));
    }
  }

  /**
   * Records a failed request.
   *
   * @param isRateLimit whether the failure was a rate-limit signal
   */
  public void recordFailure(String domain, boolean isRateLimit) {
    if (isRateLimit) {
      recordRateLimit(domain, null);
      return;
    }
    update(domain, "record failure", s -> s.withConsecutiveSuccesses(0));
  }

  /**
   * Records a definite rate-limit signal and backs off.
   *
   * @param retryAfter server-requested wait; when present it replaces the computed delay,
   *                   capped at {@link RateLimitConfig#retryAfterCap()}. May be {@code null}.
   */
  public void recordRateLimit(String domain, Duration retryAfter) {
    clear403s(domain);
    DomainRateState state = update(domain, "record rate limit", s -> {
      long delay;
      if (retryAfter != null) {
        delay = config.clampMs(Math.min(retryAfter.toMillis(), config.retryAfterCap().toMillis()));
      } else {
        delay = Math.min((long) (s.currentDelayMs() * config.backoffMultiplier()), config.maxDelayMs());
      }
      return s.withRateLimitHit().withDelay(delay, true);
    });
    metrics.incrementRateLimitHit(domain);
    if (state != null) {
      metrics.recordDomainDelayMs(domain, state.currentDelayMs());
      logger.warning("Rate limited by " + domain + ", backing off to " + state.currentDelayMs() + "ms");
    }
  }

  /**
   * Records a 403 response. A {@code Retry-After} header, or {@code forbiddenThreshold}
   * distinct URLs answering 403 within {@code forbiddenWindow}, counts as rate limiting.
   *
   * @return {@code true} if the response was treated as rate limiting
   */
  public boolean record403(String domain, String url, boolean hasRetryAfter) {
    return handle403(domain, url, hasRetryAfter, null);
  }

  /**
   * Records a 5xx response other than 503: the delay grows by half, without counting a
   * rate-limit hit.
   */
  public void recordServerError(String domain) {
    DomainRateState state = update(domain, "record server error", s -> {
      long delay = Math.min((long) (s.currentDelayMs() * SERVER_ERROR_MULTIPLIER), config.maxDelayMs());
      return s.withDelay(delay, s.inBackoff() || delay > config.baseDelayMs()).withConsecutiveSuccesses(0);
    });
    if (state != null) {
      logger.fine("Server error from " + domain + ", delay raised to " + state.currentDelayMs() + "ms");
    }
  }

  /**
   * Classifies an HTTP response and records it: 429/503 back off (honouring
   * {@code Retry-After}), 403 feeds soft-limit detection, other 5xx apply a mild backoff,
   * 2xx/3xx count as success. Other 4xx leave the state unchanged.
   *
   * @param headers response headers; names are matched case-insensitively
   */
  public void recordResponse(String domain, String url, int status, Map<String, String> headers) {
    String retryAfterHeader = header(headers, "Retry-After");
    Duration retryAfter = parseRetryAfter(retryAfterHeader).orElse(null);
    if (isDefiniteRateLimit(status)) {
      recordRateLimit(domain, retryAfter);
    } else if (status == 403) {
      handle403(domain, url, retryAfterHeader != null, retryAfter);
    } else if (status >= 500) {
      recordServerError(domain);
    } else if (status >= 200 && status < 400) {
      recordSuccess(domain);
    } else {
      logger.fine("Client error " + status + " from " + domain + ", delay unchanged");
    }
  }

  /**
   * Returns statistics for every tracked domain, or an empty map if the backend is unavailable.
   */
  public Map<String, DomainStats> stats() {
    Map<String, DomainStats> stats = new LinkedHashMap<>();
    try {
      for (DomainRateState state : backend.snapshot()) {
        stats.put(state.domain(), DomainStats.of(state));
      }
    } catch (RateLimitBackendException e) {
      warnFallback("read statistics", "*", e);
    }
    return stats;
  }

  /**
   * Removes 403 records that fell out of the detection window.
   *
   * @return number of records removed
   */
  public int cleanupExpired403s() {
    try {
      return backend.cleanupExpired403s(clock.millis() - config.forbiddenWindow().toMillis());
    } catch (RateLimitBackendException e) {
      warnFallback("clean up 403 records", "*", e);
      return 0;
    }
  }

  /**
   * Parses a {@code Retry-After} header given in seconds or as an HTTP date, capped at
   * {@link RateLimitConfig#retryAfterCap()}.
   */
  public Optional<Duration> parseRetryAfter(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    Duration wait;
    try {
      long seconds = Long.parseLong(trimmed);
      if (seconds < 0) {
        return Optional.empty();
      }
      wait = Duration.ofSeconds(seconds);
    } catch (NumberFormatException e) {
      try {
        ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
        wait = Duration.between(clock.instant(), at.toInstant());
        if (wait.isNegative()) {
          wait = Duration.ZERO;
        }
      } catch (DateTimeParseException ignored) {
        return Optional.empty();
      }
    }
    return Optional.of(wait.compareTo(config.retryAfterCap()) > 0 ? config.retryAfterCap() : wait);
  }

  /**
   * Extracts the lower-cased host of {@code url}.
   */
  public static Optional<String> extractDomain(String url) {
    if (url == null || url.isEmpty()) {
      return Optional.empty();
    }
    try {
      String host = new URI(url.trim()).getHost();
      return host == null ? Optional.empty() : Optional.of(host.toLowerCase(Locale.ROOT));
    } catch (URISyntaxException e) {
      return Optional.empty();
    }
  }

  /** HTTP 429 and 503 always mean rate limiting. */
  public static boolean isDefiniteRateLimit(int status) {
    return status == 429 || status == 503;
  }

  /** 403 may mean rate limiting, depending on the pattern across URLs. */
  public static boolean isPossibleRateLimit(int status) {
    return isDefiniteRateLimit(status) || status == 403;
  }

  private boolean handle403(String domain, String url, boolean hasRetryAfter, Duration retryAfter) {
    long now = clock.millis();
    try {
      backend.record403(domain, url, now);
    } catch (RateLimitBackendException e) {
      warnFallback("record 403", domain, e);
    }
    if (forbiddenSeen.incrementAndGet() % CLEANUP_EVERY_403S == 0) {
      cleanupExpired403s();
    }

    int distinct = 0;
    if (!hasRetryAfter) {
      try {
        distinct = backend.count403(domain, now - config.forbiddenWindow().toMillis());
      } catch (RateLimitBackendException e) {
        warnFallback("count 403s", domain, e);
      }
    }
    if (hasRetryAfter || distinct >= config.forbiddenThreshold()) {
      logger.warning("403 pattern from " + domain + " (" + distinct + " distinct URLs"
          + (hasRetryAfter ? ", Retry-After present" : "") + ") treated as rate limiting");
      recordRateLimit(domain, retryAfter);
      return true;
    }
    update(domain, "record 403", s -> s.withConsecutiveSuccesses(0));
    logger.fine("403 from " + domain + " for " + url + " (" + distinct
        + " distinct URLs in window) treated as access denied");
    return false;
  }

  private void clear403s(String domain) {
    try {
      backend.clear403s(domain);
    } catch (RateLimitBackendException e) {
      warnFallback("clear 403s", domain, e);
    }
  }

  private DomainRateState update(String domain, String action, UnaryOperator<DomainRateState> mutation) {
    try {
      return backend.update(domain, config.baseDelayMs(), mutation);
    } catch (RateLimitBackendException e) {
      warnFallback(action, domain, e);
      return null;
    }
  }

  private void warnFallback(String action, String domain, RateLimitBackendException e) {
    logger.log(Level.WARNING, "Rate limit backend failed to " + action + " for " + domain
        + "; using base delay " + config.baseDelay().toMillis() + "ms", e);
  }

  private static String header(Map<String, String> headers, String name) {
    if (headers == null) {
      return null;
    }
    for (Map.Entry<String, String> e : headers.entrySet()) {
      if (e.getKey() != null && e.getKey().equalsIgnoreCase(name)) {
        return e.getValue();
      }
    }
    return null;
  }
}

package workpipe.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for {@link RateLimiter}.
 *
 * <p>Defaults: base 500ms, min 100ms, max 60s, backoff x2.0, recovery x0.8 after
 * 5 consecutive successes, soft-limit detection at 3 distinct-URL 403s within 30s,
 * {@code Retry-After} capped at 60s.
 *
 * <p>Create instances via {@link #builder()} or {@link #defaults()}.
 */
public final class RateLimitConfig {
  public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(500);
  public static final Duration DEFAULT_MIN_DELAY = Duration.ofMillis(100);
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
  public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;
  public static final double DEFAULT_RECOVERY_MULTIPLIER = 0.8;
  public static final int DEFAULT_RECOVERY_THRESHOLD = 5;
  public static final Duration DEFAULT_FORBIDDEN_WINDOW = Duration.ofSeconds(30);
  public static final int DEFAULT_FORBIDDEN_THRESHOLD = 3;
  public static final Duration DEFAULT_RETRY_AFTER_CAP = Duration.ofSeconds(60);

  private static final RateLimitConfig DEFAULTS = builder().build();

  private final Duration baseDelay;
  private final Duration minDelay;
  private final Duration maxDelay;
  private final double backoffMultiplier;
  private final double recoveryMultiplier;
  private final int recoveryThreshold;
  private final Duration forbiddenWindow;
  private final int forbiddenThreshold;
  private final Duration retryAfterCap;

  private RateLimitConfig(Builder builder) {
    this.baseDelay = Objects.requireNonNull(builder.baseDelay, "baseDelay");
    this.minDelay = Objects.requireNonNull(builder.minDelay, "minDelay");
    this.maxDelay = Objects.requireNonNull(builder.maxDelay, "maxDelay");
    this.forbiddenWindow = Objects.requireNonNull(builder.forbiddenWindow, "forbiddenWindow");
    this.retryAfterCap = Objects.requireNonNull(builder.retryAfterCap, "retryAfterCap");
    this.backoffMultiplier = builder.backoffMultiplier;
    this.recoveryMultiplier = builder.recoveryMultiplier;
    this.recoveryThreshold = builder.recoveryThreshold;
    this.forbiddenThreshold = builder.forbiddenThreshold;

    if (minDelay.isNegative()) {
      throw new IllegalArgumentException("minDelay must be >= 0");
    }
    if (minDelay.compareTo(baseDelay) > 0 || baseDelay.compareTo(maxDelay) > 0) {
      throw new IllegalArgumentException("Expected minDelay <= baseDelay <= maxDelay, got "
          + minDelay + ", " + baseDelay + ", " + maxDelay);
    }
    if (backoffMultiplier <= 1.0) {
      throw new IllegalArgumentException("backoffMultiplier must be > 1.0, got: " + backoffMultiplier);
    }
    if (recoveryMultiplier <= 0.0 || recoveryMultiplier >= 1.0) {
      throw new IllegalArgumentException("recoveryMultiplier must be in (0, 1), got: " + recoveryMultiplier);
    }
    if (recoveryThreshold < 1) {
      throw new IllegalArgumentException("recoveryThreshold must be >= 1, got: " + recoveryThreshold);
    }
    if (forbiddenThreshold < 1) {
      throw new IllegalArgumentException("forbiddenThreshold must be >= 1, got: " + forbiddenThreshold);
    }
    if (forbiddenWindow.isNegative() || forbiddenWindow.isZero()) {
      throw new IllegalArgumentException("forbiddenWindow must be > 0");
    }
    if (retryAfterCap.isNegative()) {
      throw new IllegalArgumentException("retryAfterCap must be >= 0");
    }
  }

  public static RateLimitConfig defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Duration baseDelay() {
    return baseDelay;
  }

  public Duration minDelay() {
    return minDelay;
  }

  public Duration maxDelay() {
    return maxDelay;
  }

  public double backoffMultiplier() {
    return backoffMultiplier;
  }

  public double recoveryMultiplier() {
    return recoveryMultiplier;
  }

  public int recoveryThreshold() {
    return recoveryThreshold;
  }

  public Duration forbiddenWindow() {
    return forbiddenWindow;
  }

  public int forbiddenThreshold() {
    return forbiddenThreshold;
  }

  public Duration retryAfterCap() {
    return retryAfterCap;
  }

  long baseDelayMs() {
    return baseDelay.toMillis();
  }

  long minDelayMs() {
    return minDelay.toMillis();
  }

  long maxDelayMs() {
    return maxDelay.toMillis();
  }

  long clampMs(long delayMs) {
    return Math.max(minDelayMs(), Math.min(delayMs, maxDelayMs()));
  }

  @Override
  public String toString() {
    return "RateLimitConfig{base=" + baseDelay + ", min=" + minDelay + ", max=" + maxDelay
        + ", backoff=" + backoffMultiplier + ", recovery=" + recoveryMultiplier
        + ", recoveryThreshold=" + recoveryThreshold + "}";
  }

  public static final class Builder {
    private Duration baseDelay = DEFAULT_BASE_DELAY;
    private Duration minDelay = DEFAULT_MIN_DELAY;
    private Duration maxDelay = DEFAULT_MAX_DELAY;
    private double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
    private double recoveryMultiplier = DEFAULT_RECOVERY_MULTIPLIER;
    private int recoveryThreshold = DEFAULT_RECOVERY_THRESHOLD;
    private Duration forbiddenWindow = DEFAULT_FORBIDDEN_WINDOW;
    private int forbiddenThreshold = DEFAULT_FORBIDDEN_THRESHOLD;
    private Duration retryAfterCap = DEFAULT_RETRY_AFTER_CAP;

    private Builder() {
    }

    public Builder baseDelay(Duration baseDelay) {
      this.baseDelay = baseDelay;
      return this;
    }

    public Builder minDelay(Duration minDelay) {
      this.minDelay = minDelay;
      return this;
    }

    public Builder maxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
      return this;
    }

    public Builder backoffMultiplier(double backoffMultiplier) {
      this.backoffMultiplier = backoffMultiplier;
      return this;
    }

    public Builder recoveryMultiplier(double recoveryMultiplier) {
      this.recoveryMultiplier = recoveryMultiplier;
      return this;
    }

    public Builder recoveryThreshold(int recoveryThreshold) {
      this.recoveryThreshold = recoveryThreshold;
      return this;
    }

    /** Sliding window for counting distinct-URL 403 responses. */
    public Builder forbiddenWindow(Duration forbiddenWindow) {
      this.forbiddenWindow = forbiddenWindow;
      return this;
    }

    /** Distinct-URL 403 responses within the window that count as a rate limit. */
    public Builder forbiddenThreshold(int forbiddenThreshold) {
      this.forbiddenThreshold = forbiddenThreshold;
      return this;
    }

    public Builder retryAfterCap(Duration retryAfterCap) {
      this.retryAfterCap = retryAfterCap;
      return this;
    }

    public RateLimitConfig build() {
      return new RateLimitConfig(this);
    }
  }
}

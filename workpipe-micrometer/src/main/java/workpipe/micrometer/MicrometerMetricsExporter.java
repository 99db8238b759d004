package workpipe.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import workpipe.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Per-stage and per-domain meters are registered lazily the first time a stage or domain
 * reports, tagged with {@code stage} or {@code domain}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code workpipe.items.succeeded} (tag {@code stage}): items processed and completed</li>
 *   <li>{@code workpipe.items.failed} (tag {@code stage}): items whose processing failed</li>
 *   <li>{@code workpipe.items.skipped} (tag {@code stage}): items skipped or lost to another worker</li>
 *   <li>{@code workpipe.events.dropped}: progress events dropped by a full event channel</li>
 *   <li>{@code workpipe.ratelimit.hits} (tag {@code domain}): rate-limit signals observed</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code workpipe.stage.backlog} (tag {@code stage}): claimable items left after a stage ran</li>
 *   <li>{@code workpipe.ratelimit.delay.ms} (tag {@code domain}): current delay between requests</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter eventsDropped;
  private final Map<String, Counter> succeeded = new ConcurrentHashMap<>();
  private final Map<String, Counter> failed = new ConcurrentHashMap<>();
  private final Map<String, Counter> skipped = new ConcurrentHashMap<>();
  private final Map<String, Counter> rateLimitHits = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong> backlogs = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong> delays = new ConcurrentHashMap<>();
  private final List<Meter> gauges = new ArrayList<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "workpipe"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "workpipe");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several pipelines in one registry.
   *
   * @param namePrefix prefix for all meter names (e.g. {@code "ocr.workpipe"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.eventsDropped = Counter.builder(namePrefix + ".events.dropped")
        .description("Progress events dropped because the event channel was full")
        .register(registry);
  }

  @Override
  public void incrementItemSucceeded(String stage) {
    if (closed) return;
    counter(succeeded, ".items.succeeded", "stage", stage, "Items processed and completed").increment();
  }

  @Override
  public void incrementItemFailed(String stage) {
    if (closed) return;
    counter(failed, ".items.failed", "stage", stage, "Items whose processing failed").increment();
  }

  @Override
  public void incrementItemSkipped(String stage) {
    if (closed) return;
    counter(skipped, ".items.skipped", "stage", stage, "Items skipped or claimed by another worker").increment();
  }

  @Override
  public void incrementEventsDropped() {
    if (closed) return;
    eventsDropped.increment();
  }

  @Override
  public void recordBacklog(String stage, long backlog) {
    if (closed) return;
    gauge(backlogs, ".stage.backlog", "stage", stage, "Claimable items left for the stage").set(backlog);
  }

  @Override
  public void incrementRateLimitHit(String domain) {
    if (closed) return;
    counter(rateLimitHits, ".ratelimit.hits", "domain", domain, "Rate-limit signals observed").increment();
  }

  @Override
  public void recordDomainDelayMs(String domain, long delayMs) {
    if (closed) return;
    gauge(delays, ".ratelimit.delay.ms", "domain", domain, "Current delay between requests").set(delayMs);
  }

  private Counter counter(Map<String, Counter> counters, String suffix, String tag, String value,
      String description) {
    return counters.computeIfAbsent(value, v -> Counter.builder(namePrefix + suffix)
        .description(description)
        .tag(tag, v)
        .register(registry));
  }

  private AtomicLong gauge(Map<String, AtomicLong> values, String suffix, String tag, String value,
      String description) {
    return values.computeIfAbsent(value, v -> {
      AtomicLong holder = new AtomicLong();
      Gauge gauge = Gauge.builder(namePrefix + suffix, holder, AtomicLong::get)
          .description(description)
          .tag(tag, v)
          .register(registry);
      synchronized (gauges) {
        gauges.add(gauge);
      }
      return holder;
    });
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>();
    meters.add(eventsDropped);
    meters.addAll(succeeded.values());
    meters.addAll(failed.values());
    meters.addAll(skipped.values());
    meters.addAll(rateLimitHits.values());
    synchronized (gauges) {
      meters.addAll(gauges);
    }
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}

package workpipe.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import workpipe.ratelimit.InMemoryRateLimitBackend;
import workpipe.ratelimit.RateLimitConfig;
import workpipe.ratelimit.RateLimiter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void itemCountersAreTaggedByStage() {
    exporter.incrementItemSucceeded("ocr");
    exporter.incrementItemSucceeded("ocr");
    exporter.incrementItemSucceeded("summarize");
    exporter.incrementItemFailed("ocr");
    exporter.incrementItemSkipped("summarize");

    assertEquals(2.0, counter("workpipe.items.succeeded", "stage", "ocr").count());
    assertEquals(1.0, counter("workpipe.items.succeeded", "stage", "summarize").count());
    assertEquals(1.0, counter("workpipe.items.failed", "stage", "ocr").count());
    assertEquals(1.0, counter("workpipe.items.skipped", "stage", "summarize").count());
  }

  @Test
  void droppedEventsCounterExistsUpFront() {
    assertEquals(0.0, registry.get("workpipe.events.dropped").counter().count());

    exporter.incrementEventsDropped();

    assertEquals(1.0, registry.get("workpipe.events.dropped").counter().count());
  }

  @Test
  void backlogGaugeFollowsLatestValue() {
    exporter.recordBacklog("ocr", 120);
    assertEquals(120.0, gauge("workpipe.stage.backlog", "stage", "ocr").value());

    exporter.recordBacklog("ocr", 0);
    assertEquals(0.0, gauge("workpipe.stage.backlog", "stage", "ocr").value());
  }

  @Test
  void rateLimiterReportsHitsAndDelay() {
    RateLimiter limiter = new RateLimiter(new InMemoryRateLimitBackend(), RateLimitConfig.defaults(),
        Clock.systemUTC(), exporter);

    limiter.recordRateLimit("example.com", null);
    limiter.recordRateLimit("example.com", Duration.ofSeconds(5));

    assertEquals(2.0, counter("workpipe.ratelimit.hits", "domain", "example.com").count());
    assertEquals(5000.0, gauge("workpipe.ratelimit.delay.ms", "domain", "example.com").value());
  }

  @Test
  void customNamePrefix() {
    MicrometerMetricsExporter custom = new MicrometerMetricsExporter(registry, "ocr.workpipe");
    custom.incrementItemFailed("ocr");
    custom.recordDomainDelayMs("example.com", 750);

    assertEquals(1.0, counter("ocr.workpipe.items.failed", "stage", "ocr").count());
    assertEquals(750.0, gauge("ocr.workpipe.ratelimit.delay.ms", "domain", "example.com").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementItemSucceeded("ocr");
    exporter.recordBacklog("ocr", 3);
    exporter.incrementRateLimitHit("example.com");

    exporter.close();
    exporter.incrementItemSucceeded("ocr");
    exporter.recordBacklog("index", 1);

    assertTrue(registry.getMeters().isEmpty());
  }

  @Test
  void rejectsInvalidPrefix() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "workpipe."));
  }

  private Counter counter(String name, String tag, String value) {
    Counter c = registry.find(name).tag(tag, value).counter();
    assertNotNull(c, "Counter not found: " + name + "{" + tag + "=" + value + "}");
    return c;
  }

  private Gauge gauge(String name, String tag, String value) {
    Gauge g = registry.find(name).tag(tag, value).gauge();
    assertNotNull(g, "Gauge not found: " + name + "{" + tag + "=" + value + "}");
    return g;
  }
}

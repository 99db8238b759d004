package workpipe.pipeline;

import workpipe.spi.MetricsExporter;
import workpipe.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded, non-blocking delivery of {@link PipelineEvent}s to a single listener.
 *
 * <p>Producers {@link #emit} into a fixed-capacity queue, waiting at most
 * {@code offerTimeoutMs} for space; when the queue stays full the event is dropped and
 * counted. One daemon thread delivers queued events to the listener in order. A listener
 * exception is logged and does not stop delivery.
 *
 * <p>Create instances via {@link #builder()}; delivery starts immediately.
 * {@link #close()} stops accepting events and drains what is queued within the drain timeout.
 */
public final class EventChannel implements EventSink, AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventChannel.class.getName());
  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  public static final int DEFAULT_CAPACITY = 1024;
  public static final long DEFAULT_OFFER_TIMEOUT_MS = 10;

  private final PipelineEventListener listener;
  private final BlockingQueue<PipelineEvent> queue;
  private final long offerTimeoutMs;
  private final long drainTimeoutMs;
  private final MetricsExporter metrics;
  private final ExecutorService deliveryThread;
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicLong dropped = new AtomicLong();

  private EventChannel(Builder builder) {
    this.listener = Objects.requireNonNull(builder.listener, "listener");
    if (builder.capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    if (builder.offerTimeoutMs < 0) {
      throw new IllegalArgumentException("offerTimeoutMs must be >= 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.queue = new ArrayBlockingQueue<>(builder.capacity);
    this.offerTimeoutMs = builder.offerTimeoutMs;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.deliveryThread = Executors.newSingleThreadExecutor(new DaemonThreadFactory("events"));
    deliveryThread.submit(this::deliveryLoop);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Queues an event for delivery, dropping it if the channel stays full for the offer
   * timeout or is closed.
   */
  @Override
  public void emit(PipelineEvent event) {
    Objects.requireNonNull(event, "event");
    boolean queued = false;
    if (accepting.get()) {
      try {
        queued = queue.offer(event, offerTimeoutMs, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    if (!queued) {
      long count = dropped.incrementAndGet();
      metrics.incrementEventsDropped();
      if (count == 1 || count % 1000 == 0) {
        logger.warning("Event channel full or closed; dropped " + count + " events so far");
      }
    }
  }

  /** Number of events dropped since creation. */
  public long droppedCount() {
    return dropped.get();
  }

  /** Number of events waiting for delivery. */
  public int pending() {
    return queue.size();
  }

  private void deliveryLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        PipelineEvent event = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (event == null) {
          if (!running.get()) break;
          continue;
        }
        listener.onEvent(event);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.WARNING, "Pipeline event listener failed", t);
      }
    }
  }

  /**
   * Stops accepting events and delivers what is queued within the drain timeout.
   */
  @Override
  public void close() {
    accepting.set(false);
    running.set(false);
    deliveryThread.shutdown();
    try {
      if (!deliveryThread.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Event drain timeout exceeded; discarding " + queue.size() + " events");
        deliveryThread.shutdownNow();
      }
    } catch (InterruptedException e) {
      deliveryThread.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link EventChannel}. */
  public static final class Builder {
    private PipelineEventListener listener;
    private int capacity = DEFAULT_CAPACITY;
    private long offerTimeoutMs = DEFAULT_OFFER_TIMEOUT_MS;
    private long drainTimeoutMs = 2000;
    private MetricsExporter metrics;

    private Builder() {
    }

    public Builder listener(PipelineEventListener listener) {
      this.listener = listener;
      return this;
    }

    /** Maximum number of queued events. */
    public Builder capacity(int capacity) {
      this.capacity = capacity;
      return this;
    }

    /** How long {@link EventChannel#emit} waits for space before dropping. */
    public Builder offerTimeoutMs(long offerTimeoutMs) {
      this.offerTimeoutMs = offerTimeoutMs;
      return this;
    }

    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public EventChannel build() {
      return new EventChannel(this);
    }
  }
}

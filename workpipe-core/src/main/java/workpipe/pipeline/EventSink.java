package workpipe.pipeline;

/**
 * Receives progress events from stages. Implementations must not block for long:
 * {@link EventChannel} drops events rather than stall processing.
 */
@FunctionalInterface
public interface EventSink {

    /**
     * Sink that discards all events.
     */
    EventSink NOOP = event -> { };

    void emit(PipelineEvent event);
}

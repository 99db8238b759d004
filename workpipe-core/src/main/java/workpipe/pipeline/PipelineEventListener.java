package workpipe.pipeline;

/**
 * Consumer of progress events, called on the {@link EventChannel}'s delivery thread.
 */
@FunctionalInterface
public interface PipelineEventListener {

    void onEvent(PipelineEvent event);
}

/**
 * Multi-stage pipeline execution.
 *
 * <p>{@link workpipe.pipeline.PipelineStage}s are driven by
 * {@link workpipe.pipeline.PipelineRunner} under an
 * {@link workpipe.pipeline.ExecutionStrategy}; progress flows as
 * {@link workpipe.pipeline.PipelineEvent}s, usually through a bounded
 * {@link workpipe.pipeline.EventChannel}.
 */
package workpipe.pipeline;

package workpipe.pipeline;

/**
 * Thrown from {@link AbstractWorkQueueStage#process} when an item needs no work.
 * The claim is completed and the item counts as skipped.
 */
public class SkipItemException extends Exception {

    public SkipItemException(String reason) {
        super(reason);
    }
}

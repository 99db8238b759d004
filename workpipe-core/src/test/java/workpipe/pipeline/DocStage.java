package workpipe.pipeline;

import workpipe.queue.Doc;
import workpipe.queue.WorkFilter;
import workpipe.queue.WorkQueue;

import java.time.Duration;

/**
 * Configurable stage over {@link Doc}s for pipeline tests.
 */
class DocStage extends AbstractWorkQueueStage<Doc> {

    @FunctionalInterface
    interface Processor {
        String process(Doc doc) throws Exception;
    }

    private final Processor processor;
    private boolean deferred;
    private int concurrency = 1;
    private Duration itemTimeout = DEFAULT_ITEM_TIMEOUT;

    DocStage(String name, WorkQueue<Doc> queue, WorkFilter filter, Processor processor) {
        super(name, queue, filter);
        this.processor = processor;
    }

    DocStage deferred() {
        this.deferred = true;
        return this;
    }

    DocStage concurrency(int concurrency) {
        this.concurrency = concurrency;
        return this;
    }

    DocStage itemTimeout(Duration itemTimeout) {
        this.itemTimeout = itemTimeout;
        return this;
    }

    @Override
    protected String process(Doc item) throws Exception {
        return processor.process(item);
    }

    @Override
    protected String itemId(Doc item) {
        return item.id();
    }

    @Override
    public boolean isDeferred() {
        return deferred;
    }

    @Override
    protected int concurrency() {
        return concurrency;
    }

    @Override
    protected Duration itemTimeout() {
        return itemTimeout;
    }
}

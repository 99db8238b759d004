package workpipe.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the daemon threads behind stage pools, deferred-stage consumers, event delivery
 * and the runner schedule, named {@code workpipe-<role>-<n>}.
 *
 * <p>An exception that escapes a worker is logged instead of going to stderr.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private static final Thread.UncaughtExceptionHandler LOG_UNCAUGHT = (thread, error) ->
            logger.log(Level.SEVERE, "Uncaught exception in " + thread.getName(), error);

    private final String namePrefix;
    private final AtomicInteger created = new AtomicInteger();

    /**
     * @param role short label for what the threads do, e.g. {@code events} or {@code stage-ocr}
     */
    public DaemonThreadFactory(String role) {
        Objects.requireNonNull(role, "role");
        if (role.isBlank()) {
            throw new IllegalArgumentException("role must not be blank");
        }
        this.namePrefix = "workpipe-" + role + "-";
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread worker = new Thread(task, namePrefix + created.incrementAndGet());
        worker.setDaemon(true);
        worker.setUncaughtExceptionHandler(LOG_UNCAUGHT);
        return worker;
    }
}

package workpipe.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsDaemonThreadsNamedByRole() {
        DaemonThreadFactory factory = new DaemonThreadFactory("stage-ocr");

        Thread first = factory.newThread(() -> {
        });
        Thread second = factory.newThread(() -> {
        });

        assertTrue(first.isDaemon());
        assertEquals("workpipe-stage-ocr-1", first.getName());
        assertEquals("workpipe-stage-ocr-2", second.getName());
    }

    @Test
    void countsPerFactory() {
        new DaemonThreadFactory("deferred").newThread(() -> {
        });

        Thread events = new DaemonThreadFactory("events").newThread(() -> {
        });

        assertEquals("workpipe-events-1", events.getName());
    }

    @Test
    void uncaughtExceptionsAreLogged() throws InterruptedException {
        Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());
        List<LogRecord> records = new CopyOnWriteArrayList<>();
        Handler capture = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        logger.addHandler(capture);
        try {
            Thread worker = new DaemonThreadFactory("runner").newThread(() -> {
                throw new IllegalStateException("boom");
            });
            worker.start();
            worker.join(5_000);

            assertEquals(1, records.size());
            assertEquals(Level.SEVERE, records.get(0).getLevel());
            assertEquals("boom", records.get(0).getThrown().getMessage());
        } finally {
            logger.removeHandler(capture);
        }
    }

    @Test
    void rejectsMissingRole() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
        assertThrows(IllegalArgumentException.class, () -> new DaemonThreadFactory(" "));
    }
}

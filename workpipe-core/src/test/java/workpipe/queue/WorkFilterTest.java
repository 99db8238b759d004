package workpipe.queue;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class WorkFilterTest {

    @Test
    void defaultsVersionAndRetryInterval() {
        WorkFilter filter = WorkFilter.of("ocr");

        assertEquals("ocr", filter.workType());
        assertEquals(1, filter.version());
        assertEquals(12, filter.retryIntervalHours());
        assertEquals(Duration.ofHours(12), filter.retryInterval());
        assertNull(filter.sourceId());
        assertNull(filter.mimeType());
        assertNull(filter.prerequisite());
    }

    @Test
    void withersReturnNewFilters() {
        WorkFilter base = WorkFilter.of("annotate:summary");
        WorkFilter narrowed = base.withSourceId("fbi-vault").withMimeType("application/pdf").withVersion(3);

        assertNull(base.sourceId());
        assertEquals("fbi-vault", narrowed.sourceId());
        assertEquals("application/pdf", narrowed.mimeType());
        assertEquals(3, narrowed.version());
        assertEquals("annotate:summary", narrowed.workType());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(NullPointerException.class, () -> WorkFilter.of(null));
        assertThrows(IllegalArgumentException.class, () -> WorkFilter.of(" "));
        assertThrows(IllegalArgumentException.class, () -> WorkFilter.of("ocr").withVersion(0));
        assertThrows(IllegalArgumentException.class, () -> WorkFilter.of("ocr").withRetryIntervalHours(-1));
    }
}

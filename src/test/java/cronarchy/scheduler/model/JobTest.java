package cronarchy.scheduler.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobTest {

    @Test
    void builderTruncatesDueTimeToSeconds() {
        Job job = Job.builder()
                .dueAt(Instant.ofEpochSecond(100, 999_000_000))
                .hook("h")
                .build();

        assertEquals(Instant.ofEpochSecond(100), job.dueAt());
        assertEquals(List.of(), job.args());
    }

    @Test
    void argsAreCopiedAndReadOnly() {
        List<Object> args = new ArrayList<>(List.of(1));
        Job job = Job.builder().dueAt(Instant.EPOCH).hook("h").args(args).build();
        args.add(2);

        assertEquals(List.of(1), job.args());
        assertThrows(UnsupportedOperationException.class, () -> job.args().add(3));
    }

    @Test
    void recurrenceOnlyWhenPositive() {
        Job.Builder b = Job.builder().dueAt(Instant.EPOCH).hook("h");

        assertFalse(b.recurrence(null).build().isRecurring());
        assertFalse(b.recurrence(0L).build().isRecurring());
        assertTrue(b.recurrence(60L).build().isRecurring());
    }

    @Test
    void hookIsRequired() {
        assertThrows(NullPointerException.class, () -> Job.builder().dueAt(Instant.EPOCH).build());
    }
}

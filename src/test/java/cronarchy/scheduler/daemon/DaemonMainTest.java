package cronarchy.scheduler.daemon;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DaemonMainTest {

    @Test
    void cleanOutcomesExitWithZero() {
        assertEquals(0, DaemonMain.exitCode(DaemonOutcome.COMPLETED));
        assertEquals(0, DaemonMain.exitCode(DaemonOutcome.CHAINED));
        assertEquals(0, DaemonMain.exitCode(DaemonOutcome.NOT_AUTHORIZED));
    }

    @Test
    void failedOutcomesExitWithOne() {
        assertEquals(1, DaemonMain.exitCode(DaemonOutcome.TIMED_OUT));
        assertEquals(1, DaemonMain.exitCode(DaemonOutcome.ABORTED));
        assertEquals(1, DaemonMain.exitCode(DaemonOutcome.FAILED));
    }
}

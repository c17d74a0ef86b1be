package cronarchy.scheduler.model;

/**
 * Persisted state of a runner. Codes are stored as integers and ordered:
 * a later state in a run cycle always has a higher code.
 */
public enum RunnerState {
    /** Not running; clean finish or never run */
    STOPPED(0),
    /** Rest state equivalent to STOPPED */
    IDLE(1),
    /** Trigger fired, daemon request in flight */
    QUEUED(2),
    /** Daemon accepted the run and is about to execute jobs */
    PREPARING(3),
    /** Jobs are being executed */
    RUNNING(4);

    private final int code;

    RunnerState(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isAtRest() {
        return this == STOPPED || this == IDLE;
    }

    public boolean isBefore(RunnerState other) {
        return code < other.code;
    }

    public boolean isAfter(RunnerState other) {
        return code > other.code;
    }

    /**
     * Resolve a stored code. Unknown codes fall back to STOPPED so a corrupt
     * option never blocks the gate forever.
     */
    public static RunnerState fromCode(int code) {
        for (RunnerState state : values()) {
            if (state.code == code) {
                return state;
            }
        }
        return STOPPED;
    }
}

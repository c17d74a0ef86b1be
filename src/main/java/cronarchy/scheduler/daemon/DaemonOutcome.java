package cronarchy.scheduler.daemon;

/**
 * How a daemon invocation ended.
 */
public enum DaemonOutcome {
    /** Jobs run, runner back at rest */
    COMPLETED,
    /** Jobs run, next cycle triggered (self-pinging) */
    CHAINED,
    /** Runner was at rest: the invocation was not authorized */
    NOT_AUTHORIZED,
    /** A handler outlived maxJobRunTime; remaining jobs left due, runner reset */
    TIMED_OUT,
    /** Environment or instance missing */
    ABORTED,
    /** Ended by an unexpected error; the recovery hook reset the runner */
    FAILED
}

package cronarchy.scheduler.daemon;

import cronarchy.scheduler.model.Job;
import cronarchy.scheduler.runner.Runner;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Puts the runner back to rest on every exit path of a daemon run that did
 * not finish cleanly: exceptions, errors, and (with a shutdown hook) JVM
 * termination by signal. A run that finishes cleanly disarms it.
 */
final class RecoveryGuard implements AutoCloseable {

    private final DaemonLog log;
    private final AtomicBoolean done = new AtomicBoolean();
    private volatile Runner runner;
    private volatile Job currentJob;
    private volatile boolean armed = true;
    private Thread shutdownHook;

    RecoveryGuard(DaemonLog log) {
        this.log = log;
    }

    /**
     * Also recover when the JVM is terminated while the run is in progress.
     */
    RecoveryGuard withShutdownHook() {
        shutdownHook = new Thread(this::recover, "cronarchy-daemon-recovery");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        return this;
    }

    void attach(Runner runner) {
        this.runner = runner;
    }

    void currentJob(Job job) {
        this.currentJob = job;
    }

    void disarm() {
        armed = false;
    }

    boolean isArmed() {
        return armed;
    }

    @Override
    public void close() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                // JVM already shutting down; the hook runs recover() itself
                log.line("Shutdown in progress, recovery left to the shutdown hook");
            }
        }
        recover();
    }

    void recover() {
        if (!armed || !done.compareAndSet(false, true)) {
            return;
        }

        log.reset();
        Job job = currentJob;
        if (job != null) {
            log.enter("Daemon ended unexpectedly while running a job");
            log.line("Job ID: " + job.id());
            log.line("Job hook: " + job.hook());
            log.line("Job due at: " + job.dueAt());
            log.line("Job recurrence: " + job.recurrence());
            log.exit();
        }

        Runner r = runner;
        if (r != null) {
            try {
                r.rest();
                log.line("Runner state reset to STOPPED");
            } catch (RuntimeException e) {
                log.error("Could not reset runner state", e);
            }
        }
        log.line("Exiting ...");
    }
}

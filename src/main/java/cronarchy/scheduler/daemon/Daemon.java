package cronarchy.scheduler.daemon;

import cronarchy.scheduler.Cronarchy;
import cronarchy.scheduler.Instances;
import cronarchy.scheduler.config.SchedulerConfig;
import cronarchy.scheduler.exceptions.EnvironmentNotFoundException;
import cronarchy.scheduler.exceptions.InstanceNotFoundException;
import cronarchy.scheduler.hook.HookDispatcher;
import cronarchy.scheduler.model.Job;
import cronarchy.scheduler.model.RunnerState;
import cronarchy.scheduler.runner.Runner;
import cronarchy.scheduler.service.JobManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One daemon invocation for one scheduler instance.
 *
 * <p>A run:
 * <ol>
 * <li>locates and loads the environment, then looks up the instance</li>
 * <li>re-validates the runner state; a runner at rest means the run was not authorized</li>
 * <li>runs every pending job in order, one at a time, each bounded by {@code maxJobRunTime}</li>
 * <li>reschedules recurring jobs and deletes the rows that ran</li>
 * <li>rests the runner, or re-arms and triggers the next cycle when self-pinging</li>
 * </ol>
 *
 * Every exit path that does not reach the last step puts the runner back to rest
 * through a {@link RecoveryGuard}.
 *
 * <p>A handler that outlives {@code maxJobRunTime} may not stop when it is
 * cancelled, so a timeout ends the run: no further job is started and the
 * timed-out row and the rest of the batch stay due.
 */
public class Daemon {

    private static final Logger log = LoggerFactory.getLogger(Daemon.class);

    private final String instanceId;
    private final Path callerDir;
    private final SchedulerConfig bootstrapConfig;
    private final EnvironmentLoader loader;
    private final Clock clock;
    private boolean shutdownHook;
    private volatile CompletableFuture<Void> nextCycle = CompletableFuture.completedFuture(null);

    public Daemon(String instanceId, Path callerDir, SchedulerConfig bootstrapConfig,
            EnvironmentLoader loader, Clock clock) {
        this.instanceId = instanceId;
        this.callerDir = callerDir;
        this.bootstrapConfig = bootstrapConfig;
        this.loader = loader;
        this.clock = clock;
    }

    /**
     * Daemon for an instance set up in this process, e.g. by the HTTP server.
     * The environment is already loaded, so only the instance lookup is done.
     */
    public static Daemon inProcess(String instanceId, SchedulerConfig config, Clock clock) {
        return new Daemon(instanceId, null, config, null, clock);
    }

    /**
     * Also recover the runner when the JVM is terminated during the run.
     * Used by the standalone entry point.
     */
    public Daemon withShutdownHook() {
        this.shutdownHook = true;
        return this;
    }

    public DaemonOutcome run() {
        DaemonLog transcript = DaemonLog.open(
                instanceId, bootstrapConfig.loggingEnabled(), bootstrapConfig.logFilePath());
        transcript.line("Daemon started for instance " + instanceId);

        ExecutorService jobExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "cronarchy-job-" + instanceId);
            t.setDaemon(true);
            return t;
        });

        RecoveryGuard guard = new RecoveryGuard(transcript);
        if (shutdownHook) {
            guard.withShutdownHook();
        }

        try (guard) {
            return execute(guard, transcript, jobExecutor);
        } catch (EnvironmentNotFoundException | InstanceNotFoundException e) {
            transcript.reset();
            transcript.line(e.getMessage());
            log.warn("Daemon aborted for {}: {}", instanceId, e.getMessage());
            return DaemonOutcome.ABORTED;
        } catch (RuntimeException e) {
            transcript.error("Daemon failed: " + e.getMessage(), e);
            log.error("Daemon run failed for {}", instanceId, e);
            return DaemonOutcome.FAILED;
        } finally {
            jobExecutor.shutdownNow();
        }
    }

    private DaemonOutcome execute(RecoveryGuard guard, DaemonLog transcript, ExecutorService jobExecutor) {
        Cronarchy instance = loadInstance(transcript);
        Runner runner = instance.runner();
        guard.attach(runner);

        RunnerState state = runner.getState();
        if (state.isAtRest()) {
            transcript.line("Runner is " + state + ", run not authorized");
            guard.disarm();
            return DaemonOutcome.NOT_AUTHORIZED;
        }

        runner.setState(RunnerState.PREPARING);
        Instant deadline = clock.instant().plus(runner.getMaxTotalRunTime());
        runner.setState(RunnerState.RUNNING);

        transcript.enter("Getting pending jobs");
        List<Job> jobs = instance.manager().getPendingJobs();
        transcript.exit(jobs.size() + " pending job(s)");

        if (!jobs.isEmpty() && !runJobs(instance, jobs, deadline, guard, transcript, jobExecutor)) {
            // guard stays armed: it logs the job and rests the runner
            return DaemonOutcome.TIMED_OUT;
        }

        return finish(runner, guard, transcript);
    }

    private Cronarchy loadInstance(DaemonLog transcript) {
        if (callerDir != null) {
            loadEnvironment(transcript);
        }

        Optional<Cronarchy> instance = Instances.lookup(instanceId);
        if (instance.isEmpty()) {
            throw new InstanceNotFoundException(instanceId);
        }
        return instance.get();
    }

    private void loadEnvironment(DaemonLog transcript) {
        transcript.enter("Locating environment");
        EnvironmentLocator locator = new EnvironmentLocator(bootstrapConfig.maxDirSearch());
        Path entryFile = locator.locate(callerDir, transcript)
                .orElseThrow(() -> new EnvironmentNotFoundException(callerDir, locator.maxLevels()));
        transcript.exit();

        transcript.enter("Loading environment");
        try {
            loader.load(entryFile);
        } catch (IOException e) {
            throw new EnvironmentNotFoundException("Could not load environment " + entryFile, e);
        }
        transcript.exit("Environment loaded");
    }

    /**
     * @return false if a handler timed out and the run has to end
     */
    private boolean runJobs(Cronarchy instance, List<Job> jobs, Instant deadline, RecoveryGuard guard,
            DaemonLog transcript, ExecutorService jobExecutor) {
        JobManager manager = instance.manager();
        Duration jobTimeout = instance.runner().getMaxJobRunTime();
        boolean retainFailed = instance.config().retainFailedJobs();

        transcript.enter("Running jobs");
        int done = 0;
        for (Job job : jobs) {
            if (!clock.instant().isBefore(deadline)) {
                transcript.line("Run time budget spent, " + (jobs.size() - done) + " job(s) left for the next run");
                break;
            }
            if (Thread.currentThread().isInterrupted()) {
                transcript.line("Interrupted, " + (jobs.size() - done) + " job(s) left for the next run");
                break;
            }

            guard.currentJob(job);
            transcript.enter("Job " + job.id() + " (" + job.hook() + ")");

            JobResult result = executeJob(instance.dispatcher(), job, jobTimeout, transcript, jobExecutor);
            if (result == JobResult.TIMED_OUT) {
                transcript.exit((jobs.size() - done) + " job(s) left for the next run");
                transcript.exit("Run ended by job timeout");
                log.warn("Job {} ({}) of {} timed out after {}s, run ended", job.id(), job.hook(), instanceId,
                        jobTimeout.toSeconds());
                return false;
            }
            if (result == JobResult.FAILED && retainFailed) {
                transcript.exit("Retained for retry");
            } else {
                completeJob(manager, job, transcript);
                transcript.exit();
            }

            guard.currentJob(null);
            done++;
        }
        transcript.exit("Done");
        return true;
    }

    private enum JobResult {
        SUCCEEDED,
        FAILED,
        TIMED_OUT
    }

    private JobResult executeJob(HookDispatcher dispatcher, Job job, Duration timeout, DaemonLog transcript,
            ExecutorService jobExecutor) {
        Future<?> execution = jobExecutor.submit(() -> {
            dispatcher.invoke(job.hook(), job.args());
            return null;
        });

        try {
            execution.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            transcript.line("Completed");
            return JobResult.SUCCEEDED;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            transcript.error("Handler failed: " + cause.getMessage(), cause);
            return JobResult.FAILED;
        } catch (TimeoutException e) {
            execution.cancel(true);
            transcript.line("Handler timed out after " + timeout.toSeconds() + "s, cancelled");
            return JobResult.TIMED_OUT;
        } catch (InterruptedException e) {
            execution.cancel(true);
            Thread.currentThread().interrupt();
            transcript.line("Interrupted while running job " + job.id());
            return JobResult.FAILED;
        }
    }

    private void completeJob(JobManager manager, Job job, DaemonLog transcript) {
        try {
            manager.scheduleJobRecurrence(job.id())
                    .ifPresent(next -> transcript.line("Next occurrence " + next.id() + " due at " + next.dueAt()));
        } catch (RuntimeException e) {
            transcript.error("Could not schedule recurrence of job " + job.id(), e);
            log.warn("Recurrence of job {} failed: {}", job.id(), e.getMessage());
        }

        try {
            manager.deleteJobs(List.of(job.id()));
            transcript.line("Deleted");
        } catch (RuntimeException e) {
            transcript.error("Could not delete job " + job.id(), e);
            log.warn("Deletion of job {} failed: {}", job.id(), e.getMessage());
        }
    }

    private DaemonOutcome finish(Runner runner, RecoveryGuard guard, DaemonLog transcript) {
        if (!runner.isSelfPinging()) {
            runner.rest();
            guard.disarm();
            transcript.line("Runner at rest");
            return DaemonOutcome.COMPLETED;
        }

        runner.setState(RunnerState.PREPARING);
        transcript.line("Sleeping " + runner.getRunInterval().toSeconds() + "s before the next cycle");
        try {
            Thread.sleep(runner.getRunInterval().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            transcript.line("Interrupted while sleeping, next cycle not triggered");
            return DaemonOutcome.COMPLETED;
        }

        guard.disarm();
        runner.selfTrigger();
        nextCycle = runner.lastTrigger();
        transcript.line("Next cycle triggered");
        return DaemonOutcome.CHAINED;
    }

    /**
     * Wait until the request starting the next cycle has gone out. Only a
     * {@link DaemonOutcome#CHAINED} run has one; otherwise returns at once.
     *
     * @return false if the request was still pending after {@code timeout}
     */
    public boolean awaitNextCycle(Duration timeout) {
        try {
            nextCycle.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("Trigger of the next cycle for {} still pending after {}ms", instanceId, timeout.toMillis());
            return false;
        } catch (ExecutionException e) {
            log.warn("Trigger of the next cycle for {} failed: {}", instanceId, e.getCause().toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

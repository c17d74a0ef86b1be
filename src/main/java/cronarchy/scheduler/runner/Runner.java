package cronarchy.scheduler.runner;

import cronarchy.scheduler.config.SchedulerConfig;
import cronarchy.scheduler.model.RunnerState;
import cronarchy.scheduler.repository.OptionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Owns the persisted run state of one scheduler instance and starts daemon
 * runs through its {@link DaemonTrigger} when the gate allows it.
 *
 * <p>State lives in the option store under {@code <instance>_cronarchy_*}
 * names, so several instances can share one store.
 */
public class Runner {

    private static final Logger log = LoggerFactory.getLogger(Runner.class);

    static final String STATE_OPTION_SUFFIX = "cronarchy_state";
    static final String LAST_STATE_CHANGE_OPTION_SUFFIX = "cronarchy_last_state_change";
    static final String LAST_RUN_OPTION_SUFFIX = "cronarchy_last_run";

    private final OptionStore options;
    private final DaemonTrigger trigger;
    private final Clock clock;
    private final String instanceId;
    private final String optionPrefix;
    private final Duration runInterval;
    private final Duration maxJobRunTime;
    private final Duration maxTotalRunTime;
    private final boolean selfPinging;
    private volatile CompletableFuture<Void> lastTrigger = CompletableFuture.completedFuture(null);

    public Runner(OptionStore options, DaemonTrigger trigger, SchedulerConfig config, Clock clock) {
        this.options = options;
        this.trigger = trigger;
        this.clock = clock;
        this.instanceId = config.instanceId();
        this.optionPrefix = config.optionPrefix();
        this.runInterval = config.runInterval();
        this.maxJobRunTime = config.maxJobRunTime();
        this.maxTotalRunTime = config.maxTotalRunTime();
        this.selfPinging = config.selfPinging();
    }

    public RunnerState getState() {
        return RunnerState.fromCode((int) options.get(optionName(STATE_OPTION_SUFFIX), RunnerState.STOPPED.code()));
    }

    public Instant getLastStateChangeTime() {
        return Instant.ofEpochSecond(options.get(optionName(LAST_STATE_CHANGE_OPTION_SUFFIX), 0));
    }

    public Instant getLastRunTime() {
        return Instant.ofEpochSecond(options.get(optionName(LAST_RUN_OPTION_SUFFIX), 0));
    }

    public RunnerSnapshot snapshot() {
        return new RunnerSnapshot(getState(), getLastStateChangeTime(), getLastRunTime());
    }

    /**
     * Persist a new state and stamp the state change time.
     */
    public void setState(RunnerState state) {
        options.set(optionName(STATE_OPTION_SUFFIX), state.code());
        options.set(optionName(LAST_STATE_CHANGE_OPTION_SUFFIX), clock.instant().getEpochSecond());
        log.debug("[{}] Runner state -> {}", instanceId, state);
    }

    public void setLastRunTime() {
        setLastRunTime(clock.instant());
    }

    public void setLastRunTime(Instant time) {
        options.set(optionName(LAST_RUN_OPTION_SUFFIX), time.getEpochSecond());
    }

    /**
     * Put the runner back to rest after a run, clean or not.
     */
    public void rest() {
        setState(RunnerState.STOPPED);
        setLastRunTime();
    }

    public GateDecision checkGate() {
        return RunnerGate.evaluate(snapshot(), runInterval, maxTotalRunTime, clock.instant());
    }

    public boolean canRunDaemon() {
        return checkGate().allowed();
    }

    /**
     * Queue a daemon run if the gate allows it.
     *
     * @return true if a trigger was fired
     */
    public synchronized boolean runDaemon() {
        GateDecision decision = checkGate();
        if (!decision.allowed()) {
            log.trace("[{}] Daemon run refused: {}", instanceId, decision.reason());
            return false;
        }
        log.debug("[{}] Daemon run allowed: {}", instanceId, decision.reason());
        queueAndTrigger();
        return true;
    }

    /**
     * Re-trigger from inside a daemon run. A self-pinging daemon already holds
     * the run, so the gate is skipped; otherwise this is a normal {@link #runDaemon()}.
     *
     * @return true if a trigger was fired
     */
    public synchronized boolean selfTrigger() {
        if (!selfPinging) {
            return runDaemon();
        }
        queueAndTrigger();
        return true;
    }

    /**
     * The request fired by the latest trigger; a process about to exit waits
     * on it so the request is not lost.
     */
    public CompletableFuture<Void> lastTrigger() {
        return lastTrigger;
    }

    private void queueAndTrigger() {
        setState(RunnerState.QUEUED);
        try {
            CompletableFuture<Void> fired = trigger.trigger();
            lastTrigger = fired != null ? fired : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            // the queued state self-heals after runInterval
            log.warn("[{}] Daemon trigger failed: {}", instanceId, e.getMessage());
        }
    }

    public Duration getRunInterval() {
        return runInterval;
    }

    public Duration getMaxJobRunTime() {
        return maxJobRunTime;
    }

    public Duration getMaxTotalRunTime() {
        return maxTotalRunTime;
    }

    public boolean isSelfPinging() {
        return selfPinging;
    }

    public String getInstanceId() {
        return instanceId;
    }

    private String optionName(String suffix) {
        return optionPrefix + suffix;
    }
}

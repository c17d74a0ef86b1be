package cronarchy.scheduler;

import cronarchy.scheduler.config.SchedulerConfig;
import cronarchy.scheduler.hook.HookDispatcher;
import cronarchy.scheduler.runner.DaemonTrigger;
import cronarchy.scheduler.runner.HttpDaemonTrigger;
import cronarchy.scheduler.runner.Runner;
import cronarchy.scheduler.service.JobManager;
import cronarchy.scheduler.store.Database;
import cronarchy.scheduler.store.JdbcJobRepository;
import cronarchy.scheduler.store.JdbcOptionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * One scheduler instance: a job manager and a runner sharing an instance id.
 *
 * <p>Usage:
 *
 * <pre>
 * Cronarchy cron = Cronarchy.setup(config, database, hooks);
 * cron.manager().scheduleJob(cron.manager().newJob(dueAt, "mail.digest", List.of(42), 3600L));
 * cron.onRequest(); // from every ordinary inbound request
 * </pre>
 */
public final class Cronarchy {

    private static final Logger log = LoggerFactory.getLogger(Cronarchy.class);

    private final SchedulerConfig config;
    private final JobManager manager;
    private final Runner runner;
    private final HookDispatcher dispatcher;

    public Cronarchy(SchedulerConfig config, JobManager manager, Runner runner, HookDispatcher dispatcher) {
        this.config = config;
        this.manager = manager;
        this.runner = runner;
        this.dispatcher = dispatcher;
    }

    /**
     * Create the instance's jobs table if missing, build its components, and
     * register it in {@link Instances} under its instance id.
     */
    public static Cronarchy setup(SchedulerConfig config, Database database, HookDispatcher dispatcher) {
        return setup(config, database, dispatcher, new HttpDaemonTrigger(config.daemonUrl()), Clock.systemUTC());
    }

    public static Cronarchy setup(SchedulerConfig config, Database database, HookDispatcher dispatcher,
            DaemonTrigger trigger, Clock clock) {
        JobManager manager = new JobManager(
                config.instanceId(),
                new JdbcJobRepository(database, config.jobsTable()),
                clock);
        Runner runner = new Runner(new JdbcOptionStore(database), trigger, config, clock);

        Cronarchy instance = new Cronarchy(config, manager, runner, dispatcher);
        Instances.register(config.instanceId(), instance);

        log.info("Scheduler instance {} ready: {}", config.instanceId(), config);
        return instance;
    }

    /**
     * Called for every ordinary inbound request; starts a daemon run when the gate allows.
     */
    public void onRequest() {
        runner.runDaemon();
    }

    public String instanceId() {
        return config.instanceId();
    }

    public SchedulerConfig config() {
        return config;
    }

    public JobManager manager() {
        return manager;
    }

    public Runner runner() {
        return runner;
    }

    public HookDispatcher dispatcher() {
        return dispatcher;
    }
}

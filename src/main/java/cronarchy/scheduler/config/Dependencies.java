package cronarchy.scheduler.config;

import cronarchy.scheduler.Cronarchy;
import cronarchy.scheduler.Instances;
import cronarchy.scheduler.api.internal.v1.DaemonController;
import cronarchy.scheduler.api.v1.HealthController;
import cronarchy.scheduler.api.v1.JobController;
import cronarchy.scheduler.hook.HookDispatcher;
import cronarchy.scheduler.hook.HookRegistry;
import cronarchy.scheduler.server.RouterHandler;
import cronarchy.scheduler.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Manual dependency injection container.
 * Creates and wires the scheduler instance and the HTTP controllers.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(SchedulerConfig.fromEnv());
 * deps.scheduler().manager().scheduleJob(job);
 * // ... serve deps.routerHandler() ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final SchedulerConfig config;
    private final Database database;
    private final Cronarchy scheduler;
    private final ExecutorService daemonExecutor;

    // Controllers
    private final HealthController healthController;
    private final JobController jobController;
    private final DaemonController daemonController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(SchedulerConfig config, HookDispatcher hooks) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.daemonExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "cronarchy-daemon");
            t.setDaemon(true);
            return t;
        });

        // Scheduler instance
        this.scheduler = Cronarchy.setup(config, database, hooks);

        // Controllers (public API)
        this.healthController = new HealthController(database, scheduler);
        this.jobController = new JobController(scheduler.manager());

        // Controllers (internal API)
        this.daemonController = new DaemonController(daemonExecutor, Clock.systemUTC());

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and handlers.
     */
    public static Dependencies create(SchedulerConfig config, HookDispatcher hooks) {
        return new Dependencies(config, hooks);
    }

    /**
     * Create dependencies with handlers from the class path providers.
     */
    public static Dependencies create(SchedulerConfig config) {
        return create(config, HookRegistry.fromProviders());
    }

    // Getters
    public SchedulerConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public Cronarchy scheduler() {
        return scheduler;
    }

    public ExecutorService daemonExecutor() {
        return daemonExecutor;
    }

    // Controller getters
    public HealthController healthController() {
        return healthController;
    }

    public JobController jobController() {
        return jobController;
    }

    public DaemonController daemonController() {
        return daemonController;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(jobController)
                    .registerController(daemonController)
                    .registerInstance(scheduler);
            log.info("RouterHandler created with {} controllers", 3);
        }
        return routerHandler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Let a running daemon finish its current job before the pool goes away
        daemonExecutor.shutdown();
        try {
            if (!daemonExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Daemon run still active at shutdown, interrupting");
                daemonExecutor.shutdownNow();
                // give the interrupted run time to put its runner back to rest
                daemonExecutor.awaitTermination(2, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            daemonExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        Instances.unregister(config.instanceId());

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}

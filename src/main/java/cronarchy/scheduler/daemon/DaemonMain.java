package cronarchy.scheduler.daemon;

import cronarchy.scheduler.config.SchedulerConfig;
import cronarchy.scheduler.runner.HttpDaemonTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Standalone daemon entry point: one run for one instance, then exit.
 *
 * <pre>
 * java -cp cronarchy.jar cronarchy.scheduler.daemon.DaemonMain [instanceId]
 * </pre>
 *
 * The environment is searched upward from the working directory. Logging
 * settings for the run come from {@code CRONARCHY_*} environment variables.
 */
public final class DaemonMain {

    private static final Logger log = LoggerFactory.getLogger(DaemonMain.class);

    private DaemonMain() {
    }

    public static void main(String[] args) {
        SchedulerConfig bootstrap = SchedulerConfig.fromEnv();
        String instanceId = args.length > 0 ? args[0] : bootstrap.instanceId();
        Path callerDir = Path.of("").toAbsolutePath();

        DaemonOutcome outcome;
        try (FileEnvironmentLoader loader = new FileEnvironmentLoader()) {
            Daemon daemon = new Daemon(instanceId, callerDir, bootstrap, loader, Clock.systemUTC())
                    .withShutdownHook();
            outcome = daemon.run();
            // the trigger is asynchronous and would die with the JVM
            daemon.awaitNextCycle(HttpDaemonTrigger.DEFAULT_TIMEOUT);
        }

        log.info("Daemon for {} finished: {}", instanceId, outcome);
        System.exit(exitCode(outcome));
    }

    static int exitCode(DaemonOutcome outcome) {
        return switch (outcome) {
            case COMPLETED, CHAINED, NOT_AUTHORIZED -> 0;
            case TIMED_OUT, ABORTED, FAILED -> 1;
        };
    }
}

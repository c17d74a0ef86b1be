package cronarchy;

import cronarchy.scheduler.config.SchedulerConfig;
import cronarchy.scheduler.daemon.DaemonLog;
import cronarchy.scheduler.daemon.EnvironmentLocator;
import cronarchy.scheduler.server.SchedulerServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Server entry point.
 *
 * Reads the {@code cronarchy.conf} environment found upward from the working
 * directory, or {@code CRONARCHY_*} environment variables when there is none,
 * then serves the scheduler until the JVM is stopped.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws IOException {
        SchedulerConfig config = loadConfig();

        if (!SchedulerServer.start(config)) {
            log.error("Scheduler server did not start");
            System.exit(1);
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Application closing, stopping server...");
            SchedulerServer.stop();
        }, "cronarchy-shutdown"));
    }

    static SchedulerConfig loadConfig() throws IOException {
        SchedulerConfig env = SchedulerConfig.fromEnv();
        DaemonLog quiet = DaemonLog.open(env.instanceId(), false, null);
        Optional<Path> entryFile = new EnvironmentLocator(env.maxDirSearch())
                .locate(Path.of("").toAbsolutePath(), quiet);

        if (entryFile.isPresent()) {
            log.info("Using environment {}", entryFile.get());
            return SchedulerConfig.fromFile(entryFile.get());
        }
        log.info("No {} found, using environment variables", EnvironmentLocator.ENTRY_FILE);
        return env;
    }
}

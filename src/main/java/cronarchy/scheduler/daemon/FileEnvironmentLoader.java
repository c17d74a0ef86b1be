package cronarchy.scheduler.daemon;

import cronarchy.scheduler.Cronarchy;
import cronarchy.scheduler.Instances;
import cronarchy.scheduler.config.SchedulerConfig;
import cronarchy.scheduler.hook.HookRegistry;
import cronarchy.scheduler.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a scheduler instance from a key=value entry file, with handlers
 * contributed by every {@link cronarchy.scheduler.hook.HookProvider} on the class path.
 * An instance that is already registered is left as is.
 */
public class FileEnvironmentLoader implements EnvironmentLoader, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FileEnvironmentLoader.class);

    private final List<Database> opened = new ArrayList<>();

    @Override
    public synchronized void load(Path entryFile) throws IOException {
        SchedulerConfig config = SchedulerConfig.fromFile(entryFile);
        if (Instances.contains(config.instanceId())) {
            log.debug("Instance {} already loaded", config.instanceId());
            return;
        }

        HookRegistry hooks = HookRegistry.fromProviders();

        Database database = new Database(config);
        opened.add(database);
        Cronarchy.setup(config, database, hooks);
        log.info("Loaded environment {} with hooks {}", entryFile, hooks.hooks());
    }

    @Override
    public synchronized void close() {
        for (Database database : opened) {
            try {
                database.close();
            } catch (Exception e) {
                log.warn("Error closing database: {}", e.getMessage());
            }
        }
        opened.clear();
    }
}

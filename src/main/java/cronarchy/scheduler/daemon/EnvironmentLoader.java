package cronarchy.scheduler.daemon;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads the host environment from its entry file. Once loaded, the
 * environment's scheduler instances are available from
 * {@link cronarchy.scheduler.Instances}.
 */
@FunctionalInterface
public interface EnvironmentLoader {

    void load(Path entryFile) throws IOException;
}

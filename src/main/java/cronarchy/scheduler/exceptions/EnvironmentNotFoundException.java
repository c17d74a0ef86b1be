package cronarchy.scheduler.exceptions;

import java.nio.file.Path;

public class EnvironmentNotFoundException extends CronarchyException {

    private static final long serialVersionUID = 1L;

    public EnvironmentNotFoundException(Path start, int maxLevels) {
        super("environment-not-found",
                "No environment file found from " + start + " within " + maxLevels + " parent directories");
    }

    public EnvironmentNotFoundException(String message, Throwable cause) {
        super("environment-not-found", message, cause);
    }
}

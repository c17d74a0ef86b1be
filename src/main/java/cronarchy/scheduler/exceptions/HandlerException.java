package cronarchy.scheduler.exceptions;

/**
 * A job's handler failed, timed out, or does not exist.
 */
public class HandlerException extends CronarchyException {

    private static final long serialVersionUID = 1L;

    public HandlerException(String hook, String message) {
        super("handler-failure", "Hook '" + hook + "': " + message);
    }

    public HandlerException(String hook, String message, Throwable cause) {
        super("handler-failure", "Hook '" + hook + "': " + message, cause);
    }
}

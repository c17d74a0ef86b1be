package cronarchy.scheduler.exceptions;

/**
 * Base class of scheduler errors. The error code is stable and used in HTTP
 * error bodies and log lines.
 */
public abstract class CronarchyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorCode;

    protected CronarchyException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected CronarchyException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String errorCode() {
        return errorCode;
    }
}

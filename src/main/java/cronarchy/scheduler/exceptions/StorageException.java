package cronarchy.scheduler.exceptions;

/**
 * Any failure of the jobs table or the option store.
 * Never retried by the storage layer itself.
 */
public class StorageException extends CronarchyException {

    private static final long serialVersionUID = 1L;

    public StorageException(String message, Throwable cause) {
        super("storage-failure", message, cause);
    }

    public StorageException(String message) {
        super("storage-failure", message);
    }
}

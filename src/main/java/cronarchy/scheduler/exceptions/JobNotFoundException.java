package cronarchy.scheduler.exceptions;

public class JobNotFoundException extends CronarchyException {

    private static final long serialVersionUID = 1L;

    public JobNotFoundException(long id) {
        super("job-not-found", "No job found with id " + id);
    }

    public JobNotFoundException(String criteria) {
        super("job-not-found", "No job matches " + criteria);
    }
}

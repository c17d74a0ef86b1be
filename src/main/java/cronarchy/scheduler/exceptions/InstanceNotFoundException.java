package cronarchy.scheduler.exceptions;

public class InstanceNotFoundException extends CronarchyException {

    private static final long serialVersionUID = 1L;

    public InstanceNotFoundException(String instanceId) {
        super("instance-not-found", "No scheduler instance registered as '" + instanceId + "'");
    }
}

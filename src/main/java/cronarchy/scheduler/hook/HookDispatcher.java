package cronarchy.scheduler.hook;

import java.util.List;

/**
 * Runs a job's payload by hook name. The only way jobs are executed;
 * the scheduler never inspects handler logic.
 */
public interface HookDispatcher {

    /**
     * Invoke the handler for a hook synchronously.
     *
     * @param hook hook name stored with the job
     * @param args positional arguments
     * @throws Exception if the handler fails or no handler exists
     */
    void invoke(String hook, List<Object> args) throws Exception;
}

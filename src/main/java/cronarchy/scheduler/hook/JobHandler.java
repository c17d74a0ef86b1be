package cronarchy.scheduler.hook;

import java.util.List;

/**
 * Functional interface for job handlers.
 *
 * <pre>{@code
 * registry.register("mail.digest", args -> {
 *     var userId = (Integer) args.get(0);
 *     sendDigest(userId);
 * });
 * }</pre>
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * Run the job's payload.
     *
     * @param args the job's stored arguments, in order
     * @throws Exception if the handler fails
     */
    void handle(List<Object> args) throws Exception;
}

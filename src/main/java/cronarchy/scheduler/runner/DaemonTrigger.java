package cronarchy.scheduler.runner;

import java.util.concurrent.CompletableFuture;

/**
 * Starts a daemon invocation without waiting for it.
 * Failures are never reported back to the caller.
 */
@FunctionalInterface
public interface DaemonTrigger {

    /**
     * @return completes once the request has been handed over or has failed;
     *         never completes exceptionally
     */
    CompletableFuture<Void> trigger();
}

package cronarchy.scheduler.support;

import cronarchy.scheduler.runner.DaemonTrigger;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

public class CountingTrigger implements DaemonTrigger {

    private final AtomicInteger count = new AtomicInteger();
    private volatile CompletableFuture<Void> delivery = CompletableFuture.completedFuture(null);

    @Override
    public CompletableFuture<Void> trigger() {
        count.incrementAndGet();
        return delivery;
    }

    /** Hand out this future from now on, so a test decides when the request is delivered */
    public CountingTrigger deliverWith(CompletableFuture<Void> delivery) {
        this.delivery = delivery;
        return this;
    }

    public int count() {
        return count.get();
    }
}

package cronarchy.scheduler.runner;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HttpDaemonTriggerTest {

    @Test
    void unreachableDaemonCompletesNormally() throws Exception {
        HttpDaemonTrigger trigger = new HttpDaemonTrigger(
                "http://127.0.0.1:1/internal/v1/daemon/site", Duration.ofMillis(500));

        CompletableFuture<Void> delivery = trigger.trigger();

        assertNull(delivery.get(5, TimeUnit.SECONDS));
        assertFalse(delivery.isCompletedExceptionally());
    }

    @Test
    void daemonUriIsParsedFromUrl() {
        HttpDaemonTrigger trigger = new HttpDaemonTrigger("http://127.0.0.1:8080/internal/v1/daemon/site");

        assertEquals("/internal/v1/daemon/site", trigger.daemonUri().getPath());
    }
}

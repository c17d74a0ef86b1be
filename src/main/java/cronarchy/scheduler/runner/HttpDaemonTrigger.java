package cronarchy.scheduler.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Fires an empty POST at the daemon endpoint and returns immediately.
 */
public final class HttpDaemonTrigger implements DaemonTrigger {

    private static final Logger log = LoggerFactory.getLogger(HttpDaemonTrigger.class);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(1);

    private final URI daemonUri;
    private final HttpClient httpClient;
    private final Duration timeout;

    public HttpDaemonTrigger(String daemonUrl) {
        this(daemonUrl, DEFAULT_TIMEOUT);
    }

    public HttpDaemonTrigger(String daemonUrl, Duration timeout) {
        this.daemonUri = URI.create(daemonUrl);
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public CompletableFuture<Void> trigger() {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(daemonUri)
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .handle((response, error) -> {
                    if (error != null) {
                        log.debug("Daemon trigger to {} did not complete: {}", daemonUri, error.toString());
                    } else {
                        log.debug("Daemon trigger to {} answered {}", daemonUri, response.statusCode());
                    }
                    return null;
                });
    }

    public URI daemonUri() {
        return daemonUri;
    }
}

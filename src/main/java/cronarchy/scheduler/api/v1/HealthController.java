package cronarchy.scheduler.api.v1;

import cronarchy.scheduler.Cronarchy;
import cronarchy.scheduler.api.Controller;
import cronarchy.scheduler.api.v1.dto.HealthResponse;
import cronarchy.scheduler.runner.RunnerSnapshot;
import cronarchy.scheduler.server.RouterHandler;
import cronarchy.scheduler.store.Database;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final Cronarchy instance;

    public HealthController(Database database, Cronarchy instance) {
        this.database = database;
        this.instance = instance;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (!database.isHealthy()) {
            return unhealthy("connection failed");
        }

        try {
            RunnerSnapshot snapshot = instance.runner().snapshot();
            int pending = instance.manager().getPendingJobs().size();

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(), VERSION, instance.instanceId(),
                    snapshot.state().name(), snapshot.lastRunAt(), pending);

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return unhealthy(e.getMessage());
        }
    }

    private ControllerResponse unhealthy(String reason) throws Exception {
        return ControllerResponse.json(
                HttpResponseStatus.SERVICE_UNAVAILABLE,
                RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(reason)));
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}

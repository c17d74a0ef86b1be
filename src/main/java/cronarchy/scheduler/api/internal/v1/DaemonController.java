package cronarchy.scheduler.api.internal.v1;

import cronarchy.scheduler.Cronarchy;
import cronarchy.scheduler.Instances;
import cronarchy.scheduler.api.Controller;
import cronarchy.scheduler.config.SchedulerConfig;
import cronarchy.scheduler.daemon.Daemon;
import cronarchy.scheduler.daemon.DaemonOutcome;
import cronarchy.scheduler.server.RouterHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Daemon entry point targeted by the runner's trigger.
 *
 * POST /internal/v1/daemon/{instanceId}
 *
 * Answers 202 at once and runs the daemon on the daemon executor, so the
 * caller's short timeout never cuts a run short.
 */
public class DaemonController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(DaemonController.class);

    private static final Pattern DAEMON_PATTERN = Pattern.compile(
            "^" + Pattern.quote(SchedulerConfig.DAEMON_PATH_PREFIX) + "([^/]+)$");

    private final ExecutorService daemonExecutor;
    private final Clock clock;

    public DaemonController(ExecutorService daemonExecutor, Clock clock) {
        this.daemonExecutor = daemonExecutor;
        this.clock = clock;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && DAEMON_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        Matcher matcher = DAEMON_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return ControllerResponse.notFound("unknown daemon endpoint");
        }

        String instanceId = matcher.group(1);
        Optional<Cronarchy> instance = Instances.lookup(instanceId);
        if (instance.isEmpty()) {
            log.warn("Daemon invoked for unknown instance {}", instanceId);
            return ControllerResponse.notFound("unknown instance " + instanceId);
        }

        Daemon daemon = Daemon.inProcess(instanceId, instance.get().config(), clock);
        try {
            daemonExecutor.submit(() -> {
                DaemonOutcome outcome = daemon.run();
                log.debug("Daemon run for {} ended: {}", instanceId, outcome);
            });
        } catch (RejectedExecutionException e) {
            log.warn("Daemon executor rejected run for {}: {}", instanceId, e.getMessage());
            return ControllerResponse.error(HttpResponseStatus.SERVICE_UNAVAILABLE, "daemon executor unavailable");
        }

        Map<String, Object> response = Map.of(
                "accepted", true,
                "instanceId", instanceId);
        return ControllerResponse.json(HttpResponseStatus.ACCEPTED,
                RouterHandler.mapper().writeValueAsString(response));
    }
}

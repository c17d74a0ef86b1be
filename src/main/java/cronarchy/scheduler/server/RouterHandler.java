package cronarchy.scheduler.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import cronarchy.scheduler.Cronarchy;
import cronarchy.scheduler.api.Controller;
import cronarchy.scheduler.api.Controller.ControllerResponse;
import cronarchy.scheduler.config.SchedulerConfig;
import cronarchy.scheduler.exceptions.CronarchyException;
import cronarchy.scheduler.exceptions.JobNotFoundException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Handles versioned endpoints only:
 * - /api/v1/* (public API)
 * - /internal/v1/* (daemon entry point)
 *
 * Every request other than a daemon invocation is also a page load: once it
 * has been answered, each registered scheduler instance gets a chance to
 * start a daemon run.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new CopyOnWriteArrayList<>();
    private final List<Cronarchy> instances = new CopyOnWriteArrayList<>();

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    /**
     * Trigger this instance's runner on every ordinary request.
     */
    public RouterHandler registerInstance(Cronarchy instance) {
        instances.add(instance);
        log.debug("Page-load trigger enabled for instance {}", instance.instanceId());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            dispatch(ctx, req, method, path);
        } finally {
            if (!path.startsWith(SchedulerConfig.DAEMON_PATH_PREFIX)) {
                triggerInstances();
            }
        }
    }

    private void dispatch(ChannelHandlerContext ctx, FullHttpRequest req, HttpMethod method, String path) {
        try {
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    writeSafe(ctx, response.status(), response.contentType(), response.body());
                    return;
                }
            }

            // No controller matched - return 404
            log.debug("No handler for: {} {}", method, path);
            writeSafe(ctx, NOT_FOUND, "application/json", "{\"error\":\"not found\"}");

        } catch (JobNotFoundException e) {
            writeError(ctx, NOT_FOUND, e.getMessage());
        } catch (IllegalArgumentException | JsonProcessingException e) {
            // Validation errors
            log.warn("Validation error on {} {}: {}", method, path, e.getMessage());
            writeError(ctx, BAD_REQUEST, e.getMessage());
        } catch (CronarchyException e) {
            log.error("Scheduler error on {} {} [{}]", method, path, e.errorCode(), e);
            writeError(ctx, INTERNAL_SERVER_ERROR, e.errorCode() + ": " + e.getMessage());
        } catch (Exception e) {
            String requestBody = req.content().toString(StandardCharsets.UTF_8);
            log.error("Handler error: {} {} - Body: [{}]", method, path, requestBody, e);

            // Build full error chain for debugging
            StringBuilder errorChain = new StringBuilder(e.toString());
            Throwable cause = e.getCause();
            while (cause != null) {
                errorChain.append(" <- ").append(cause);
                cause = cause.getCause();
            }
            writeError(ctx, INTERNAL_SERVER_ERROR, errorChain.toString());
        }
    }

    private void triggerInstances() {
        for (Cronarchy instance : instances) {
            try {
                instance.onRequest();
            } catch (RuntimeException e) {
                log.warn("Page-load trigger failed for {}: {}", instance.instanceId(), e.getMessage());
            }
        }
    }

    private void writeError(ChannelHandlerContext ctx, HttpResponseStatus status, String message) {
        ControllerResponse response = ControllerResponse.error(status, message);
        writeSafe(ctx, response.status(), response.contentType(), response.body());
    }

    /**
     * Safe write that catches any exceptions during response writing.
     * Ensures we never silently close the connection.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            if (body == null) {
                body = "";
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (RuntimeException e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            writeError(ctx, INTERNAL_SERVER_ERROR, "channel error: " + cause.getMessage());
        } finally {
            ctx.close();
        }
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}

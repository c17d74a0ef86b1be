package cronarchy.scheduler.api.v1;

import cronarchy.scheduler.api.Controller;
import cronarchy.scheduler.api.v1.dto.JobResponse;
import cronarchy.scheduler.api.v1.dto.ScheduleJobRequest;
import cronarchy.scheduler.model.Job;
import cronarchy.scheduler.model.JobQuery;
import cronarchy.scheduler.server.RouterHandler;
import cronarchy.scheduler.service.JobManager;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for the job queue (public API).
 *
 * POST /api/v1/jobs - Schedule a job
 * GET /api/v1/jobs[?hook=&recurrence=&pending=true] - List jobs
 * GET /api/v1/jobs/{id} - Get one job
 * DELETE /api/v1/jobs/{id} - Delete a job (idempotent)
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");

    private final JobManager jobManager;

    public JobController(JobManager jobManager) {
        this.jobManager = jobManager;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (JOBS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        if (JOB_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.DELETE);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (JOBS_PATTERN.matcher(path).matches()) {
            return req.method().equals(HttpMethod.POST)
                    ? handleScheduleJob(req)
                    : handleListJobs(req);
        }

        Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
        if (jobMatcher.matches()) {
            long id = parseId(jobMatcher.group(1));
            return req.method().equals(HttpMethod.DELETE)
                    ? handleDeleteJob(id)
                    : handleGetJob(id);
        }

        return ControllerResponse.notFound("unknown job endpoint");
    }

    /**
     * POST /api/v1/jobs - Schedule a job
     */
    private ControllerResponse handleScheduleJob(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        ScheduleJobRequest request = RouterHandler.mapper().readValue(body, ScheduleJobRequest.class);

        request.validate();

        Job job = jobManager.newJob(
                request.dueAtInstant(),
                request.hook(),
                request.argsOrEmpty(),
                request.recurrence());
        long id = jobManager.scheduleJob(job);
        log.info("Scheduled job {} ({}) due at {}", id, job.hook(), job.dueAt());

        Map<String, Object> response = Map.of(
                "success", true,
                "id", id);

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/jobs - List jobs, optionally filtered
     */
    private ControllerResponse handleListJobs(FullHttpRequest req) throws Exception {
        Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();

        List<Job> jobs;
        if ("true".equalsIgnoreCase(first(params, "pending"))) {
            jobs = jobManager.getPendingJobs();
        } else {
            JobQuery query = JobQuery.all();
            String hook = first(params, "hook");
            if (hook != null) {
                query = query.withHook(hook);
            }
            String recurrence = first(params, "recurrence");
            if (recurrence != null) {
                long seconds = parseLong("recurrence", recurrence);
                query = seconds > 0 ? query.withRecurrence(seconds) : query.withoutRecurrence();
            }
            jobs = jobManager.getJobs(query);
        }

        List<JobResponse> items = jobs.stream()
                .map(JobResponse::from)
                .toList();

        Map<String, Object> response = Map.of(
                "count", items.size(),
                "jobs", items);

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/jobs/{id} - Get one job
     */
    private ControllerResponse handleGetJob(long id) throws Exception {
        Job job = jobManager.getJob(id);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(JobResponse.from(job)));
    }

    /**
     * DELETE /api/v1/jobs/{id} - Delete a job; a missing id is not an error
     */
    private ControllerResponse handleDeleteJob(long id) {
        int removed = jobManager.deleteJobs(List.of(id));
        log.debug("Delete job {}: {} row(s) removed", id, removed);
        return ControllerResponse.noContent();
    }

    private static String first(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static long parseId(String raw) {
        return parseLong("job id", raw);
    }

    private static long parseLong(String name, String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number: " + raw);
        }
    }
}

package retrain.orchestrator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import retrain.orchestrator.api.Controller;
import retrain.orchestrator.api.v1.dto.CreateJobRequest;
import retrain.orchestrator.api.v1.dto.ExecutionResponse;
import retrain.orchestrator.api.v1.dto.JobListResponse;
import retrain.orchestrator.api.v1.dto.JobResponse;
import retrain.orchestrator.api.v1.dto.MetricSampleResponse;
import retrain.orchestrator.api.v1.dto.UpdateJobRequest;
import retrain.orchestrator.error.OrchestratorException;
import retrain.orchestrator.error.ValidationException;
import retrain.orchestrator.model.Job;
import retrain.orchestrator.model.JobStatus;
import retrain.orchestrator.server.RouterHandler;
import retrain.orchestrator.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for job definitions (public API).
 *
 * POST   /api/v1/jobs                     - Register a job
 * GET    /api/v1/jobs                     - List jobs (?status=&page=&page_size=)
 * GET    /api/v1/jobs/{jobId}             - Get a job
 * PUT    /api/v1/jobs/{jobId}             - Update a job
 * DELETE /api/v1/jobs/{jobId}             - Delete a job
 * POST   /api/v1/jobs/{jobId}/retry       - Manually re-arm a finished job
 * GET    /api/v1/jobs/{jobId}/executions  - Execution history
 * GET    /api/v1/jobs/{jobId}/metrics     - Recorded metric samples
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs/?$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern JOB_RETRY_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/retry$");
    private static final Pattern JOB_EXECUTIONS_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/executions$");
    private static final Pattern JOB_METRICS_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/metrics$");

    static final int DEFAULT_PAGE_SIZE = 50;

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (JOBS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        if (JOB_RETRY_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST);
        }
        if (JOB_EXECUTIONS_PATTERN.matcher(path).matches() || JOB_METRICS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET);
        }
        if (JOB_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT)
                    || method.equals(HttpMethod.DELETE);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            HttpMethod method = req.method();

            if (JOBS_PATTERN.matcher(path).matches()) {
                return method.equals(HttpMethod.POST) ? handleCreate(req) : handleList(req);
            }

            Matcher retryMatcher = JOB_RETRY_PATTERN.matcher(path);
            if (retryMatcher.matches()) {
                return json(HttpResponseStatus.OK, JobResponse.from(jobService.manualRetry(retryMatcher.group(1))));
            }

            Matcher executionsMatcher = JOB_EXECUTIONS_PATTERN.matcher(path);
            if (executionsMatcher.matches()) {
                String jobId = executionsMatcher.group(1);
                List<ExecutionResponse> executions = jobService.executions(jobId).stream()
                        .map(ExecutionResponse::from)
                        .toList();
                return json(HttpResponseStatus.OK, Map.of("job_id", jobId, "executions", executions));
            }

            Matcher metricsMatcher = JOB_METRICS_PATTERN.matcher(path);
            if (metricsMatcher.matches()) {
                String jobId = metricsMatcher.group(1);
                List<MetricSampleResponse> samples = jobService.metrics(jobId).stream()
                        .map(MetricSampleResponse::from)
                        .toList();
                return json(HttpResponseStatus.OK, Map.of("job_id", jobId, "metrics", samples));
            }

            Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
            if (jobMatcher.matches()) {
                String jobId = jobMatcher.group(1);
                if (method.equals(HttpMethod.PUT)) {
                    return handleUpdate(jobId, req);
                }
                if (method.equals(HttpMethod.DELETE)) {
                    jobService.delete(jobId);
                    return ControllerResponse.noContent();
                }
                return json(HttpResponseStatus.OK, JobResponse.from(jobService.get(jobId)));
            }

            return ControllerResponse.notFound("unknown job endpoint");

        } catch (OrchestratorException e) {
            throw e;
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed JSON body: " + e.getOriginalMessage());
        } catch (Exception e) {
            log.error("Job controller error", e);
            return ControllerResponse.internalError("internal error");
        }
    }

    /**
     * POST /api/v1/jobs
     */
    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        CreateJobRequest request = RouterHandler.mapper().readValue(body(req), CreateJobRequest.class);
        request.validate();

        Job job = jobService.register(
                request.name(),
                request.image(),
                request.command(),
                request.schedule(),
                request.maxRetries(),
                request.checkpointPath());

        return json(HttpResponseStatus.CREATED, JobResponse.from(job));
    }

    /**
     * GET /api/v1/jobs?status=&page=&page_size=
     */
    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        JobStatus status = null;
        String statusParam = param(query, "status");
        if (statusParam != null && !statusParam.isBlank()) {
            try {
                status = JobStatus.fromValue(statusParam);
            } catch (IllegalArgumentException e) {
                throw new ValidationException("unknown status: " + statusParam);
            }
        }
        int page = intParam(query, "page", 1);
        int pageSize = intParam(query, "page_size", DEFAULT_PAGE_SIZE);

        return json(HttpResponseStatus.OK, JobListResponse.from(jobService.list(status, page, pageSize)));
    }

    /**
     * PUT /api/v1/jobs/{jobId}
     */
    private ControllerResponse handleUpdate(String jobId, FullHttpRequest req) throws Exception {
        UpdateJobRequest request = RouterHandler.mapper().readValue(body(req), UpdateJobRequest.class);
        Job job = jobService.update(jobId, request.toUpdate());
        return json(HttpResponseStatus.OK, JobResponse.from(job));
    }

    private static String body(FullHttpRequest req) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new ValidationException("request body is required");
        }
        return body;
    }

    private static String param(QueryStringDecoder query, String name) {
        List<String> values = query.parameters().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static int intParam(QueryStringDecoder query, String name, int defaultValue) {
        String value = param(query, name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(name + " must be an integer");
        }
    }

    private static ControllerResponse json(HttpResponseStatus status, Object body) throws JsonProcessingException {
        return ControllerResponse.json(status, RouterHandler.mapper().writeValueAsString(body));
    }
}

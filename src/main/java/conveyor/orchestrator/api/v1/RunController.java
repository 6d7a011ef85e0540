package conveyor.orchestrator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import conveyor.orchestrator.api.Controller;
import conveyor.orchestrator.api.v1.dto.RunResponse;
import conveyor.orchestrator.api.v1.dto.SubmitRunRequest;
import conveyor.orchestrator.api.v1.dto.TaskAttemptResponse;
import conveyor.orchestrator.api.v1.dto.TaskLogResponse;
import conveyor.orchestrator.graph.GraphValidationException;
import conveyor.orchestrator.model.PipelineRun;
import conveyor.orchestrator.model.RunState;
import conveyor.orchestrator.server.RouterHandler;
import conveyor.orchestrator.service.RunService;
import conveyor.orchestrator.service.TaskLog;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for pipeline runs (public API).
 * 
 * POST /api/v1/runs - Submit a run
 * GET /api/v1/runs - List recent runs
 * GET /api/v1/runs/{runId} - Get run status with every task execution
 * POST /api/v1/runs/{runId}/cancel - Request cancellation
 * GET /api/v1/runs/{runId}/tasks/{taskId}/attempts - Attempt history of a task
 * GET /api/v1/runs/{runId}/tasks/{taskId}/log - Log of the task's latest attempt
 */
public class RunController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private static final int DEFAULT_LIST_LIMIT = 50;

    private static final Pattern RUNS_PATTERN = Pattern.compile("^/api/v1/runs$");
    private static final Pattern RUN_BY_ID_PATTERN = Pattern.compile("^/api/v1/runs/([^/]+)$");
    private static final Pattern RUN_CANCEL_PATTERN = Pattern.compile("^/api/v1/runs/([^/]+)/cancel$");
    private static final Pattern TASK_ATTEMPTS_PATTERN = Pattern.compile("^/api/v1/runs/([^/]+)/tasks/([^/]+)/attempts$");
    private static final Pattern TASK_LOG_PATTERN = Pattern.compile("^/api/v1/runs/([^/]+)/tasks/([^/]+)/log$");

    private final RunService runService;

    public RunController(RunService runService) {
        this.runService = runService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return RUNS_PATTERN.matcher(path).matches() || RUN_CANCEL_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return RUNS_PATTERN.matcher(path).matches()
                    || RUN_BY_ID_PATTERN.matcher(path).matches()
                    || TASK_ATTEMPTS_PATTERN.matcher(path).matches()
                    || TASK_LOG_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST)) {
                if (RUNS_PATTERN.matcher(path).matches()) {
                    return handleSubmit(req);
                }
                Matcher cancelMatcher = RUN_CANCEL_PATTERN.matcher(path);
                if (cancelMatcher.matches()) {
                    return handleCancel(cancelMatcher.group(1));
                }
            }

            if (req.method().equals(HttpMethod.GET)) {
                if (RUNS_PATTERN.matcher(path).matches()) {
                    return handleList(req);
                }
                Matcher attemptsMatcher = TASK_ATTEMPTS_PATTERN.matcher(path);
                if (attemptsMatcher.matches()) {
                    return handleAttempts(attemptsMatcher.group(1), attemptsMatcher.group(2));
                }
                Matcher logMatcher = TASK_LOG_PATTERN.matcher(path);
                if (logMatcher.matches()) {
                    return handleLog(logMatcher.group(1), logMatcher.group(2));
                }
                Matcher runMatcher = RUN_BY_ID_PATTERN.matcher(path);
                if (runMatcher.matches()) {
                    return handleGetRun(runMatcher.group(1));
                }
            }

            return ControllerResponse.notFound("unknown run endpoint");

        } catch (GraphValidationException e) {
            return validationError(e);
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Run controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/runs - Submit a run
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        SubmitRunRequest request = RouterHandler.mapper().readValue(body, SubmitRunRequest.class);

        request.validate();

        PipelineRun run = runService.submit(request.pipeline(), request.arguments(), request.annotations());

        Map<String, Object> response = Map.of(
                "success", true,
                "runId", run.id(),
                "status", run.status().name(),
                "totalTasks", run.pipeline().tasks().size());

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/runs?limit=N - List recent runs
     */
    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        int limit = DEFAULT_LIST_LIMIT;
        List<String> limitParam = query.parameters().get("limit");
        if (limitParam != null && !limitParam.isEmpty()) {
            try {
                limit = Integer.parseInt(limitParam.get(0));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("limit must be a number");
            }
        }

        List<RunResponse> runs = runService.listRuns(limit).stream()
                .map(RunResponse::from)
                .toList();

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("runs", runs)));
    }

    /**
     * GET /api/v1/runs/{runId} - Get run status
     */
    private ControllerResponse handleGetRun(String runId) throws Exception {
        Optional<RunState> state = runService.getRun(runId);

        if (state.isEmpty()) {
            return ControllerResponse.notFound("run not found");
        }

        RunResponse response = RunResponse.from(state.get(), runService.outputs(runId));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * POST /api/v1/runs/{runId}/cancel - Request cancellation
     */
    private ControllerResponse handleCancel(String runId) throws Exception {
        if (runService.getRun(runId).isEmpty()) {
            return ControllerResponse.notFound("run not found");
        }
        if (!runService.cancel(runId)) {
            return ControllerResponse.conflict("run is already finished");
        }
        return ControllerResponse.json(HttpResponseStatus.ACCEPTED,
                RouterHandler.mapper().writeValueAsString(Map.of("success", true, "runId", runId)));
    }

    /**
     * GET /api/v1/runs/{runId}/tasks/{taskId}/attempts - Attempt history
     */
    private ControllerResponse handleAttempts(String runId, String taskId) throws Exception {
        if (runService.getRun(runId).isEmpty()) {
            return ControllerResponse.notFound("run not found");
        }
        List<TaskAttemptResponse> attempts = runService.attempts(runId, taskId).stream()
                .map(TaskAttemptResponse::from)
                .toList();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("runId", runId);
        response.put("taskId", taskId);
        response.put("attempts", attempts);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/runs/{runId}/tasks/{taskId}/log - Log of the latest attempt
     */
    private ControllerResponse handleLog(String runId, String taskId) throws Exception {
        if (runService.getRun(runId).isEmpty()) {
            return ControllerResponse.notFound("run not found");
        }
        Optional<TaskLog> taskLog = runService.taskLog(runId, taskId);
        if (taskLog.isEmpty()) {
            return ControllerResponse.notFound("no log available");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskLogResponse.from(taskLog.get())));
    }

    private ControllerResponse validationError(GraphValidationException e) {
        try {
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("error", "invalid pipeline");
            response.put("problems", e.problems());
            return ControllerResponse.json(HttpResponseStatus.BAD_REQUEST,
                    RouterHandler.mapper().writeValueAsString(response));
        } catch (JsonProcessingException ex) {
            return ControllerResponse.badRequest(e.getMessage());
        }
    }
}

package conveyor.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import conveyor.orchestrator.model.PipelineRun;
import conveyor.orchestrator.model.RunState;
import conveyor.orchestrator.model.TaskStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for run details.
 * GET /api/v1/runs/{runId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResponse(
        @JsonProperty("runId") String runId,
        @JsonProperty("pipeline") String pipeline,
        @JsonProperty("status") String status,
        @JsonProperty("cancelRequested") boolean cancelRequested,
        @JsonProperty("error") String error,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("taskCounts") Map<String, Long> taskCounts,
        @JsonProperty("tasks") List<TaskExecutionResponse> tasks,
        @JsonProperty("outputs") Map<String, String> outputs) {

    /** Compact version for list responses */
    public static RunResponse from(PipelineRun run) {
        return new RunResponse(
                run.id(),
                run.pipeline().name(),
                run.status().name(),
                run.cancelRequested(),
                run.errorMessage(),
                run.createdAt(),
                run.startedAt(),
                run.finishedAt(),
                null,
                null,
                null);
    }

    /** Full version with every task execution and the pipeline outputs produced so far */
    public static RunResponse from(RunState state, Map<String, String> outputs) {
        PipelineRun run = state.run();
        List<TaskExecutionResponse> tasks = state.tasks().values().stream()
                .map(TaskExecutionResponse::from)
                .toList();
        return new RunResponse(
                run.id(),
                run.pipeline().name(),
                run.status().name(),
                run.cancelRequested(),
                run.errorMessage(),
                run.createdAt(),
                run.startedAt(),
                run.finishedAt(),
                taskCounts(state),
                tasks,
                outputs.isEmpty() ? null : outputs);
    }

    /** Number of tasks in each status; statuses with no task are left out */
    private static Map<String, Long> taskCounts(RunState state) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (TaskStatus status : TaskStatus.values()) {
            long count = state.count(status);
            if (count > 0) {
                counts.put(status.name(), count);
            }
        }
        return counts;
    }
}

package conveyor.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import conveyor.orchestrator.model.TaskExecution;

import java.time.Instant;
import java.util.Map;

/**
 * Task execution as part of a run response.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskExecutionResponse(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("status") String status,
        @JsonProperty("executionId") String executionId,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("infraRetryCount") int infraRetryCount,
        @JsonProperty("outputs") Map<String, String> outputs,
        @JsonProperty("error") String error,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt) {

    public static TaskExecutionResponse from(TaskExecution execution) {
        return new TaskExecutionResponse(
                execution.taskId(),
                execution.status().name(),
                execution.executionId(),
                execution.retryCount(),
                execution.infraRetryCount(),
                execution.outputs().isEmpty() ? null : execution.outputs(),
                execution.errorMessage(),
                execution.startedAt(),
                execution.finishedAt());
    }
}

package conveyor.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import conveyor.orchestrator.model.TaskAttempt;

import java.time.Instant;

/**
 * One archived attempt of a task.
 * GET /api/v1/runs/{runId}/tasks/{taskId}/attempts
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskAttemptResponse(
        @JsonProperty("attempt") int attempt,
        @JsonProperty("executionId") String executionId,
        @JsonProperty("status") String status,
        @JsonProperty("error") String error,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt) {

    public static TaskAttemptResponse from(TaskAttempt attempt) {
        return new TaskAttemptResponse(
                attempt.attempt(),
                attempt.executionId(),
                attempt.status().name(),
                attempt.errorMessage(),
                attempt.startedAt(),
                attempt.finishedAt());
    }
}

package conveyor.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import conveyor.orchestrator.service.TaskLog;

/**
 * Log of a task's latest attempt.
 * GET /api/v1/runs/{runId}/tasks/{taskId}/log
 */
public record TaskLogResponse(
        @JsonProperty("runId") String runId,
        @JsonProperty("taskId") String taskId,
        @JsonProperty("executionId") String executionId,
        @JsonProperty("logUri") String logUri,
        @JsonProperty("content") String content) {

    public static TaskLogResponse from(TaskLog log) {
        return new TaskLogResponse(log.runId(), log.taskId(), log.executionId(), log.uri(), log.content());
    }
}

package conveyor.orchestrator.model;

import java.time.Instant;

/**
 * Archived attempt of a task execution.
 *
 * @param attempt 1-based attempt number within the task
 * @param status  final status of the attempt (SUCCEEDED, FAILED or CANCELLED)
 */
public record TaskAttempt(
        String runId,
        String taskId,
        int attempt,
        String executionId,
        String handle,
        TaskStatus status,
        String errorMessage,
        Instant startedAt,
        Instant finishedAt) {
}

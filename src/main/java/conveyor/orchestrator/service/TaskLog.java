package conveyor.orchestrator.service;

/**
 * Log of one attempt of a task.
 *
 * @param executionId attempt the log belongs to
 * @param uri         where the launcher wrote the log
 * @param content     log text as read at request time
 */
public record TaskLog(String runId, String taskId, String executionId, String uri, String content) {
}

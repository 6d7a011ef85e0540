package conveyor.orchestrator.repository;

import conveyor.orchestrator.model.PipelineRun;
import conveyor.orchestrator.model.RunState;
import conveyor.orchestrator.model.RunStatus;
import conveyor.orchestrator.model.TaskAttempt;
import conveyor.orchestrator.model.TaskExecution;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of runs and task executions.
 * <p>
 * Every state change is a compare-and-set keyed by (run id, task id, expected
 * status): a lost race returns {@code false} and is never an error. The store is
 * the only state shared between controller steps, dispatch workers and processes.
 * Implementations can use JDBC or in-memory storage.
 */
public interface ExecutionStateStore {

    /**
     * Create a run together with a PENDING execution for each task.
     *
     * @param run     the run, normally in PENDING status
     * @param taskIds every task id of the run's pipeline
     */
    void createRun(PipelineRun run, List<String> taskIds);

    /**
     * Find a run without its task executions.
     *
     * @param runId the run ID
     * @return the run if found
     */
    Optional<PipelineRun> findRun(String runId);

    /**
     * Read a consistent snapshot of a run and all of its task executions,
     * including recorded outputs.
     *
     * @param runId the run ID
     * @return the snapshot if the run exists
     */
    Optional<RunState> getRunState(String runId);

    /**
     * List runs, newest first.
     *
     * @param limit maximum number of results
     * @return list of runs
     */
    List<PipelineRun> listRuns(int limit);

    /**
     * Ids of runs that are not terminal.
     *
     * @return run ids, oldest first
     */
    List<String> findActiveRunIds();

    /**
     * Atomically move a run from {@code expected} to {@code next}.
     * Sets the start time on RUNNING and the finish time on terminal statuses.
     *
     * @param runId        the run ID
     * @param expected     status the run must currently have
     * @param next         new status
     * @param errorMessage optional reason, stored for terminal statuses
     * @return true if the transition was applied
     */
    boolean transitionRun(String runId, RunStatus expected, RunStatus next, String errorMessage);

    /**
     * Set the cancellation flag of a non-terminal run.
     *
     * @param runId the run ID
     * @return true if the flag was set (or was already set), false if the run is terminal or unknown
     */
    boolean requestCancellation(String runId);

    /**
     * Atomically replace a task execution if the stored row is still the attempt the caller read.
     * <p>
     * The row matches when its status, execution id, retry count and infra retry count equal
     * those of {@code expected}. Every return to PENDING bumps one of the counters, so a
     * snapshot taken before a retry can never claim the retried task.
     * <p>
     * When the execution leaves STARTING or RUNNING, the attempt that just ended is archived
     * in the same transaction. Leaving an in-flight status for PENDING (a retry) also
     * clears the outputs recorded by the previous attempt.
     *
     * @param expected the execution as last read by the caller
     * @param updated  the new execution state (run and task ids identify the row)
     * @return true if the transition was applied
     */
    boolean transitionTask(TaskExecution expected, TaskExecution updated);

    /**
     * Record (or overwrite) the artifact URI of one output of a task.
     *
     * @param runId       the run ID
     * @param taskId      the task ID
     * @param outputName  declared output name
     * @param artifactUri opaque artifact URI
     */
    void recordTaskOutput(String runId, String taskId, String outputName, String artifactUri);

    /**
     * PENDING executions of a run whose backoff has elapsed. The readiness
     * resolver decides which of them can actually be dispatched.
     *
     * @param runId the run ID
     * @param now   current time, compared with the not-before time
     * @return candidate executions
     */
    List<TaskExecution> listReadyCandidates(String runId, Instant now);

    /**
     * Count STARTING and RUNNING executions across all runs.
     *
     * @return in-flight count
     */
    int countInFlight();

    /**
     * Find STARTING executions (across all runs of non-terminal runs) that started before the cutoff.
     *
     * @param startedBefore cutoff
     * @return stale executions
     */
    List<TaskExecution> findStaleStarting(Instant startedBefore);

    /**
     * Archived attempts of a task, oldest first.
     *
     * @param runId  the run ID
     * @param taskId the task ID
     * @return attempts
     */
    List<TaskAttempt> listAttempts(String runId, String taskId);

    /**
     * Check if the backing storage is reachable.
     *
     * @return true if healthy
     */
    boolean isHealthy();
}

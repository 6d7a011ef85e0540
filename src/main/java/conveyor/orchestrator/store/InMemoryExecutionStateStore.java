package conveyor.orchestrator.store;

import conveyor.orchestrator.model.PipelineRun;
import conveyor.orchestrator.model.RunState;
import conveyor.orchestrator.model.RunStatus;
import conveyor.orchestrator.model.TaskAttempt;
import conveyor.orchestrator.model.TaskExecution;
import conveyor.orchestrator.model.TaskStatus;
import conveyor.orchestrator.repository.ExecutionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory implementation of ExecutionStateStore, for tests and single-process use.
 * Every operation holds the store monitor, which gives the same compare-and-set
 * semantics as the JDBC engine within one JVM.
 */
public class InMemoryExecutionStateStore implements ExecutionStateStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryExecutionStateStore.class);

    private final Map<String, PipelineRun> runs = new LinkedHashMap<>();
    private final Map<String, Map<String, TaskExecution>> tasks = new LinkedHashMap<>();
    private final Map<String, Map<String, String>> outputs = new LinkedHashMap<>();
    private final Map<String, List<TaskAttempt>> attempts = new LinkedHashMap<>();

    @Override
    public synchronized void createRun(PipelineRun run, List<String> taskIds) {
        if (runs.containsKey(run.id())) {
            throw new IllegalStateException("Run already exists: " + run.id());
        }
        Instant createdAt = run.createdAt() != null ? run.createdAt() : Instant.now();
        runs.put(run.id(), run.toBuilder().createdAt(createdAt).build());

        Map<String, TaskExecution> runTasks = new LinkedHashMap<>();
        for (String taskId : taskIds) {
            runTasks.put(taskId, TaskExecution.pending(run.id(), taskId, createdAt));
        }
        tasks.put(run.id(), runTasks);
        log.debug("Created run {} with {} task executions", run.id(), taskIds.size());
    }

    @Override
    public synchronized Optional<PipelineRun> findRun(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public synchronized Optional<RunState> getRunState(String runId) {
        PipelineRun run = runs.get(runId);
        if (run == null) {
            return Optional.empty();
        }
        Map<String, TaskExecution> snapshot = new LinkedHashMap<>();
        for (TaskExecution execution : tasks.get(runId).values()) {
            snapshot.put(execution.taskId(), withOutputs(execution));
        }
        return Optional.of(new RunState(run, snapshot));
    }

    @Override
    public synchronized List<PipelineRun> listRuns(int limit) {
        List<PipelineRun> result = new ArrayList<>(runs.values());
        result.sort(Comparator.comparing(PipelineRun::createdAt).thenComparing(PipelineRun::id).reversed());
        return result.size() > limit ? new ArrayList<>(result.subList(0, limit)) : result;
    }

    @Override
    public synchronized List<String> findActiveRunIds() {
        List<String> ids = new ArrayList<>();
        for (PipelineRun run : runs.values()) {
            if (!run.isTerminal()) {
                ids.add(run.id());
            }
        }
        return ids;
    }

    @Override
    public synchronized boolean transitionRun(String runId, RunStatus expected, RunStatus next, String errorMessage) {
        PipelineRun run = runs.get(runId);
        if (run == null || run.status() != expected) {
            return false;
        }
        Instant now = Instant.now();
        PipelineRun.Builder builder = run.toBuilder().status(next);
        if (next == RunStatus.RUNNING && run.startedAt() == null) {
            builder.startedAt(now);
        }
        if (next.isTerminal()) {
            builder.finishedAt(now);
        }
        if (errorMessage != null) {
            builder.errorMessage(errorMessage);
        }
        runs.put(runId, builder.build());
        log.debug("Run {} {} -> {}", runId, expected, next);
        return true;
    }

    @Override
    public synchronized boolean requestCancellation(String runId) {
        PipelineRun run = runs.get(runId);
        if (run == null || run.isTerminal()) {
            return false;
        }
        runs.put(runId, run.toBuilder().cancelRequested(true).build());
        return true;
    }

    @Override
    public synchronized boolean transitionTask(TaskExecution expected, TaskExecution updated) {
        Map<String, TaskExecution> runTasks = tasks.get(updated.runId());
        TaskExecution current = runTasks != null ? runTasks.get(updated.taskId()) : null;
        if (current == null || !sameAttempt(current, expected)) {
            return false;
        }

        runTasks.put(updated.taskId(), updated.toBuilder().outputs(Map.of()).build());

        if (expected.status().isInFlight() && !updated.status().isInFlight()) {
            List<TaskAttempt> history = attempts.computeIfAbsent(key(updated.runId(), updated.taskId()),
                    k -> new ArrayList<>());
            history.add(new TaskAttempt(
                    current.runId(),
                    current.taskId(),
                    history.size() + 1,
                    current.executionId(),
                    current.handle(),
                    JdbcExecutionStateStore.attemptStatus(updated.status()),
                    updated.errorMessage(),
                    current.startedAt(),
                    updated.finishedAt() != null ? updated.finishedAt() : Instant.now()));
            if (updated.status() == TaskStatus.PENDING) {
                outputs.remove(key(updated.runId(), updated.taskId()));
            }
        }
        log.debug("Task {}/{} {} -> {}", updated.runId(), updated.taskId(), expected.status(), updated.status());
        return true;
    }

    private static boolean sameAttempt(TaskExecution current, TaskExecution expected) {
        return current.status() == expected.status()
                && Objects.equals(current.executionId(), expected.executionId())
                && current.retryCount() == expected.retryCount()
                && current.infraRetryCount() == expected.infraRetryCount();
    }

    @Override
    public synchronized void recordTaskOutput(String runId, String taskId, String outputName, String artifactUri) {
        outputs.computeIfAbsent(key(runId, taskId), k -> new LinkedHashMap<>()).put(outputName, artifactUri);
    }

    @Override
    public synchronized List<TaskExecution> listReadyCandidates(String runId, Instant now) {
        List<TaskExecution> result = new ArrayList<>();
        Map<String, TaskExecution> runTasks = tasks.get(runId);
        if (runTasks == null) {
            return result;
        }
        for (TaskExecution execution : runTasks.values()) {
            if (execution.status() == TaskStatus.PENDING && execution.isDue(now)) {
                result.add(execution);
            }
        }
        return result;
    }

    @Override
    public synchronized int countInFlight() {
        int count = 0;
        for (Map<String, TaskExecution> runTasks : tasks.values()) {
            for (TaskExecution execution : runTasks.values()) {
                if (execution.status().isInFlight()) {
                    count++;
                }
            }
        }
        return count;
    }

    @Override
    public synchronized List<TaskExecution> findStaleStarting(Instant startedBefore) {
        List<TaskExecution> result = new ArrayList<>();
        for (Map.Entry<String, Map<String, TaskExecution>> entry : tasks.entrySet()) {
            if (runs.get(entry.getKey()).isTerminal()) {
                continue;
            }
            for (TaskExecution execution : entry.getValue().values()) {
                if (execution.status() == TaskStatus.STARTING
                        && execution.startedAt() != null
                        && execution.startedAt().isBefore(startedBefore)) {
                    result.add(execution);
                }
            }
        }
        return result;
    }

    @Override
    public synchronized List<TaskAttempt> listAttempts(String runId, String taskId) {
        return List.copyOf(attempts.getOrDefault(key(runId, taskId), List.of()));
    }

    @Override
    public boolean isHealthy() {
        return true;
    }

    private TaskExecution withOutputs(TaskExecution execution) {
        Map<String, String> recorded = outputs.get(key(execution.runId(), execution.taskId()));
        if (recorded == null) {
            return execution;
        }
        return execution.toBuilder().outputs(Map.copyOf(recorded)).build();
    }

    private static String key(String runId, String taskId) {
        return runId + "/" + taskId;
    }
}

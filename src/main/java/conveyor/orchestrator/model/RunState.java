package conveyor.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Consistent snapshot of a run and all of its task executions.
 */
public record RunState(PipelineRun run, Map<String, TaskExecution> tasks) {

    public RunState {
        tasks = Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
    }

    public Optional<TaskExecution> task(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public TaskStatus statusOf(String taskId) {
        TaskExecution execution = tasks.get(taskId);
        return execution != null ? execution.status() : null;
    }

    public long count(TaskStatus status) {
        return tasks.values().stream().filter(t -> t.status() == status).count();
    }

    public long inFlight() {
        return tasks.values().stream().filter(t -> t.status().isInFlight()).count();
    }

    public boolean allTasksTerminal() {
        return tasks.values().stream().allMatch(t -> t.status().isTerminal());
    }
}

package conveyor.orchestrator.service;

import conveyor.orchestrator.graph.PipelineGraph;
import conveyor.orchestrator.model.ArgumentSource;
import conveyor.orchestrator.model.RunState;
import conveyor.orchestrator.model.TaskExecution;
import conveyor.orchestrator.model.TaskSpec;
import conveyor.orchestrator.model.TaskStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides which PENDING tasks of a run can be dispatched and which can never run.
 * <p>
 * A task is ready when it is PENDING, its backoff has elapsed and every argument
 * source is resolvable. A task that depends on a FAILED, SKIPPED or CANCELLED task
 * is to be skipped; skipping is transitive and is computed to a fixed point in a
 * single pass over the topological order. Pure: reads the snapshot, writes nothing.
 */
public class ReadinessResolver {

    /**
     * @param ready   task ids that can be dispatched now, in topological order
     * @param skipped task id to the upstream task that blocks it
     */
    public record Readiness(List<String> ready, Map<String, String> skipped) {
    }

    public Readiness resolve(PipelineGraph graph, RunState state, Instant now) {
        Map<String, TaskStatus> effective = new HashMap<>();
        for (String taskId : graph.topologicalOrder()) {
            TaskStatus status = state.statusOf(taskId);
            effective.put(taskId, status != null ? status : TaskStatus.PENDING);
        }

        Map<String, String> skipped = new LinkedHashMap<>();
        List<String> ready = new ArrayList<>();

        for (String taskId : graph.topologicalOrder()) {
            if (effective.get(taskId) != TaskStatus.PENDING) {
                continue;
            }

            String blocker = null;
            for (String upstreamId : graph.upstreamOf(taskId)) {
                if (effective.get(upstreamId).blocksDownstream()) {
                    blocker = upstreamId;
                    break;
                }
            }
            if (blocker != null) {
                effective.put(taskId, TaskStatus.SKIPPED);
                skipped.put(taskId, blocker);
                continue;
            }

            TaskExecution execution = state.tasks().get(taskId);
            if (execution != null && execution.isDue(now) && argumentsResolvable(graph.task(taskId), state)) {
                ready.add(taskId);
            }
        }

        return new Readiness(ready, skipped);
    }

    private static boolean argumentsResolvable(TaskSpec task, RunState state) {
        for (ArgumentSource source : task.arguments().values()) {
            for (ArgumentSource.TaskOutput ref : source.upstreamOutputs()) {
                TaskExecution upstream = state.tasks().get(ref.taskId());
                if (upstream == null
                        || upstream.status() != TaskStatus.SUCCEEDED
                        || !upstream.outputs().containsKey(ref.outputName())) {
                    return false;
                }
            }
        }
        return true;
    }
}

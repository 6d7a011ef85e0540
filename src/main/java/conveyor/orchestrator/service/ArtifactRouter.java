package conveyor.orchestrator.service;

import conveyor.orchestrator.graph.PipelineGraph;
import conveyor.orchestrator.model.ArgumentSource;
import conveyor.orchestrator.model.InputSpec;
import conveyor.orchestrator.model.PipelineRun;
import conveyor.orchestrator.model.ResolvedInput;
import conveyor.orchestrator.model.RunState;
import conveyor.orchestrator.model.TaskExecution;
import conveyor.orchestrator.model.TaskSpec;
import conveyor.orchestrator.model.TaskStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a task's argument sources to concrete values and artifact references.
 */
public class ArtifactRouter {

    /**
     * Resolve every input port of a task, in the component's declaration order.
     * Unbound inputs take the component default; unbound optional inputs, and
     * optional pipeline inputs the run did not supply, are omitted.
     *
     * @throws UnresolvedReferenceException if a referenced output has not been recorded
     */
    public Map<String, ResolvedInput> resolveInputs(PipelineGraph graph, String taskId, RunState state) {
        TaskSpec task = graph.task(taskId);
        Map<String, ResolvedInput> resolved = new LinkedHashMap<>();

        for (InputSpec input : task.component().inputs()) {
            ArgumentSource source = task.arguments().get(input.name());
            if (source == null) {
                if (input.hasDefault()) {
                    resolved.put(input.name(), ResolvedInput.value(input.defaultValue()));
                } else if (!input.optional()) {
                    throw new UnresolvedReferenceException(
                            "Task " + taskId + " has no argument for required input '" + input.name() + "'");
                }
                continue;
            }

            ResolvedInput value = resolve(graph, taskId, source, state);
            if (value != null) {
                resolved.put(input.name(), value);
            } else if (input.hasDefault()) {
                resolved.put(input.name(), ResolvedInput.value(input.defaultValue()));
            }
        }
        return resolved;
    }

    private ResolvedInput resolve(PipelineGraph graph, String taskId, ArgumentSource source, RunState state) {
        if (source instanceof ArgumentSource.Literal literal) {
            return ResolvedInput.value(literal.value());
        }
        if (source instanceof ArgumentSource.PipelineInput pipelineInput) {
            return resolvePipelineInput(graph, taskId, pipelineInput.inputName(), state.run());
        }
        if (source instanceof ArgumentSource.TaskOutput ref) {
            return resolveTaskOutput(taskId, ref, state);
        }
        if (source instanceof ArgumentSource.Collection collection) {
            List<ResolvedInput> items = new ArrayList<>(collection.members().size());
            for (ArgumentSource.TaskOutput member : collection.members()) {
                items.add(resolveTaskOutput(taskId, member, state));
            }
            return new ResolvedInput.Collection(items);
        }
        throw new IllegalArgumentException("Unsupported argument source: " + source);
    }

    private ResolvedInput resolvePipelineInput(PipelineGraph graph, String taskId, String inputName, PipelineRun run) {
        String supplied = run.arguments().get(inputName);
        if (supplied != null) {
            return ResolvedInput.value(supplied);
        }
        InputSpec declared = graph.pipeline().input(inputName)
                .orElseThrow(() -> new UnresolvedReferenceException(
                        "Task " + taskId + " references undeclared pipeline input '" + inputName + "'"));
        if (declared.hasDefault()) {
            return ResolvedInput.value(declared.defaultValue());
        }
        if (declared.optional()) {
            return null;
        }
        throw new UnresolvedReferenceException(
                "Run " + run.id() + " did not supply pipeline input '" + inputName + "' for task " + taskId);
    }

    private ResolvedInput.Artifact resolveTaskOutput(String taskId, ArgumentSource.TaskOutput ref, RunState state) {
        TaskExecution upstream = state.tasks().get(ref.taskId());
        if (upstream == null || upstream.status() != TaskStatus.SUCCEEDED) {
            throw new UnresolvedReferenceException("Task " + taskId + " needs " + ref
                    + " but task " + ref.taskId() + " has not succeeded");
        }
        String uri = upstream.outputs().get(ref.outputName());
        if (uri == null) {
            throw new UnresolvedReferenceException("Task " + taskId + " needs " + ref + " which was not recorded");
        }
        return ResolvedInput.artifact(uri);
    }
}

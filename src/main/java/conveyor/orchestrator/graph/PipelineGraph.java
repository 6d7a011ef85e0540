package conveyor.orchestrator.graph;

import conveyor.orchestrator.model.ArgumentSource;
import conveyor.orchestrator.model.ComponentSpec;
import conveyor.orchestrator.model.InputSpec;
import conveyor.orchestrator.model.OutputSpec;
import conveyor.orchestrator.model.PipelineSpec;
import conveyor.orchestrator.model.TaskSpec;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validated, indexed view of a {@link PipelineSpec}.
 * <p>
 * Construction checks that task ids are unique, that every argument binds a
 * declared port, that every task output reference points at an existing task and
 * a declared output, that port types are compatible, that required inputs are
 * bound and that the graph is acyclic. All problems are reported together.
 */
public final class PipelineGraph {

    private final PipelineSpec pipeline;
    private final Map<String, TaskSpec> tasks;
    private final Map<String, Set<String>> upstream;
    private final Map<String, Set<String>> downstream;
    private final List<String> topologicalOrder;

    private PipelineGraph(PipelineSpec pipeline, Map<String, TaskSpec> tasks,
            Map<String, Set<String>> upstream, Map<String, Set<String>> downstream,
            List<String> topologicalOrder) {
        this.pipeline = pipeline;
        this.tasks = tasks;
        this.upstream = upstream;
        this.downstream = downstream;
        this.topologicalOrder = topologicalOrder;
    }

    /**
     * Validate the pipeline and build its graph.
     *
     * @throws GraphValidationException if the pipeline is not a valid DAG
     */
    public static PipelineGraph of(PipelineSpec pipeline) {
        List<String> problems = new ArrayList<>();
        Map<String, TaskSpec> tasks = new LinkedHashMap<>();

        for (TaskSpec task : pipeline.tasks()) {
            if (task.id().isBlank()) {
                problems.add("task id must not be blank");
            } else if (tasks.putIfAbsent(task.id(), task) != null) {
                problems.add("duplicate task id '" + task.id() + "'");
            }
        }

        Map<String, Set<String>> upstream = new LinkedHashMap<>();
        Map<String, Set<String>> downstream = new LinkedHashMap<>();
        for (String id : tasks.keySet()) {
            upstream.put(id, new LinkedHashSet<>());
            downstream.put(id, new LinkedHashSet<>());
        }

        for (TaskSpec task : tasks.values()) {
            checkArguments(pipeline, task, tasks, problems);
            for (String upstreamId : task.upstreamTaskIds()) {
                if (tasks.containsKey(upstreamId)) {
                    upstream.get(task.id()).add(upstreamId);
                    downstream.get(upstreamId).add(task.id());
                }
            }
        }

        for (Map.Entry<String, ArgumentSource.TaskOutput> output : pipeline.outputs().entrySet()) {
            checkTaskOutputRef("pipeline output '" + output.getKey() + "'", output.getValue(), tasks, problems);
        }

        List<String> order = toposort(tasks, upstream, downstream, problems);

        if (!problems.isEmpty()) {
            throw new GraphValidationException(problems);
        }

        return new PipelineGraph(pipeline, Collections.unmodifiableMap(tasks),
                freeze(upstream), freeze(downstream), List.copyOf(order));
    }

    private static void checkArguments(PipelineSpec pipeline, TaskSpec task, Map<String, TaskSpec> tasks,
            List<String> problems) {
        ComponentSpec component = task.component();
        String where = "task '" + task.id() + "'";

        for (Map.Entry<String, ArgumentSource> argument : task.arguments().entrySet()) {
            String port = argument.getKey();
            Optional<InputSpec> input = component.input(port);
            if (input.isEmpty()) {
                problems.add(where + " binds unknown input '" + port + "' of component '" + component.name() + "'");
                continue;
            }

            ArgumentSource source = argument.getValue();
            if (source instanceof ArgumentSource.PipelineInput pipelineInput) {
                if (pipeline.input(pipelineInput.inputName()).isEmpty()) {
                    problems.add(where + " input '" + port + "' references undeclared pipeline input '"
                            + pipelineInput.inputName() + "'");
                }
            }
            if (source instanceof ArgumentSource.Collection collection && collection.members().isEmpty()) {
                problems.add(where + " input '" + port + "' has an empty collection");
            }
            for (ArgumentSource.TaskOutput ref : source.upstreamOutputs()) {
                if (ref.taskId().equals(task.id())) {
                    problems.add(where + " input '" + port + "' references its own output");
                    continue;
                }
                Optional<OutputSpec> output = checkTaskOutputRef(where + " input '" + port + "'", ref, tasks, problems);
                if (output.isPresent() && !typesCompatible(output.get().type(), input.get().type())) {
                    problems.add(where + " input '" + port + "' of type '" + input.get().type()
                            + "' cannot consume " + ref + " of type '" + output.get().type() + "'");
                }
            }
        }

        for (InputSpec input : component.inputs()) {
            if (input.isRequired() && !task.arguments().containsKey(input.name())) {
                problems.add(where + " does not bind required input '" + input.name() + "'");
            }
        }
    }

    private static Optional<OutputSpec> checkTaskOutputRef(String where, ArgumentSource.TaskOutput ref,
            Map<String, TaskSpec> tasks, List<String> problems) {
        TaskSpec producer = tasks.get(ref.taskId());
        if (producer == null) {
            problems.add(where + " references unknown task '" + ref.taskId() + "'");
            return Optional.empty();
        }
        Optional<OutputSpec> output = producer.component().output(ref.outputName());
        if (output.isEmpty()) {
            problems.add(where + " references undeclared output '" + ref.outputName()
                    + "' of task '" + ref.taskId() + "'");
        }
        return output;
    }

    /** Untyped ports accept anything. */
    static boolean typesCompatible(String outputType, String inputType) {
        if (outputType == null || inputType == null || outputType.isBlank() || inputType.isBlank()) {
            return true;
        }
        return outputType.equals(inputType);
    }

    /**
     * Kahn's algorithm. Ties are broken by declaration order so the result is deterministic.
     */
    private static List<String> toposort(Map<String, TaskSpec> tasks, Map<String, Set<String>> upstream,
            Map<String, Set<String>> downstream, List<String> problems) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String id : tasks.keySet()) {
            inDegree.put(id, upstream.get(id).size());
        }

        List<String> order = new ArrayList<>(tasks.size());
        Set<String> emitted = new LinkedHashSet<>();
        boolean progress = true;
        while (progress) {
            progress = false;
            for (String id : tasks.keySet()) {
                if (!emitted.contains(id) && inDegree.get(id) == 0) {
                    order.add(id);
                    emitted.add(id);
                    for (String next : downstream.get(id)) {
                        inDegree.merge(next, -1, Integer::sum);
                    }
                    progress = true;
                    break;
                }
            }
        }

        if (order.size() < tasks.size()) {
            List<String> cyclic = new ArrayList<>();
            for (String id : tasks.keySet()) {
                if (!emitted.contains(id)) {
                    cyclic.add(id);
                }
            }
            problems.add("pipeline has a dependency cycle among tasks " + cyclic);
        }
        return order;
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> edges) {
        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        edges.forEach((id, ids) -> frozen.put(id, Collections.unmodifiableSet(ids)));
        return Collections.unmodifiableMap(frozen);
    }

    public PipelineSpec pipeline() {
        return pipeline;
    }

    public TaskSpec task(String taskId) {
        TaskSpec task = tasks.get(taskId);
        if (task == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        return task;
    }

    public Set<String> taskIds() {
        return tasks.keySet();
    }

    /** Tasks whose outputs the given task consumes. */
    public Set<String> upstreamOf(String taskId) {
        return upstream.getOrDefault(taskId, Set.of());
    }

    /** Tasks that consume an output of the given task. */
    public Set<String> downstreamOf(String taskId) {
        return downstream.getOrDefault(taskId, Set.of());
    }

    /** Every task reachable downstream of the given one, in topological order. */
    public List<String> descendantsOf(String taskId) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(downstreamOf(taskId));
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (seen.add(id)) {
                queue.addAll(downstreamOf(id));
            }
        }
        List<String> result = new ArrayList<>();
        for (String id : topologicalOrder) {
            if (seen.contains(id)) {
                result.add(id);
            }
        }
        return result;
    }

    public List<String> topologicalOrder() {
        return topologicalOrder;
    }
}

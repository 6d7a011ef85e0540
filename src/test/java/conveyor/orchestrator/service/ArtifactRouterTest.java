package conveyor.orchestrator.service;

import conveyor.orchestrator.graph.PipelineGraph;
import conveyor.orchestrator.model.ArgumentSource;
import conveyor.orchestrator.model.ComponentSpec;
import conveyor.orchestrator.model.InputSpec;
import conveyor.orchestrator.model.PipelineRun;
import conveyor.orchestrator.model.PipelineSpec;
import conveyor.orchestrator.model.ResolvedInput;
import conveyor.orchestrator.model.RunState;
import conveyor.orchestrator.model.TaskExecution;
import conveyor.orchestrator.model.TaskSpec;
import conveyor.orchestrator.model.TaskStatus;
import conveyor.orchestrator.model.TestPipelines;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactRouterTest {

    private final ArtifactRouter router = new ArtifactRouter();

    private static final ComponentSpec TRAIN = ComponentSpec.builder("train")
            .input("data")
            .input(new InputSpec("epochs", null, "10", false))
            .input(new InputSpec("seed", null, null, true))
            .input("mode")
            .output("model")
            .build();

    private static RunState state(PipelineSpec pipeline, Map<String, String> arguments, TaskExecution... executions) {
        Map<String, TaskExecution> tasks = new LinkedHashMap<>();
        for (TaskSpec task : pipeline.tasks()) {
            tasks.put(task.id(), TaskExecution.pending("run-1", task.id(), Instant.now()));
        }
        for (TaskExecution execution : executions) {
            tasks.put(execution.taskId(), execution);
        }
        PipelineRun run = TestPipelines.run("run-1", pipeline).toBuilder().arguments(arguments).build();
        return new RunState(run, tasks);
    }

    private static TaskExecution succeeded(String taskId, String uri) {
        return TaskExecution.pending("run-1", taskId, Instant.now()).toBuilder()
                .status(TaskStatus.SUCCEEDED)
                .outputs(Map.of("out", uri))
                .build();
    }

    @Test
    void resolvesEverySourceKind() {
        PipelineSpec pipeline = PipelineSpec.builder("train")
                .input(InputSpec.of("mode"))
                .task(TaskSpec.builder("prep", TestPipelines.source()).build())
                .task(TaskSpec.builder("train", TRAIN)
                        .fromTask("data", "prep", "out")
                        .argument("mode", ArgumentSource.pipelineInput("mode"))
                        .build())
                .build();

        Map<String, ResolvedInput> inputs = router.resolveInputs(PipelineGraph.of(pipeline), "train",
                state(pipeline, Map.of("mode", "fast"), succeeded("prep", "/data/prep/out")));

        assertEquals(List.of("data", "epochs", "mode"), List.copyOf(inputs.keySet()));
        assertEquals(ResolvedInput.artifact("/data/prep/out"), inputs.get("data"));
        assertEquals(ResolvedInput.value("10"), inputs.get("epochs"));
        assertEquals(ResolvedInput.value("fast"), inputs.get("mode"));
        assertFalse(inputs.containsKey("seed"));
    }

    @Test
    void pipelineInputFallsBackToItsDefault() {
        PipelineSpec pipeline = PipelineSpec.builder("defaults")
                .input(new InputSpec("threshold", null, "0.5", false))
                .task(TaskSpec.builder("A", TestPipelines.step())
                        .argument("in", ArgumentSource.pipelineInput("threshold"))
                        .build())
                .build();

        Map<String, ResolvedInput> inputs = router.resolveInputs(PipelineGraph.of(pipeline), "A",
                state(pipeline, Map.of()));

        assertEquals(ResolvedInput.value("0.5"), inputs.get("in"));
    }

    @Test
    void collectionKeepsMemberOrder() {
        ComponentSpec gather = ComponentSpec.builder("gather").input("parts").build();
        PipelineSpec pipeline = PipelineSpec.builder("gather")
                .task(TaskSpec.builder("A", TestPipelines.source()).build())
                .task(TaskSpec.builder("B", TestPipelines.source()).build())
                .task(TaskSpec.builder("G", gather)
                        .argument("parts", ArgumentSource.collection(
                                ArgumentSource.taskOutput("B", "out"),
                                ArgumentSource.taskOutput("A", "out")))
                        .build())
                .build();

        Map<String, ResolvedInput> inputs = router.resolveInputs(PipelineGraph.of(pipeline), "G",
                state(pipeline, Map.of(), succeeded("A", "/a"), succeeded("B", "/b")));

        assertEquals(new ResolvedInput.Collection(List.of(ResolvedInput.artifact("/b"), ResolvedInput.artifact("/a"))),
                inputs.get("parts"));
    }

    @Test
    void unrecordedUpstreamOutputIsUnresolved() {
        PipelineSpec pipeline = TestPipelines.chain();
        TaskExecution noOutputs = TaskExecution.pending("run-1", "A", Instant.now()).toBuilder()
                .status(TaskStatus.SUCCEEDED)
                .build();

        UnresolvedReferenceException e = assertThrows(UnresolvedReferenceException.class,
                () -> router.resolveInputs(PipelineGraph.of(pipeline), "B", state(pipeline, Map.of(), noOutputs)));
        assertTrue(e.getMessage().contains("A.out"));
    }

    @Test
    void pendingUpstreamIsUnresolved() {
        PipelineSpec pipeline = TestPipelines.chain();

        assertThrows(UnresolvedReferenceException.class,
                () -> router.resolveInputs(PipelineGraph.of(pipeline), "B", state(pipeline, Map.of())));
    }
}

package conveyor.orchestrator.service;

import conveyor.orchestrator.core.ChangeNotifier;
import conveyor.orchestrator.graph.GraphValidationException;
import conveyor.orchestrator.graph.PipelineGraph;
import conveyor.orchestrator.model.ArgumentSource;
import conveyor.orchestrator.model.InputSpec;
import conveyor.orchestrator.model.PipelineRun;
import conveyor.orchestrator.model.PipelineSpec;
import conveyor.orchestrator.model.RunState;
import conveyor.orchestrator.model.RunStatus;
import conveyor.orchestrator.model.TaskAttempt;
import conveyor.orchestrator.model.TaskExecution;
import conveyor.orchestrator.repository.ExecutionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Business logic for pipeline runs: submission, queries and cancellation.
 * Runs are driven by {@link PipelineRunController}; this class only creates and reads them.
 */
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    private final ExecutionStateStore store;
    private final PipelineRunController controller;
    private final ChangeNotifier notifier;
    private final ArtifactLayout layout;

    public RunService(ExecutionStateStore store, PipelineRunController controller, ChangeNotifier notifier,
                      ArtifactLayout layout) {
        this.store = store;
        this.controller = controller;
        this.notifier = notifier;
        this.layout = layout;
    }

    /**
     * Validate a pipeline and create a run for it. Nothing is stored if validation fails.
     *
     * @param pipeline    pipeline to run
     * @param arguments   values for pipeline inputs
     * @param annotations run annotations, merged into every task's annotations
     * @return the created run, in PENDING status
     * @throws GraphValidationException if the pipeline or its arguments are invalid
     */
    public PipelineRun submit(PipelineSpec pipeline, Map<String, String> arguments, Map<String, Object> annotations) {
        if (pipeline == null) {
            throw new IllegalArgumentException("pipeline is required");
        }
        PipelineGraph graph = PipelineGraph.of(pipeline);
        Map<String, String> args = arguments != null ? arguments : Map.of();
        checkArguments(pipeline, args);

        PipelineRun run = PipelineRun.builder()
                .id(UUID.randomUUID().toString())
                .pipeline(pipeline)
                .arguments(args)
                .annotations(annotations != null ? new LinkedHashMap<>(annotations) : Map.of())
                .status(RunStatus.PENDING)
                .createdAt(Instant.now())
                .build();

        store.createRun(run, graph.topologicalOrder());
        log.info("Submitted run {} of pipeline '{}' with {} tasks", run.id(), pipeline.name(), pipeline.tasks().size());
        notifier.fire();
        return run;
    }

    private static void checkArguments(PipelineSpec pipeline, Map<String, String> arguments) {
        List<String> problems = new ArrayList<>();
        for (String name : arguments.keySet()) {
            if (pipeline.input(name).isEmpty()) {
                problems.add("argument '" + name + "' does not match any pipeline input");
            }
        }
        for (InputSpec input : pipeline.inputs()) {
            if (input.isRequired() && !arguments.containsKey(input.name())) {
                problems.add("required pipeline input '" + input.name() + "' was not supplied");
            }
        }
        if (!problems.isEmpty()) {
            throw new GraphValidationException(problems);
        }
    }

    public Optional<RunState> getRun(String runId) {
        return store.getRunState(runId);
    }

    public List<PipelineRun> listRuns(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return store.listRuns(limit);
    }

    /**
     * Request cancellation of a run.
     *
     * @return false if the run is unknown or already terminal
     */
    public boolean cancel(String runId) {
        return controller.requestCancellation(runId);
    }

    /**
     * Artifact URIs of the pipeline outputs that have been produced so far.
     */
    public Map<String, String> outputs(String runId) {
        RunState state = store.getRunState(runId)
                .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));
        Map<String, String> outputs = new LinkedHashMap<>();
        for (Map.Entry<String, ArgumentSource.TaskOutput> entry : state.run().pipeline().outputs().entrySet()) {
            ArgumentSource.TaskOutput ref = entry.getValue();
            TaskExecution producer = state.tasks().get(ref.taskId());
            if (producer != null && producer.outputs().containsKey(ref.outputName())) {
                outputs.put(entry.getKey(), producer.outputs().get(ref.outputName()));
            }
        }
        return outputs;
    }

    public List<TaskAttempt> attempts(String runId, String taskId) {
        RunState state = store.getRunState(runId)
                .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));
        if (!state.tasks().containsKey(taskId)) {
            throw new IllegalArgumentException("Task not found: " + taskId);
        }
        return store.listAttempts(runId, taskId);
    }

    /**
     * Read the log of the task's current attempt, or of its latest archived attempt
     * while the task waits for a retry.
     *
     * @return empty if the task never started or its log has not been written
     * @throws IllegalArgumentException if the run or task does not exist
     */
    public Optional<TaskLog> taskLog(String runId, String taskId) {
        RunState state = store.getRunState(runId)
                .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));
        TaskExecution execution = state.tasks().get(taskId);
        if (execution == null) {
            throw new IllegalArgumentException("Task not found: " + taskId);
        }

        String executionId = execution.executionId();
        if (executionId == null) {
            List<TaskAttempt> attempts = store.listAttempts(runId, taskId);
            if (attempts.isEmpty()) {
                return Optional.empty();
            }
            executionId = attempts.get(attempts.size() - 1).executionId();
        }

        String uri = layout.logUri(executionId);
        try {
            String content = Files.readString(Path.of(uri));
            return Optional.of(new TaskLog(runId, taskId, executionId, uri, content));
        } catch (NoSuchFileException e) {
            log.debug("No log yet for task {}/{} at {}", runId, taskId, uri);
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read log " + uri, e);
        }
    }

    /**
     * Drive a run in the calling thread until it is terminal.
     */
    public RunStatus awaitCompletion(String runId) throws InterruptedException {
        return controller.runToCompletion(runId);
    }
}

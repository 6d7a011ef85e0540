package conveyor.orchestrator.service;

import conveyor.orchestrator.config.OrchestratorConfig;
import conveyor.orchestrator.core.ChangeNotifier;
import conveyor.orchestrator.graph.PipelineGraph;
import conveyor.orchestrator.model.FailurePolicy;
import conveyor.orchestrator.model.PipelineRun;
import conveyor.orchestrator.model.RunState;
import conveyor.orchestrator.model.RunStatus;
import conveyor.orchestrator.model.TaskExecution;
import conveyor.orchestrator.model.TaskStatus;
import conveyor.orchestrator.repository.ExecutionStateStore;
import conveyor.orchestrator.repository.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Drives pipeline runs to completion.
 * <p>
 * A step re-reads the run from the store, observes in-flight tasks, skips tasks
 * blocked by failures, dispatches ready tasks concurrently (bounded by the per-run
 * and global in-flight limits) and finalizes the run once every task is terminal.
 * Nothing is kept between steps, so any process can resume a run after a restart.
 */
public class PipelineRunController {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunController.class);

    private final ExecutionStateStore store;
    private final Dispatcher dispatcher;
    private final ReadinessResolver resolver;
    private final ChangeNotifier notifier;
    private final ExecutorService dispatchPool;
    private final OrchestratorConfig config;

    public PipelineRunController(ExecutionStateStore store, Dispatcher dispatcher, ReadinessResolver resolver,
            ChangeNotifier notifier, ExecutorService dispatchPool, OrchestratorConfig config) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.resolver = resolver;
        this.notifier = notifier;
        this.dispatchPool = dispatchPool;
        this.config = config;
    }

    /**
     * Advance a run by one iteration.
     *
     * @return the run's status after the step
     * @throws IllegalArgumentException if the run does not exist
     */
    public RunStatus step(String runId) {
        RunState state = load(runId);
        PipelineRun run = state.run();
        if (run.isTerminal()) {
            return run.status();
        }

        if (run.status() == RunStatus.PENDING && store.transitionRun(runId, RunStatus.PENDING, RunStatus.RUNNING, null)) {
            log.info("Run {} started ({} tasks)", runId, state.tasks().size());
        }

        PipelineGraph graph = PipelineGraph.of(run.pipeline());

        if (run.cancelRequested()) {
            return cancelRun(state);
        }

        if (observeInFlight(graph, state)) {
            state = load(runId);
        }

        boolean hardFailure = hasRequiredFailure(graph, state);
        FailurePolicy policy = config.failurePolicy();
        if (hardFailure && policy != FailurePolicy.CONTINUE) {
            stopAfterFailure(state, policy);
            state = load(runId);
        } else {
            ReadinessResolver.Readiness readiness = resolver.resolve(graph, state, Instant.now());
            if (applySkips(state, readiness.skipped())) {
                state = load(runId);
                readiness = resolver.resolve(graph, state, Instant.now());
            }
            if (dispatchReady(graph, state, readiness.ready())) {
                state = load(runId);
            }
            if (failStuckTasks(state, readiness)) {
                state = load(runId);
            }
        }

        return finalizeIfDone(graph, state);
    }

    /**
     * Step the run until it is terminal, waiting for change notifications or the
     * poll interval between steps.
     *
     * @return the terminal status
     */
    public RunStatus runToCompletion(String runId) throws InterruptedException {
        while (true) {
            long seen = notifier.version();
            RunStatus status;
            try {
                status = step(runId);
            } catch (StateStoreException e) {
                log.error("Store error while stepping run {}, retrying", runId, e);
                status = RunStatus.RUNNING;
            }
            if (status.isTerminal()) {
                return status;
            }
            notifier.awaitChange(seen, config.pollInterval());
        }
    }

    /**
     * Ask a run to stop. The next step cancels in-flight tasks and marks the run CANCELLED.
     *
     * @return false if the run is unknown or already terminal
     */
    public boolean requestCancellation(String runId) {
        boolean accepted = store.requestCancellation(runId);
        if (accepted) {
            log.info("Cancellation requested for run {}", runId);
            notifier.fire();
        }
        return accepted;
    }

    private RunState load(String runId) {
        return store.getRunState(runId).orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));
    }

    /**
     * Poll RUNNING tasks and reconcile STARTING tasks whose launch went stale.
     *
     * @return true if any task changed status
     */
    private boolean observeInFlight(PipelineGraph graph, RunState state) {
        Instant staleCutoff = Instant.now().minus(config.staleStartThreshold());
        boolean changed = false;
        for (TaskExecution execution : state.tasks().values()) {
            DispatchOutcome outcome = null;
            if (execution.status() == TaskStatus.RUNNING) {
                outcome = dispatcher.observe(graph, execution);
            } else if (execution.status() == TaskStatus.STARTING
                    && execution.startedAt() != null
                    && execution.startedAt().isBefore(staleCutoff)) {
                outcome = dispatcher.reconcileUnknown(execution);
            }
            if (outcome != null && outcome != DispatchOutcome.STILL_RUNNING && outcome != DispatchOutcome.NOT_CLAIMED) {
                changed = true;
            }
        }
        return changed;
    }

    private boolean applySkips(RunState state, Map<String, String> skipped) {
        boolean changed = false;
        for (Map.Entry<String, String> entry : skipped.entrySet()) {
            TaskExecution execution = state.tasks().get(entry.getKey());
            if (execution != null && dispatcher.skip(execution, "Upstream task " + entry.getValue() + " did not succeed")) {
                log.info("Task {}/{} skipped: upstream {} did not succeed", execution.runId(), entry.getKey(), entry.getValue());
                changed = true;
            }
        }
        return changed;
    }

    private boolean dispatchReady(PipelineGraph graph, RunState state, List<String> ready) {
        if (ready.isEmpty()) {
            return false;
        }

        int runSlots = config.maxInFlightPerRun() - (int) state.inFlight();
        int globalSlots = config.maxInFlightGlobal() - store.countInFlight();
        int slots = Math.min(runSlots, globalSlots);
        if (slots <= 0) {
            log.debug("Run {}: {} ready tasks waiting for in-flight slots", state.run().id(), ready.size());
            return false;
        }

        List<String> batch = ready.size() > slots ? ready.subList(0, slots) : ready;
        List<Future<DispatchOutcome>> futures = new ArrayList<>(batch.size());
        for (String taskId : batch) {
            futures.add(dispatchPool.submit(() -> dispatcher.dispatch(graph, state, taskId)));
        }

        boolean changed = false;
        for (int i = 0; i < futures.size(); i++) {
            try {
                DispatchOutcome outcome = futures.get(i).get();
                if (outcome != DispatchOutcome.NOT_CLAIMED) {
                    changed = true;
                }
            } catch (ExecutionException e) {
                log.error("Dispatch of task {}/{} failed", state.run().id(), batch.get(i), e.getCause());
                changed = true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (changed) {
            notifier.fire();
        }
        return changed;
    }

    /**
     * PENDING tasks that are neither ready, nor waiting for backoff, nor waiting for a
     * non-terminal upstream can never run: their inputs reference outputs that were not
     * recorded. Fail them so the run can finish.
     */
    private boolean failStuckTasks(RunState state, ReadinessResolver.Readiness readiness) {
        if (state.inFlight() > 0 || !readiness.ready().isEmpty()) {
            return false;
        }
        boolean changed = false;
        Instant now = Instant.now();
        PipelineGraph graph = PipelineGraph.of(state.run().pipeline());
        for (TaskExecution execution : state.tasks().values()) {
            if (execution.status() != TaskStatus.PENDING || !execution.isDue(now)) {
                continue;
            }
            boolean upstreamActive = graph.upstreamOf(execution.taskId()).stream()
                    .map(state::statusOf)
                    .anyMatch(s -> s == null || !s.isTerminal());
            if (!upstreamActive && dispatcher.fail(execution, "Inputs can never be resolved") == DispatchOutcome.FAILED) {
                log.error("Task {}/{} failed: inputs can never be resolved", execution.runId(), execution.taskId());
                changed = true;
            }
        }
        return changed;
    }

    private void stopAfterFailure(RunState state, FailurePolicy policy) {
        for (TaskExecution execution : state.tasks().values()) {
            if (execution.status() == TaskStatus.PENDING) {
                dispatcher.skip(execution, "Run stopped after a task failure");
            } else if (policy == FailurePolicy.CANCEL && execution.status().isInFlight()) {
                dispatcher.cancel(execution, "Cancelled after a task failure");
            }
        }
        log.info("Run {} applied {} failure policy", state.run().id(), policy);
    }

    private RunStatus cancelRun(RunState state) {
        String runId = state.run().id();
        int cancelled = 0;
        for (TaskExecution execution : state.tasks().values()) {
            if (!execution.status().isTerminal()
                    && dispatcher.cancel(execution, "Run cancelled") == DispatchOutcome.CANCELLED) {
                cancelled++;
            }
        }

        RunState after = load(runId);
        if (!after.allTasksTerminal()) {
            // A dispatcher moved a task between our read and our CAS; the next step retries.
            return after.run().status();
        }
        if (store.transitionRun(runId, RunStatus.RUNNING, RunStatus.CANCELLED, "Cancelled by request")) {
            log.info("Run {} cancelled ({} tasks cancelled)", runId, cancelled);
            notifier.fire();
        }
        return load(runId).run().status();
    }

    private boolean hasRequiredFailure(PipelineGraph graph, RunState state) {
        for (TaskExecution execution : state.tasks().values()) {
            if (execution.status() == TaskStatus.FAILED && !graph.task(execution.taskId()).optional()) {
                return true;
            }
        }
        return false;
    }

    private RunStatus finalizeIfDone(PipelineGraph graph, RunState state) {
        PipelineRun run = state.run();
        if (!state.allTasksTerminal()) {
            return run.status();
        }

        List<String> failedRequired = new ArrayList<>();
        for (TaskExecution execution : state.tasks().values()) {
            TaskStatus status = execution.status();
            if ((status == TaskStatus.FAILED || status == TaskStatus.CANCELLED)
                    && !graph.task(execution.taskId()).optional()) {
                failedRequired.add(execution.taskId());
            }
        }

        RunStatus target = failedRequired.isEmpty() ? RunStatus.SUCCEEDED : RunStatus.FAILED;
        String message = failedRequired.isEmpty() ? null : "Required tasks did not succeed: " + failedRequired;
        if (store.transitionRun(run.id(), RunStatus.RUNNING, target, message)) {
            Duration took = run.startedAt() != null ? Duration.between(run.startedAt(), Instant.now()) : Duration.ZERO;
            log.info("Run {} finished: {} in {}ms", run.id(), target, took.toMillis());
            notifier.fire();
            return target;
        }
        return load(run.id()).run().status();
    }
}

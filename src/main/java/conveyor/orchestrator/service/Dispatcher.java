package conveyor.orchestrator.service;

import conveyor.orchestrator.config.OrchestratorConfig;
import conveyor.orchestrator.graph.PipelineGraph;
import conveyor.orchestrator.launcher.LaunchFailureException;
import conveyor.orchestrator.launcher.LaunchSpec;
import conveyor.orchestrator.launcher.Launcher;
import conveyor.orchestrator.launcher.LauncherUnreachableException;
import conveyor.orchestrator.launcher.PollResult;
import conveyor.orchestrator.model.ComponentSpec;
import conveyor.orchestrator.model.ContainerSpec;
import conveyor.orchestrator.model.OutputSpec;
import conveyor.orchestrator.model.ResolvedInput;
import conveyor.orchestrator.model.RunState;
import conveyor.orchestrator.model.TaskExecution;
import conveyor.orchestrator.model.TaskSpec;
import conveyor.orchestrator.model.TaskStatus;
import conveyor.orchestrator.repository.ExecutionStateStore;
import conveyor.orchestrator.util.Annotations;
import conveyor.orchestrator.util.ExecutionIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;

/**
 * Moves single tasks through their state machine.
 * <p>
 * A task is claimed by the CAS {@code PENDING -> STARTING}; losing the claim is a
 * no-op, so at most one launch happens per attempt even with several dispatchers.
 * Every later transition is also a CAS on the execution the dispatcher last observed,
 * so a decision made on an outdated snapshot is never applied.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final ExecutionStateStore store;
    private final Launcher launcher;
    private final ArtifactRouter router;
    private final ArtifactLayout layout;
    private final OrchestratorConfig config;

    public Dispatcher(ExecutionStateStore store, Launcher launcher, ArtifactRouter router,
            ArtifactLayout layout, OrchestratorConfig config) {
        this.store = store;
        this.launcher = launcher;
        this.router = router;
        this.layout = layout;
        this.config = config;
    }

    /**
     * Claim, resolve and launch one PENDING task.
     *
     * @param graph  validated graph of the run
     * @param state  snapshot the caller based its readiness decision on
     * @param taskId task to dispatch
     */
    public DispatchOutcome dispatch(PipelineGraph graph, RunState state, String taskId) {
        TaskExecution current = state.tasks().get(taskId);
        if (current == null || current.status() != TaskStatus.PENDING) {
            return DispatchOutcome.NOT_CLAIMED;
        }

        Instant now = Instant.now();
        if (!current.isDue(now)) {
            log.debug("Task {}/{} backing off until {}", current.runId(), taskId, current.notBefore());
            return DispatchOutcome.NOT_CLAIMED;
        }
        TaskExecution claimed = current.toBuilder()
                .status(TaskStatus.STARTING)
                .executionId(ExecutionIds.generate())
                .handle(null)
                .notBefore(null)
                .errorMessage(null)
                .startedAt(now)
                .finishedAt(null)
                .outputs(Map.of())
                .build();

        if (!store.transitionTask(current, claimed)) {
            log.debug("Task {}/{} already claimed", current.runId(), taskId);
            return DispatchOutcome.NOT_CLAIMED;
        }

        TaskSpec task = graph.task(taskId);

        Map<String, ResolvedInput> inputs;
        try {
            inputs = router.resolveInputs(graph, taskId, state);
        } catch (UnresolvedReferenceException e) {
            log.error("Task {}/{} has unresolvable inputs: {}", claimed.runId(), taskId, e.getMessage());
            return fail(claimed, e.getMessage());
        }
        claimed = claimed.toBuilder().resolvedInputs(inputs).build();

        LaunchSpec spec = launchSpec(state, task, claimed);
        String handle;
        try {
            handle = launcher.launch(spec);
        } catch (LauncherUnreachableException e) {
            return infraRetry(claimed, e.getMessage());
        } catch (LaunchFailureException e) {
            log.warn("Launch of task {}/{} failed: {}", claimed.runId(), taskId, e.getMessage());
            return retryOrFail(claimed, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected launcher error for task {}/{}", claimed.runId(), taskId, e);
            return retryOrFail(claimed, "Launcher error: " + e);
        }

        TaskExecution running = claimed.toBuilder().status(TaskStatus.RUNNING).handle(handle).build();
        if (!store.transitionTask(claimed, running)) {
            // Cancelled or reaped while the launch was in progress.
            log.warn("Task {}/{} left STARTING during launch, cancelling handle {}", claimed.runId(), taskId, handle);
            cancelQuietly(handle);
            return DispatchOutcome.NOT_CLAIMED;
        }

        log.info("Task {}/{} launched: execution={}, handle={}", claimed.runId(), taskId, claimed.executionId(), handle);
        return DispatchOutcome.LAUNCHED;
    }

    /**
     * Poll a RUNNING task and apply the result.
     */
    public DispatchOutcome observe(PipelineGraph graph, TaskExecution execution) {
        if (execution.status() != TaskStatus.RUNNING) {
            return DispatchOutcome.NOT_CLAIMED;
        }

        PollResult result;
        try {
            result = launcher.poll(execution.handle());
        } catch (LauncherUnreachableException e) {
            log.warn("Cannot poll task {}/{} (handle {}): {}", execution.runId(), execution.taskId(),
                    execution.handle(), e.getMessage());
            return DispatchOutcome.STILL_RUNNING;
        } catch (RuntimeException e) {
            log.error("Poll of task {}/{} (handle {}) failed", execution.runId(), execution.taskId(),
                    execution.handle(), e);
            return DispatchOutcome.STILL_RUNNING;
        }

        switch (result.status()) {
            case RUNNING:
                return DispatchOutcome.STILL_RUNNING;
            case SUCCEEDED:
                return succeed(graph.task(execution.taskId()).component(), execution, result);
            case FAILED:
                log.warn("Task {}/{} attempt {} failed: {}", execution.runId(), execution.taskId(),
                        execution.executionId(), result.message());
                return retryOrFail(execution, result.message());
            default:
                log.warn("Task {}/{} handle {} lost: {}", execution.runId(), execution.taskId(),
                        execution.handle(), result.message());
                return retryOrFail(execution, "Outcome unknown: " + result.message());
        }
    }

    /**
     * Treat a STARTING task whose launch never completed as an attempt with unknown outcome.
     */
    public DispatchOutcome reconcileUnknown(TaskExecution execution) {
        if (execution.status() != TaskStatus.STARTING) {
            return DispatchOutcome.NOT_CLAIMED;
        }
        log.warn("Task {}/{} stuck in STARTING since {}, treating as failed attempt",
                execution.runId(), execution.taskId(), execution.startedAt());
        return retryOrFail(execution, "Launch outcome unknown (stale STARTING)");
    }

    /**
     * Mark a non-terminal task CANCELLED, forwarding the cancellation to the launcher
     * when an attempt is in flight. The launcher side is best effort.
     */
    public DispatchOutcome cancel(TaskExecution execution, String reason) {
        if (execution.status().isTerminal()) {
            return DispatchOutcome.NOT_CLAIMED;
        }
        if (execution.status() == TaskStatus.RUNNING && execution.handle() != null) {
            cancelQuietly(execution.handle());
        }
        TaskExecution cancelled = execution.toBuilder()
                .status(TaskStatus.CANCELLED)
                .errorMessage(reason)
                .finishedAt(Instant.now())
                .build();
        return store.transitionTask(execution, cancelled)
                ? DispatchOutcome.CANCELLED
                : DispatchOutcome.NOT_CLAIMED;
    }

    /**
     * Mark a PENDING task SKIPPED.
     */
    public boolean skip(TaskExecution execution, String reason) {
        if (execution.status() != TaskStatus.PENDING) {
            return false;
        }
        TaskExecution skipped = execution.toBuilder()
                .status(TaskStatus.SKIPPED)
                .errorMessage(reason)
                .finishedAt(Instant.now())
                .build();
        return store.transitionTask(execution, skipped);
    }

    /**
     * Mark a task FAILED without consuming retries.
     */
    public DispatchOutcome fail(TaskExecution execution, String reason) {
        TaskExecution failed = execution.toBuilder()
                .status(TaskStatus.FAILED)
                .errorMessage(reason)
                .finishedAt(Instant.now())
                .build();
        return store.transitionTask(execution, failed) ? DispatchOutcome.FAILED : DispatchOutcome.NOT_CLAIMED;
    }

    private DispatchOutcome succeed(ComponentSpec component, TaskExecution execution, PollResult result) {
        for (OutputSpec output : component.outputs()) {
            if (!result.outputs().containsKey(output.name())) {
                String message = "Declared output '" + output.name() + "' was not produced";
                log.warn("Task {}/{}: {}", execution.runId(), execution.taskId(), message);
                return retryOrFail(execution, message);
            }
        }
        for (OutputSpec output : component.outputs()) {
            store.recordTaskOutput(execution.runId(), execution.taskId(), output.name(),
                    result.outputs().get(output.name()));
        }

        TaskExecution succeeded = execution.toBuilder()
                .status(TaskStatus.SUCCEEDED)
                .errorMessage(null)
                .finishedAt(Instant.now())
                .build();
        if (!store.transitionTask(execution, succeeded)) {
            return DispatchOutcome.NOT_CLAIMED;
        }
        log.info("Task {}/{} succeeded", execution.runId(), execution.taskId());
        return DispatchOutcome.SUCCEEDED;
    }

    /**
     * Apply the retry policy to a failed attempt: back to PENDING with exponential
     * backoff while the retry count stays within {@code maxRetries}, FAILED otherwise.
     */
    DispatchOutcome retryOrFail(TaskExecution execution, String reason) {
        int retry = execution.retryCount() + 1;
        if (retry > config.maxRetries()) {
            DispatchOutcome outcome = fail(execution, reason);
            if (outcome == DispatchOutcome.FAILED) {
                log.warn("Task {}/{} failed permanently after {} retries: {}",
                        execution.runId(), execution.taskId(), execution.retryCount(), reason);
            }
            return outcome;
        }

        TaskExecution retried = resetForRetry(execution)
                .retryCount(retry)
                .notBefore(Instant.now().plus(config.backoffFor(retry)))
                .errorMessage(reason)
                .build();
        if (!store.transitionTask(execution, retried)) {
            return DispatchOutcome.NOT_CLAIMED;
        }
        log.info("Task {}/{} scheduled for retry {} of {}", execution.runId(), execution.taskId(),
                retry, config.maxRetries());
        return DispatchOutcome.RETRY_SCHEDULED;
    }

    private DispatchOutcome infraRetry(TaskExecution execution, String reason) {
        int infraRetry = execution.infraRetryCount() + 1;
        if (infraRetry > config.maxInfraRetries()) {
            log.warn("Task {}/{} exhausted {} infrastructure retries, counting as a failed attempt",
                    execution.runId(), execution.taskId(), config.maxInfraRetries());
            return retryOrFail(execution, "Launcher unreachable: " + reason);
        }

        TaskExecution retried = resetForRetry(execution)
                .infraRetryCount(infraRetry)
                .notBefore(Instant.now().plus(config.backoffFor(infraRetry)))
                .errorMessage("Launcher unreachable: " + reason)
                .build();
        if (!store.transitionTask(execution, retried)) {
            return DispatchOutcome.NOT_CLAIMED;
        }
        log.warn("Launcher unreachable for task {}/{} (infra retry {}): {}",
                execution.runId(), execution.taskId(), infraRetry, reason);
        return DispatchOutcome.INFRA_RETRY;
    }

    private static TaskExecution.Builder resetForRetry(TaskExecution execution) {
        return execution.toBuilder()
                .status(TaskStatus.PENDING)
                .executionId(null)
                .handle(null)
                .resolvedInputs(Map.of())
                .startedAt(null)
                .finishedAt(null);
    }

    private LaunchSpec launchSpec(RunState state, TaskSpec task, TaskExecution claimed) {
        ContainerSpec container = task.component().implementation();
        String executionId = claimed.executionId();
        return new LaunchSpec(
                claimed.runId(),
                task.id(),
                executionId,
                container != null ? container.image() : null,
                container != null ? container.command() : null,
                container != null ? container.args() : null,
                claimed.resolvedInputs(),
                layout.outputUris(executionId, task.component()),
                layout.logUri(executionId),
                container != null ? container.env() : null,
                Annotations.merge(config.defaultTaskAnnotations(), state.run().annotations(), task.annotations()));
    }

    private void cancelQuietly(String handle) {
        try {
            if (!launcher.cancel(handle)) {
                log.debug("Launcher did not accept cancellation of {}", handle);
            }
        } catch (RuntimeException e) {
            log.warn("Cancellation of {} failed: {}", handle, e.getMessage());
        }
    }
}

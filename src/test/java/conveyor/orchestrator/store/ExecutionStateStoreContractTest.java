package conveyor.orchestrator.store;

import conveyor.orchestrator.model.PipelineRun;
import conveyor.orchestrator.model.ResolvedInput;
import conveyor.orchestrator.model.RunState;
import conveyor.orchestrator.model.RunStatus;
import conveyor.orchestrator.model.TaskAttempt;
import conveyor.orchestrator.model.TaskExecution;
import conveyor.orchestrator.model.TaskStatus;
import conveyor.orchestrator.model.TestPipelines;
import conveyor.orchestrator.repository.ExecutionStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link ExecutionStateStore} must share.
 */
abstract class ExecutionStateStoreContractTest {

    protected ExecutionStateStore store;

    protected abstract ExecutionStateStore createStore();

    @BeforeEach
    void createFreshStore() {
        store = createStore();
    }

    private RunState createChain(String runId) {
        store.createRun(TestPipelines.run(runId, TestPipelines.chain()), List.of("A", "B", "C"));
        return store.getRunState(runId).orElseThrow();
    }

    private TaskExecution task(String runId, String taskId) {
        return store.getRunState(runId).orElseThrow().task(taskId).orElseThrow();
    }

    private TaskExecution start(String runId, String taskId, String executionId) {
        TaskExecution pending = task(runId, taskId);
        TaskExecution starting = pending.toBuilder()
                .status(TaskStatus.STARTING)
                .executionId(executionId)
                .startedAt(Instant.now().truncatedTo(ChronoUnit.MILLIS))
                .build();
        assertTrue(store.transitionTask(pending, starting));
        TaskExecution running = starting.toBuilder()
                .status(TaskStatus.RUNNING)
                .handle("h-" + executionId)
                .resolvedInputs(Map.of("in", ResolvedInput.artifact("/data/x")))
                .build();
        assertTrue(store.transitionTask(starting, running));
        return running;
    }

    @Test
    void createRunMakesPendingExecutionsInOrder() {
        RunState state = createChain("run-1");

        assertEquals(RunStatus.PENDING, state.run().status());
        assertEquals(List.of("A", "B", "C"), List.copyOf(state.tasks().keySet()));
        assertEquals(3, state.count(TaskStatus.PENDING));
        assertEquals("chain", state.run().pipeline().name());
        assertEquals("B", state.run().pipeline().tasks().get(1).id());
    }

    @Test
    void unknownRunIsEmpty() {
        assertTrue(store.getRunState("nope").isEmpty());
        assertTrue(store.findRun("nope").isEmpty());
        assertFalse(store.requestCancellation("nope"));
    }

    @Test
    void transitionTaskIsCompareAndSet() {
        createChain("run-cas");
        TaskExecution pending = task("run-cas", "A");
        TaskExecution starting = pending.toBuilder().status(TaskStatus.STARTING).executionId("e1")
                .startedAt(Instant.now()).build();

        assertTrue(store.transitionTask(pending, starting));
        assertFalse(store.transitionTask(pending, starting));
        assertEquals(TaskStatus.STARTING, task("run-cas", "A").status());
        assertEquals("e1", task("run-cas", "A").executionId());
    }

    @Test
    void snapshotFromBeforeARetryCannotClaimTheTask() {
        createChain("run-aba");
        TaskExecution before = task("run-aba", "A");
        TaskExecution running = start("run-aba", "A", "e1");
        Instant backoff = Instant.now().plusSeconds(3600).truncatedTo(ChronoUnit.MILLIS);
        assertTrue(store.transitionTask(running, running.toBuilder()
                .status(TaskStatus.PENDING)
                .executionId(null)
                .handle(null)
                .retryCount(1)
                .notBefore(backoff)
                .build()));
        assertEquals(TaskStatus.PENDING, task("run-aba", "A").status());

        TaskExecution staleClaim = before.toBuilder().status(TaskStatus.STARTING).executionId("e2")
                .startedAt(Instant.now()).build();

        assertFalse(store.transitionTask(before, staleClaim));
        TaskExecution a = task("run-aba", "A");
        assertEquals(TaskStatus.PENDING, a.status());
        assertEquals(1, a.retryCount());
        assertEquals(backoff, a.notBefore());
    }

    @Test
    void infraRetryAlsoInvalidatesOlderSnapshots() {
        createChain("run-infra");
        TaskExecution before = task("run-infra", "A");
        TaskExecution starting = before.toBuilder().status(TaskStatus.STARTING).executionId("e1")
                .startedAt(Instant.now()).build();
        assertTrue(store.transitionTask(before, starting));
        assertTrue(store.transitionTask(starting, starting.toBuilder()
                .status(TaskStatus.PENDING).executionId(null).infraRetryCount(1).build()));

        assertFalse(store.transitionTask(before, before.toBuilder().status(TaskStatus.SKIPPED).build()));
        assertEquals(1, task("run-infra", "A").infraRetryCount());
    }

    @Test
    void transitionRequiresMatchingExecutionId() {
        createChain("run-exec");
        TaskExecution running = start("run-exec", "A", "e1");
        TaskExecution other = running.toBuilder().executionId("e-other").build();

        assertFalse(store.transitionTask(other, other.toBuilder().status(TaskStatus.SUCCEEDED).build()));
        assertTrue(store.transitionTask(running, running.toBuilder().status(TaskStatus.SUCCEEDED).build()));
    }

    @Test
    void runningTaskKeepsResolvedInputs() {
        createChain("run-inputs");
        start("run-inputs", "A", "e1");

        TaskExecution a = task("run-inputs", "A");
        assertEquals(TaskStatus.RUNNING, a.status());
        assertEquals("h-e1", a.handle());
        assertEquals(ResolvedInput.artifact("/data/x"), a.resolvedInputs().get("in"));
    }

    @Test
    void outputsAreRecordedAndOverwritten() {
        createChain("run-out");
        store.recordTaskOutput("run-out", "A", "out", "/data/first");
        store.recordTaskOutput("run-out", "A", "out", "/data/second");
        store.recordTaskOutput("run-out", "A", "log", "/data/log");

        assertEquals(Map.of("out", "/data/second", "log", "/data/log"), task("run-out", "A").outputs());
        assertTrue(task("run-out", "B").outputs().isEmpty());
    }

    @Test
    void retryArchivesAttemptAndClearsOutputs() {
        createChain("run-retry");
        TaskExecution running = start("run-retry", "A", "e1");
        store.recordTaskOutput("run-retry", "A", "out", "/data/partial");

        TaskExecution retried = running.toBuilder()
                .status(TaskStatus.PENDING)
                .executionId(null)
                .handle(null)
                .retryCount(1)
                .errorMessage("exit 1")
                .startedAt(null)
                .build();
        assertTrue(store.transitionTask(running, retried));

        assertTrue(task("run-retry", "A").outputs().isEmpty());
        List<TaskAttempt> attempts = store.listAttempts("run-retry", "A");
        assertEquals(1, attempts.size());
        TaskAttempt attempt = attempts.get(0);
        assertEquals(1, attempt.attempt());
        assertEquals("e1", attempt.executionId());
        assertEquals("h-e1", attempt.handle());
        assertEquals(TaskStatus.FAILED, attempt.status());
        assertEquals("exit 1", attempt.errorMessage());
        assertNotNull(attempt.startedAt());
        assertNotNull(attempt.finishedAt());
    }

    @Test
    void successArchivesSucceededAttempt() {
        createChain("run-ok");
        TaskExecution running = start("run-ok", "A", "e1");
        store.recordTaskOutput("run-ok", "A", "out", "/data/out");

        assertTrue(store.transitionTask(running,
                running.toBuilder().status(TaskStatus.SUCCEEDED).finishedAt(Instant.now()).build()));

        assertEquals("/data/out", task("run-ok", "A").outputs().get("out"));
        assertEquals(TaskStatus.SUCCEEDED, store.listAttempts("run-ok", "A").get(0).status());
        assertTrue(store.listAttempts("run-ok", "B").isEmpty());
    }

    @Test
    void attemptsAreNumberedSequentially() {
        createChain("run-seq");
        for (int i = 1; i <= 3; i++) {
            TaskExecution running = start("run-seq", "A", "e" + i);
            assertTrue(store.transitionTask(running, running.toBuilder()
                    .status(TaskStatus.PENDING).retryCount(i).build()));
        }

        assertEquals(List.of(1, 2, 3), store.listAttempts("run-seq", "A").stream().map(TaskAttempt::attempt).toList());
        assertEquals(List.of("e1", "e2", "e3"),
                store.listAttempts("run-seq", "A").stream().map(TaskAttempt::executionId).toList());
    }

    @Test
    void runTransitionsSetTimestamps() {
        createChain("run-ts");

        assertFalse(store.transitionRun("run-ts", RunStatus.RUNNING, RunStatus.SUCCEEDED, null));
        assertTrue(store.transitionRun("run-ts", RunStatus.PENDING, RunStatus.RUNNING, null));
        assertNotNull(store.findRun("run-ts").orElseThrow().startedAt());
        assertNull(store.findRun("run-ts").orElseThrow().finishedAt());

        assertTrue(store.transitionRun("run-ts", RunStatus.RUNNING, RunStatus.FAILED, "B failed"));
        PipelineRun run = store.findRun("run-ts").orElseThrow();
        assertEquals(RunStatus.FAILED, run.status());
        assertEquals("B failed", run.errorMessage());
        assertNotNull(run.finishedAt());
    }

    @Test
    void cancellationOnlyForActiveRuns() {
        createChain("run-cancel");
        createChain("run-done");
        store.transitionRun("run-done", RunStatus.PENDING, RunStatus.RUNNING, null);
        store.transitionRun("run-done", RunStatus.RUNNING, RunStatus.SUCCEEDED, null);

        assertTrue(store.requestCancellation("run-cancel"));
        assertTrue(store.findRun("run-cancel").orElseThrow().cancelRequested());
        assertFalse(store.requestCancellation("run-done"));
    }

    @Test
    void activeRunsExcludeTerminalOnes() {
        createChain("run-a");
        createChain("run-b");
        store.transitionRun("run-b", RunStatus.PENDING, RunStatus.CANCELLED, null);

        assertEquals(List.of("run-a"), store.findActiveRunIds());
    }

    @Test
    void listRunsNewestFirstWithLimit() throws InterruptedException {
        createChain("run-old");
        Thread.sleep(5);
        createChain("run-mid");
        Thread.sleep(5);
        createChain("run-new");

        List<PipelineRun> runs = store.listRuns(2);
        assertEquals(List.of("run-new", "run-mid"), runs.stream().map(PipelineRun::id).toList());
    }

    @Test
    void inFlightAndStaleStartingAreCounted() {
        createChain("run-flight");
        start("run-flight", "A", "e1");
        TaskExecution pendingB = task("run-flight", "B");
        TaskExecution stale = pendingB.toBuilder()
                .status(TaskStatus.STARTING)
                .executionId("e2")
                .startedAt(Instant.now().minusSeconds(600))
                .build();
        assertTrue(store.transitionTask(pendingB, stale));

        assertEquals(2, store.countInFlight());
        List<TaskExecution> found = store.findStaleStarting(Instant.now().minusSeconds(60));
        assertEquals(1, found.size());
        assertEquals("B", found.get(0).taskId());
        assertTrue(store.findStaleStarting(Instant.now().minusSeconds(3600)).isEmpty());
    }

    @Test
    void readyCandidatesRespectBackoff() {
        createChain("run-ready");
        TaskExecution a = task("run-ready", "A");
        assertTrue(store.transitionTask(a,
                a.toBuilder().retryCount(1).notBefore(Instant.now().plusSeconds(60)).build()));

        List<String> now = store.listReadyCandidates("run-ready", Instant.now()).stream()
                .map(TaskExecution::taskId).toList();
        List<String> later = store.listReadyCandidates("run-ready", Instant.now().plusSeconds(120)).stream()
                .map(TaskExecution::taskId).toList();

        assertEquals(List.of("B", "C"), now);
        assertEquals(List.of("A", "B", "C"), later);
    }

    @Test
    void storeIsHealthy() {
        assertTrue(store.isHealthy());
    }
}

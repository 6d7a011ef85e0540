package conveyor.orchestrator.service;

import conveyor.orchestrator.config.OrchestratorConfig;
import conveyor.orchestrator.graph.PipelineGraph;
import conveyor.orchestrator.launcher.ScriptedLauncher;
import conveyor.orchestrator.launcher.ScriptedLauncher.Step;
import conveyor.orchestrator.model.PipelineRun;
import conveyor.orchestrator.model.RunState;
import conveyor.orchestrator.model.TaskExecution;
import conveyor.orchestrator.model.TaskStatus;
import conveyor.orchestrator.model.TestPipelines;
import conveyor.orchestrator.store.Database;
import conveyor.orchestrator.store.JdbcExecutionStateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DispatcherTest {

    private Database db;
    private JdbcExecutionStateStore store;
    private ScriptedLauncher launcher;
    private OrchestratorConfig config;
    private Dispatcher dispatcher;

    @BeforeEach
    void setUp() {
        db = new Database("jdbc:h2:mem:test-dispatch-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 8);
        store = new JdbcExecutionStateStore(db);
        launcher = new ScriptedLauncher();
        config = OrchestratorConfig.defaults().withRetryBackoff(Duration.ofSeconds(1));
        dispatcher = new Dispatcher(store, launcher, new ArtifactRouter(), new ArtifactLayout("/data", "/logs"), config);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private RunState createSingle(String runId) {
        PipelineRun run = TestPipelines.run(runId, TestPipelines.single());
        store.createRun(run, List.of("A"));
        return store.getRunState(runId).orElseThrow();
    }

    @Test
    @DisplayName("Concurrent dispatchers: exactly one claims the task")
    void concurrentDispatchLaunchesOnce() throws Exception {
        RunState state = createSingle("run-race");
        PipelineGraph graph = PipelineGraph.of(state.run().pipeline());

        int workers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<DispatchOutcome>> futures = new ArrayList<>();
        for (int i = 0; i < workers; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return dispatcher.dispatch(graph, state, "A");
            }));
        }
        start.countDown();

        int launched = 0;
        int notClaimed = 0;
        for (Future<DispatchOutcome> future : futures) {
            DispatchOutcome outcome = future.get(10, TimeUnit.SECONDS);
            if (outcome == DispatchOutcome.LAUNCHED) {
                launched++;
            } else if (outcome == DispatchOutcome.NOT_CLAIMED) {
                notClaimed++;
            }
        }
        pool.shutdownNow();

        assertEquals(1, launched);
        assertEquals(workers - 1, notClaimed);
        assertEquals(1, launcher.launches().size());
        assertEquals(TaskStatus.RUNNING, store.getRunState("run-race").orElseThrow().statusOf("A"));
    }

    @Test
    void launchRecordsHandleAndExecutionId() {
        RunState state = createSingle("run-launch");

        assertEquals(DispatchOutcome.LAUNCHED, dispatcher.dispatch(PipelineGraph.of(state.run().pipeline()), state, "A"));

        TaskExecution a = store.getRunState("run-launch").orElseThrow().task("A").orElseThrow();
        assertEquals("fake-" + a.executionId(), a.handle());
        assertNotNull(a.startedAt());
        assertEquals("/logs/by_execution/" + a.executionId() + "/log.txt", launcher.lastLaunch("A").logUri());
    }

    @Test
    void observeRecordsOutputsOnSuccess() {
        RunState state = createSingle("run-observe");
        PipelineGraph graph = PipelineGraph.of(state.run().pipeline());
        dispatcher.dispatch(graph, state, "A");
        TaskExecution running = store.getRunState("run-observe").orElseThrow().task("A").orElseThrow();

        assertEquals(DispatchOutcome.SUCCEEDED, dispatcher.observe(graph, running));
        assertEquals(DispatchOutcome.NOT_CLAIMED, dispatcher.observe(graph, running),
                "a second observer of the same snapshot loses the CAS");

        TaskExecution done = store.getRunState("run-observe").orElseThrow().task("A").orElseThrow();
        assertEquals(TaskStatus.SUCCEEDED, done.status());
        assertEquals(launcher.lastLaunch("A").outputUris().get("out"), done.outputs().get("out"));
    }

    @Test
    void missingDeclaredOutputIsAFailedAttempt() {
        launcher.script("A", Step.NO_OUTPUTS);
        RunState state = createSingle("run-missing");
        PipelineGraph graph = PipelineGraph.of(state.run().pipeline());
        dispatcher.dispatch(graph, state, "A");
        TaskExecution running = store.getRunState("run-missing").orElseThrow().task("A").orElseThrow();

        assertEquals(DispatchOutcome.RETRY_SCHEDULED, dispatcher.observe(graph, running));

        TaskExecution retried = store.getRunState("run-missing").orElseThrow().task("A").orElseThrow();
        assertEquals(TaskStatus.PENDING, retried.status());
        assertEquals("Declared output 'out' was not produced", retried.errorMessage());
        assertTrue(retried.notBefore().isAfter(Instant.now()));
        assertNull(retried.executionId());
    }

    @Test
    void reconcileUnknownRetriesStaleStart() {
        RunState state = createSingle("run-stale");
        TaskExecution pending = state.task("A").orElseThrow();
        TaskExecution starting = pending.toBuilder()
                .status(TaskStatus.STARTING)
                .executionId("0000000000000000beef")
                .startedAt(Instant.now().minusSeconds(600))
                .build();
        assertTrue(store.transitionTask(pending, starting));

        assertEquals(DispatchOutcome.RETRY_SCHEDULED, dispatcher.reconcileUnknown(starting));
        assertEquals(DispatchOutcome.NOT_CLAIMED, dispatcher.reconcileUnknown(starting));

        assertEquals(1, store.listAttempts("run-stale", "A").size());
        assertEquals("0000000000000000beef", store.listAttempts("run-stale", "A").get(0).executionId());
    }

    @Test
    void skipOnlyAppliesToPendingTasks() {
        RunState state = createSingle("run-skip");
        TaskExecution pending = state.task("A").orElseThrow();

        assertTrue(dispatcher.skip(pending, "upstream failed"));
        assertFalse(dispatcher.skip(pending.toBuilder().status(TaskStatus.SKIPPED).build(), "again"));
        assertEquals(DispatchOutcome.NOT_CLAIMED,
                dispatcher.cancel(store.getRunState("run-skip").orElseThrow().task("A").orElseThrow(), "late"));
    }

    @Test
    void retryOrFailHonoursMaxRetries() {
        config.withMaxRetries(1);
        RunState state = createSingle("run-limit");
        TaskExecution pending = state.task("A").orElseThrow();
        TaskExecution starting = pending.toBuilder()
                .status(TaskStatus.STARTING)
                .retryCount(1)
                .startedAt(Instant.now())
                .build();
        assertTrue(store.transitionTask(pending, starting));

        assertEquals(DispatchOutcome.FAILED, dispatcher.retryOrFail(starting, "boom"));

        TaskExecution failed = store.getRunState("run-limit").orElseThrow().task("A").orElseThrow();
        assertEquals(TaskStatus.FAILED, failed.status());
        assertEquals(1, failed.retryCount());
    }

    @Test
    @DisplayName("A snapshot taken before a retry cannot relaunch the task during its backoff")
    void staleSnapshotDoesNotRelaunchRetriedTask() {
        config.withMaxRetries(1).withRetryBackoff(Duration.ofHours(1));
        launcher.script("A", Step.LAUNCH_FAIL);
        RunState stale = createSingle("run-aba");
        PipelineGraph graph = PipelineGraph.of(stale.run().pipeline());

        assertEquals(DispatchOutcome.RETRY_SCHEDULED, dispatcher.dispatch(graph, stale, "A"));
        assertEquals(DispatchOutcome.NOT_CLAIMED, dispatcher.dispatch(graph, stale, "A"));

        RunState fresh = store.getRunState("run-aba").orElseThrow();
        assertEquals(DispatchOutcome.NOT_CLAIMED, dispatcher.dispatch(graph, fresh, "A"),
                "the retried task is still backing off");

        assertEquals(1, launcher.launchCalls("A"));
        TaskExecution a = store.getRunState("run-aba").orElseThrow().task("A").orElseThrow();
        assertEquals(TaskStatus.PENDING, a.status());
        assertEquals(1, a.retryCount());
        assertTrue(a.notBefore().isAfter(Instant.now().plusSeconds(30)));
    }

    @Test
    void pollErrorLeavesTaskRunning() {
        launcher.script("A", Step.POLL_ERROR);
        RunState state = createSingle("run-poll-error");
        PipelineGraph graph = PipelineGraph.of(state.run().pipeline());
        dispatcher.dispatch(graph, state, "A");
        TaskExecution running = store.getRunState("run-poll-error").orElseThrow().task("A").orElseThrow();

        assertEquals(DispatchOutcome.STILL_RUNNING, dispatcher.observe(graph, running));
        TaskExecution after = store.getRunState("run-poll-error").orElseThrow().task("A").orElseThrow();
        assertEquals(TaskStatus.RUNNING, after.status());
        assertEquals(0, after.retryCount());

        launcher.finish("A", Step.SUCCEED);
        assertEquals(DispatchOutcome.SUCCEEDED, dispatcher.observe(graph, after));
    }

    @Test
    void unrecordedUpstreamOutputFailsWithoutLaunching() {
        PipelineRun run = TestPipelines.run("run-unresolved", TestPipelines.chain());
        store.createRun(run, List.of("A", "B", "C"));
        TaskExecution a = store.getRunState("run-unresolved").orElseThrow().task("A").orElseThrow();
        assertTrue(store.transitionTask(a, a.toBuilder()
                .status(TaskStatus.SUCCEEDED)
                .finishedAt(Instant.now())
                .build()));
        RunState state = store.getRunState("run-unresolved").orElseThrow();

        assertEquals(DispatchOutcome.FAILED, dispatcher.dispatch(PipelineGraph.of(run.pipeline()), state, "B"));

        TaskExecution b = store.getRunState("run-unresolved").orElseThrow().task("B").orElseThrow();
        assertEquals(TaskStatus.FAILED, b.status());
        assertEquals(0, b.retryCount());
        assertTrue(b.errorMessage().contains("was not recorded"));
        assertEquals(0, launcher.launchCalls("B"));
    }
}

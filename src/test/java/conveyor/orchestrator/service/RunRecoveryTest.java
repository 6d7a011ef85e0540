package conveyor.orchestrator.service;

import conveyor.orchestrator.config.OrchestratorConfig;
import conveyor.orchestrator.core.ChangeNotifier;
import conveyor.orchestrator.launcher.ScriptedLauncher;
import conveyor.orchestrator.launcher.ScriptedLauncher.Step;
import conveyor.orchestrator.model.RunState;
import conveyor.orchestrator.model.RunStatus;
import conveyor.orchestrator.model.TaskAttempt;
import conveyor.orchestrator.model.TaskStatus;
import conveyor.orchestrator.model.TestPipelines;
import conveyor.orchestrator.repository.ExecutionStateStore;
import conveyor.orchestrator.store.Database;
import conveyor.orchestrator.store.JdbcExecutionStateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A second orchestrator process picks up runs from the database after the first one stopped.
 */
@Timeout(30)
class RunRecoveryTest {

    private String url;
    private Database firstDb;
    private Database secondDb;
    private ExecutorService dispatchPool;
    private OrchestratorConfig config;

    @BeforeEach
    void setUp() {
        url = "jdbc:h2:mem:test-recovery-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
        dispatchPool = Executors.newFixedThreadPool(2);
        config = OrchestratorConfig.defaults()
                .withRetryBackoff(Duration.ZERO)
                .withPollInterval(Duration.ofMillis(10));
    }

    @AfterEach
    void tearDown() {
        dispatchPool.shutdownNow();
        if (secondDb != null)
            secondDb.close();
        if (firstDb != null)
            firstDb.close();
    }

    private PipelineRunController controller(ExecutionStateStore store, ScriptedLauncher launcher) {
        Dispatcher dispatcher = new Dispatcher(store, launcher, new ArtifactRouter(),
                new ArtifactLayout("/data", "/logs"), config);
        return new PipelineRunController(store, dispatcher, new ReadinessResolver(),
                new ChangeNotifier(), dispatchPool, config);
    }

    @Test
    @DisplayName("Handle lost across a restart: the attempt is retried and the run completes")
    void resumesRunAfterRestart() throws Exception {
        firstDb = new Database(url, 2);
        ExecutionStateStore firstStore = new JdbcExecutionStateStore(firstDb);
        ScriptedLauncher before = new ScriptedLauncher().script("B", Step.HANG);
        PipelineRunController first = controller(firstStore, before);
        String runId = new RunService(firstStore, first, new ChangeNotifier(), new ArtifactLayout("/data", "/logs"))
                .submit(TestPipelines.chain(), Map.of(), Map.of()).id();

        // A finishes, B is left running when the first process goes away
        for (int i = 0; i < 3; i++) {
            first.step(runId);
        }
        RunState interrupted = firstStore.getRunState(runId).orElseThrow();
        assertEquals(TaskStatus.SUCCEEDED, interrupted.tasks().get("A").status());
        assertEquals(TaskStatus.RUNNING, interrupted.tasks().get("B").status());
        String succeededA = interrupted.tasks().get("A").outputs().get("out");

        secondDb = new Database(url, 2);
        ExecutionStateStore secondStore = new JdbcExecutionStateStore(secondDb);
        ScriptedLauncher after = new ScriptedLauncher();
        PipelineRunController second = controller(secondStore, after);

        assertEquals(List.of(runId), secondStore.findActiveRunIds());
        assertEquals(RunStatus.SUCCEEDED, second.runToCompletion(runId));

        RunState recovered = secondStore.getRunState(runId).orElseThrow();
        assertEquals(0, after.launchCalls("A"), "completed work is not redone");
        assertEquals(succeededA, recovered.tasks().get("A").outputs().get("out"));
        assertEquals(1, recovered.tasks().get("B").retryCount());

        List<TaskAttempt> attempts = secondStore.listAttempts(runId, "B");
        assertEquals(2, attempts.size());
        assertEquals(TaskStatus.FAILED, attempts.get(0).status());
        assertEquals(TaskStatus.SUCCEEDED, attempts.get(1).status());
    }

    @Test
    void cancellationRequestedBeforeRestartIsHonoured() {
        firstDb = new Database(url, 2);
        ExecutionStateStore firstStore = new JdbcExecutionStateStore(firstDb);
        ScriptedLauncher before = new ScriptedLauncher().script("A", Step.HANG);
        PipelineRunController first = controller(firstStore, before);
        String runId = new RunService(firstStore, first, new ChangeNotifier(), new ArtifactLayout("/data", "/logs"))
                .submit(TestPipelines.chain(), Map.of(), Map.of()).id();
        first.step(runId);
        assertTrue(first.requestCancellation(runId));

        secondDb = new Database(url, 2);
        ExecutionStateStore secondStore = new JdbcExecutionStateStore(secondDb);
        ScriptedLauncher after = new ScriptedLauncher();

        assertEquals(RunStatus.CANCELLED, controller(secondStore, after).step(runId));
        RunState state = secondStore.getRunState(runId).orElseThrow();
        assertEquals(3, state.count(TaskStatus.CANCELLED));
    }
}

package conveyor.orchestrator.scheduler;

import conveyor.orchestrator.config.Dependencies;
import conveyor.orchestrator.config.OrchestratorConfig;
import conveyor.orchestrator.model.PipelineRun;
import conveyor.orchestrator.model.RunStatus;
import conveyor.orchestrator.model.TestPipelines;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Background driving of runs through the fully wired container.
 */
class SchedulerTest {

    private Dependencies deps;

    @BeforeEach
    void setUp() {
        OrchestratorConfig config = OrchestratorConfig.defaults()
                .withStoreType(OrchestratorConfig.StoreType.MEMORY)
                .withSimulatedTaskDuration(Duration.ofMillis(20))
                .withSweepInterval(Duration.ofMillis(50))
                .withRetryBackoff(Duration.ZERO);
        deps = Dependencies.create(config);
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    private RunStatus waitForTerminal(String runId, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            RunStatus status = deps.store().findRun(runId).orElseThrow().status();
            if (status.isTerminal()) {
                return status;
            }
            Thread.sleep(20);
        }
        return deps.store().findRun(runId).orElseThrow().status();
    }

    @Test
    @DisplayName("Scheduler drives submitted runs to completion without a caller waiting")
    void scheduledSweepsFinishRuns() throws Exception {
        deps.startScheduler();
        assertTrue(deps.scheduler().isRunning());

        PipelineRun run = deps.runService().submit(TestPipelines.chain(), Map.of(), Map.of());

        assertEquals(RunStatus.SUCCEEDED, waitForTerminal(run.id(), Duration.ofSeconds(10)));
    }

    @Test
    void sweepStepsEveryActiveRun() throws Exception {
        PipelineRun first = deps.runService().submit(TestPipelines.single(), Map.of(), Map.of());
        PipelineRun second = deps.runService().submit(TestPipelines.single(), Map.of(), Map.of());
        RunSweeper sweeper = deps.scheduler().runSweeper();

        assertEquals(0, sweeper.sweep());
        assertEquals(RunStatus.RUNNING, deps.store().findRun(first.id()).orElseThrow().status());
        assertEquals(RunStatus.RUNNING, deps.store().findRun(second.id()).orElseThrow().status());

        Thread.sleep(100);
        assertEquals(2, sweeper.sweep());
    }

    @Test
    void stopIsIdempotent() {
        deps.startScheduler();
        deps.stopScheduler();
        deps.stopScheduler();

        assertFalse(deps.scheduler().isRunning());
    }
}

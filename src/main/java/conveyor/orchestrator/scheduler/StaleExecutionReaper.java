package conveyor.orchestrator.scheduler;

import conveyor.orchestrator.config.OrchestratorConfig;
import conveyor.orchestrator.model.TaskExecution;
import conveyor.orchestrator.repository.ExecutionStateStore;
import conveyor.orchestrator.service.DispatchOutcome;
import conveyor.orchestrator.service.Dispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Background task that recovers task executions stuck in STARTING.
 * <p>
 * An execution stays in STARTING when the process that claimed it died before the
 * launcher acknowledged the launch. Whether a container was started is unknown, so
 * the attempt counts as failed: the task is retried if it has retries left,
 * otherwise it is marked FAILED.
 */
public class StaleExecutionReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StaleExecutionReaper.class);

    private final ExecutionStateStore store;
    private final Dispatcher dispatcher;
    private final OrchestratorConfig config;

    public StaleExecutionReaper(ExecutionStateStore store, Dispatcher dispatcher, OrchestratorConfig config) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            reapStaleExecutions();
        } catch (Exception e) {
            log.error("Stale execution reaper error", e);
        }
    }

    /**
     * Find and recover stale STARTING executions.
     *
     * @return number of executions recovered
     */
    public int reapStaleExecutions() {
        Instant cutoff = Instant.now().minus(config.staleStartThreshold());

        List<TaskExecution> stale = store.findStaleStarting(cutoff);

        if (stale.isEmpty()) {
            log.debug("No stale executions found");
            return 0;
        }

        int retried = 0;
        int failed = 0;

        for (TaskExecution execution : stale) {
            try {
                DispatchOutcome outcome = dispatcher.reconcileUnknown(execution);
                if (outcome == DispatchOutcome.RETRY_SCHEDULED) {
                    retried++;
                } else if (outcome == DispatchOutcome.FAILED) {
                    failed++;
                }
            } catch (Exception e) {
                log.error("Failed to reap execution {}/{}", execution.runId(), execution.taskId(), e);
            }
        }

        log.info("Stale execution reaper: {} retried, {} failed, {} total stale",
                retried, failed, stale.size());

        return retried + failed;
    }
}

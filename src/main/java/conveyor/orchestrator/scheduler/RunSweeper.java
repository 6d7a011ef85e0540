package conveyor.orchestrator.scheduler;

import conveyor.orchestrator.model.RunStatus;
import conveyor.orchestrator.repository.ExecutionStateStore;
import conveyor.orchestrator.service.PipelineRunController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Background task that advances every non-terminal run by one step.
 * Runs left behind by a crashed process are picked up here as well.
 */
public class RunSweeper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RunSweeper.class);

    private final ExecutionStateStore store;
    private final PipelineRunController controller;

    public RunSweeper(ExecutionStateStore store, PipelineRunController controller) {
        this.store = store;
        this.controller = controller;
    }

    @Override
    public void run() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Run sweeper error", e);
        }
    }

    /**
     * Step each active run once. A failing run does not stop the others.
     *
     * @return number of runs that reached a terminal status
     */
    public int sweep() {
        List<String> active = store.findActiveRunIds();
        if (active.isEmpty()) {
            return 0;
        }

        int finished = 0;
        for (String runId : active) {
            try {
                RunStatus status = controller.step(runId);
                if (status.isTerminal()) {
                    finished++;
                }
            } catch (Exception e) {
                log.error("Failed to step run {}", runId, e);
            }
        }

        log.debug("Run sweeper: {} active, {} finished", active.size(), finished);
        return finished;
    }
}

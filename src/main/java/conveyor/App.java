package conveyor;

import conveyor.orchestrator.config.Dependencies;
import conveyor.orchestrator.config.OrchestratorConfig;
import conveyor.orchestrator.server.OrchestratorNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Orchestrator entry point.
 * 
 * Starts the HTTP API and the background scheduler, which resumes any run
 * left active by a previous process.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        OrchestratorConfig config = OrchestratorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        OrchestratorNettyServer server = new OrchestratorNettyServer(
                deps.routerHandler(), config.serverHost(), config.serverPort());

        try {
            server.start();
        } catch (RuntimeException e) {
            log.error("Server startup failed", e);
            deps.close();
            System.exit(1);
        }
        deps.startScheduler();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "conveyor-shutdown"));

        stopped.await();
    }
}

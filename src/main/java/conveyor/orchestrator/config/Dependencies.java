package conveyor.orchestrator.config;

import conveyor.orchestrator.api.v1.HealthController;
import conveyor.orchestrator.api.v1.RunController;
import conveyor.orchestrator.core.ChangeNotifier;
import conveyor.orchestrator.launcher.Launcher;
import conveyor.orchestrator.launcher.LocalProcessLauncher;
import conveyor.orchestrator.launcher.SimulatedLauncher;
import conveyor.orchestrator.repository.ExecutionStateStore;
import conveyor.orchestrator.scheduler.RunSweeper;
import conveyor.orchestrator.scheduler.Scheduler;
import conveyor.orchestrator.scheduler.StaleExecutionReaper;
import conveyor.orchestrator.server.RouterHandler;
import conveyor.orchestrator.service.ArtifactLayout;
import conveyor.orchestrator.service.ArtifactRouter;
import conveyor.orchestrator.service.Dispatcher;
import conveyor.orchestrator.service.PipelineRunController;
import conveyor.orchestrator.service.ReadinessResolver;
import conveyor.orchestrator.service.RunService;
import conveyor.orchestrator.store.Database;
import conveyor.orchestrator.store.InMemoryExecutionStateStore;
import conveyor.orchestrator.store.JdbcExecutionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 * 
 * Usage:
 * 
 * <pre>
 * Dependencies deps = Dependencies.create(OrchestratorConfig.fromEnv());
 * deps.startScheduler(); // drive submitted runs in the background
 * RunService runs = deps.runService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final OrchestratorConfig config;
    private final Database database;
    private final ExecutionStateStore store;
    private final Launcher launcher;
    private final ChangeNotifier notifier;
    private final ExecutorService dispatchPool;
    private final Dispatcher dispatcher;
    private final PipelineRunController runController;
    private final RunService runService;
    private final Scheduler scheduler;

    // Controllers
    private final HealthController healthController;
    private final RunController runApiController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(OrchestratorConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        if (config.storeType() == OrchestratorConfig.StoreType.JDBC) {
            this.database = new Database(config);
            this.store = new JdbcExecutionStateStore(database);
        } else {
            this.database = null;
            this.store = new InMemoryExecutionStateStore();
        }
        this.launcher = createLauncher(config);
        this.notifier = new ChangeNotifier();
        this.dispatchPool = Executors.newFixedThreadPool(config.dispatchThreads(), daemonThreads("conveyor-dispatch"));

        // Services
        ArtifactLayout layout = new ArtifactLayout(config);
        this.dispatcher = new Dispatcher(store, launcher, new ArtifactRouter(), layout, config);
        this.runController = new PipelineRunController(store, dispatcher, new ReadinessResolver(), notifier,
                dispatchPool, config);
        this.runService = new RunService(store, runController, notifier, layout);

        // Background work
        this.scheduler = new Scheduler(new RunSweeper(store, runController),
                new StaleExecutionReaper(store, dispatcher, config), config);
        launcher.onCompletion(handle -> notifier.fire());
        notifier.onChange(scheduler::requestSweep);

        // Controllers (public API)
        this.healthController = new HealthController(store);
        this.runApiController = new RunController(runService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(OrchestratorConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(OrchestratorConfig.fromEnv());
    }

    private static Launcher createLauncher(OrchestratorConfig config) {
        return switch (config.launcherType()) {
            case LOCAL -> new LocalProcessLauncher(config.dataRoot());
            case SIMULATED -> new SimulatedLauncher(config.simulatedTaskDuration(), config.simulatedFailureRate());
        };
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }

    // Getters
    public OrchestratorConfig config() {
        return config;
    }

    public ExecutionStateStore store() {
        return store;
    }

    public Launcher launcher() {
        return launcher;
    }

    public ChangeNotifier notifier() {
        return notifier;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    public PipelineRunController runController() {
        return runController;
    }

    public RunService runService() {
        return runService;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(runApiController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Start the background scheduler that drives runs and reaps stale executions.
     */
    public void startScheduler() {
        scheduler.start();
    }

    public void stopScheduler() {
        scheduler.stop();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        dispatchPool.shutdown();
        try {
            if (!dispatchPool.awaitTermination(5, TimeUnit.SECONDS)) {
                dispatchPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatchPool.shutdownNow();
            Thread.currentThread().interrupt();
        }

        try {
            launcher.close();
        } catch (Exception e) {
            log.warn("Error closing launcher: {}", e.getMessage());
        }

        if (database != null) {
            try {
                database.close();
            } catch (Exception e) {
                log.warn("Error closing database: {}", e.getMessage());
            }
        }

        log.info("Dependencies closed");
    }
}

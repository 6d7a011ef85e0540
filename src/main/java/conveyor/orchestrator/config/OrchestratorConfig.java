package conveyor.orchestrator.config;

import conveyor.orchestrator.model.FailurePolicy;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration holder for orchestrator settings.
 * All settings have sensible defaults.
 */
public final class OrchestratorConfig {

    /** Which {@code ExecutionStateStore} engine to use. */
    public enum StoreType {
        JDBC, MEMORY
    }

    /** Which launcher backend runs task containers. */
    public enum LauncherType {
        SIMULATED, LOCAL
    }

    // Database settings
    private StoreType storeType = StoreType.JDBC;
    private String databaseUrl = "jdbc:h2:file:./data/conveyor;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Retry settings
    private int maxRetries = 2;
    private int maxInfraRetries = 20;
    private Duration retryBackoff = Duration.ofSeconds(1);
    private Duration maxRetryBackoff = Duration.ofMinutes(1);

    // Dispatch settings
    private int maxInFlightPerRun = 16;
    private int maxInFlightGlobal = 64;
    private int dispatchThreads = 8;
    private Duration pollInterval = Duration.ofSeconds(1);
    private Duration staleStartThreshold = Duration.ofMinutes(2);
    private FailurePolicy failurePolicy = FailurePolicy.CONTINUE;

    // Background scheduler
    private Duration sweepInterval = Duration.ofSeconds(2);
    private Duration reaperInterval = Duration.ofSeconds(30);

    // Launcher settings
    private LauncherType launcherType = LauncherType.SIMULATED;
    private String dataRoot = "./data/artifacts";
    private String logsRoot = "./data/logs";
    private Duration simulatedTaskDuration = Duration.ofMillis(200);
    private double simulatedFailureRate = 0.0;
    private Map<String, Object> defaultTaskAnnotations = new LinkedHashMap<>();

    private OrchestratorConfig() {
    }

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig();
    }

    public static OrchestratorConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static OrchestratorConfig fromEnv(Map<String, String> env) {
        OrchestratorConfig config = new OrchestratorConfig();

        String store = env.get("CONVEYOR_STORE");
        if (store != null && !store.isBlank()) {
            config.storeType = StoreType.valueOf(store.trim().toUpperCase());
        }

        String dbUrl = env.get("CONVEYOR_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = env.get("CONVEYOR_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String maxRetries = env.get("CONVEYOR_MAX_RETRIES");
        if (maxRetries != null && !maxRetries.isBlank()) {
            config.maxRetries = Integer.parseInt(maxRetries.trim());
        }

        String launcher = env.get("CONVEYOR_LAUNCHER");
        if (launcher != null && !launcher.isBlank()) {
            config.launcherType = LauncherType.valueOf(launcher.trim().toUpperCase());
        }

        String dataRoot = env.get("CONVEYOR_DATA_ROOT");
        if (dataRoot != null && !dataRoot.isBlank()) {
            config.dataRoot = dataRoot;
        }

        String logsRoot = env.get("CONVEYOR_LOGS_ROOT");
        if (logsRoot != null && !logsRoot.isBlank()) {
            config.logsRoot = logsRoot;
        }

        String policy = env.get("CONVEYOR_FAILURE_POLICY");
        if (policy != null && !policy.isBlank()) {
            config.failurePolicy = FailurePolicy.valueOf(policy.trim().toUpperCase());
        }

        return config;
    }

    // Getters
    public StoreType storeType() {
        return storeType;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public int maxInfraRetries() {
        return maxInfraRetries;
    }

    public Duration retryBackoff() {
        return retryBackoff;
    }

    public Duration maxRetryBackoff() {
        return maxRetryBackoff;
    }

    public int maxInFlightPerRun() {
        return maxInFlightPerRun;
    }

    public int maxInFlightGlobal() {
        return maxInFlightGlobal;
    }

    public int dispatchThreads() {
        return dispatchThreads;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration staleStartThreshold() {
        return staleStartThreshold;
    }

    public FailurePolicy failurePolicy() {
        return failurePolicy;
    }

    public Duration sweepInterval() {
        return sweepInterval;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public LauncherType launcherType() {
        return launcherType;
    }

    public String dataRoot() {
        return dataRoot;
    }

    public String logsRoot() {
        return logsRoot;
    }

    public Duration simulatedTaskDuration() {
        return simulatedTaskDuration;
    }

    public double simulatedFailureRate() {
        return simulatedFailureRate;
    }

    public Map<String, Object> defaultTaskAnnotations() {
        return defaultTaskAnnotations;
    }

    /**
     * Backoff before the given retry: base * 2^(retry-1), capped.
     */
    public Duration backoffFor(int retry) {
        if (retry <= 0 || retryBackoff.isZero()) {
            return Duration.ZERO;
        }
        int shift = Math.min(retry - 1, 20);
        Duration backoff = retryBackoff.multipliedBy(1L << shift);
        return backoff.compareTo(maxRetryBackoff) > 0 ? maxRetryBackoff : backoff;
    }

    // Fluent setters for testing/customization
    public OrchestratorConfig withStoreType(StoreType storeType) {
        this.storeType = storeType;
        return this;
    }

    public OrchestratorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public OrchestratorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public OrchestratorConfig withMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    public OrchestratorConfig withMaxInfraRetries(int maxInfraRetries) {
        this.maxInfraRetries = maxInfraRetries;
        return this;
    }

    public OrchestratorConfig withRetryBackoff(Duration backoff) {
        this.retryBackoff = backoff;
        return this;
    }

    public OrchestratorConfig withMaxInFlightPerRun(int limit) {
        this.maxInFlightPerRun = limit;
        return this;
    }

    public OrchestratorConfig withMaxInFlightGlobal(int limit) {
        this.maxInFlightGlobal = limit;
        return this;
    }

    public OrchestratorConfig withDispatchThreads(int threads) {
        this.dispatchThreads = threads;
        return this;
    }

    public OrchestratorConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public OrchestratorConfig withStaleStartThreshold(Duration threshold) {
        this.staleStartThreshold = threshold;
        return this;
    }

    public OrchestratorConfig withFailurePolicy(FailurePolicy policy) {
        this.failurePolicy = policy;
        return this;
    }

    public OrchestratorConfig withSweepInterval(Duration interval) {
        this.sweepInterval = interval;
        return this;
    }

    public OrchestratorConfig withReaperInterval(Duration interval) {
        this.reaperInterval = interval;
        return this;
    }

    public OrchestratorConfig withLauncherType(LauncherType launcherType) {
        this.launcherType = launcherType;
        return this;
    }

    public OrchestratorConfig withDataRoot(String dataRoot) {
        this.dataRoot = dataRoot;
        return this;
    }

    public OrchestratorConfig withLogsRoot(String logsRoot) {
        this.logsRoot = logsRoot;
        return this;
    }

    public OrchestratorConfig withSimulatedTaskDuration(Duration duration) {
        this.simulatedTaskDuration = duration;
        return this;
    }

    public OrchestratorConfig withSimulatedFailureRate(double failureRate) {
        this.simulatedFailureRate = failureRate;
        return this;
    }

    public OrchestratorConfig withDefaultTaskAnnotation(String key, Object value) {
        this.defaultTaskAnnotations.put(key, value);
        return this;
    }

    @Override
    public String toString() {
        return "OrchestratorConfig{" +
                "store=" + storeType +
                ", databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", launcher=" + launcherType +
                ", maxRetries=" + maxRetries +
                ", maxInFlightPerRun=" + maxInFlightPerRun +
                ", maxInFlightGlobal=" + maxInFlightGlobal +
                ", failurePolicy=" + failurePolicy +
                '}';
    }
}

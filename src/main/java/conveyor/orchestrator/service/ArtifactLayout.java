package conveyor.orchestrator.service;

import conveyor.orchestrator.config.OrchestratorConfig;
import conveyor.orchestrator.model.ComponentSpec;
import conveyor.orchestrator.model.OutputSpec;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Where each attempt writes its outputs and log. Paths are keyed by execution id,
 * so a retry never overwrites the artifacts of an earlier attempt.
 */
public final class ArtifactLayout {

    private final String dataRoot;
    private final String logsRoot;

    public ArtifactLayout(String dataRoot, String logsRoot) {
        this.dataRoot = stripTrailingSlash(dataRoot);
        this.logsRoot = stripTrailingSlash(logsRoot);
    }

    public ArtifactLayout(OrchestratorConfig config) {
        this(config.dataRoot(), config.logsRoot());
    }

    public String outputUri(String executionId, String outputName) {
        return dataRoot + "/by_execution/" + executionId + "/outputs/" + outputName + "/data";
    }

    public Map<String, String> outputUris(String executionId, ComponentSpec component) {
        Map<String, String> uris = new LinkedHashMap<>();
        for (OutputSpec output : component.outputs()) {
            uris.put(output.name(), outputUri(executionId, output.name()));
        }
        return uris;
    }

    public String logUri(String executionId) {
        return logsRoot + "/by_execution/" + executionId + "/log.txt";
    }

    private static String stripTrailingSlash(String root) {
        return root.endsWith("/") ? root.substring(0, root.length() - 1) : root;
    }
}

package conveyor.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import conveyor.orchestrator.model.PipelineSpec;

import java.util.Map;

/**
 * Request DTO for submitting a pipeline run.
 * POST /api/v1/runs
 */
public record SubmitRunRequest(
        @JsonProperty("pipeline") PipelineSpec pipeline,
        @JsonProperty("arguments") Map<String, String> arguments,
        @JsonProperty("annotations") Map<String, Object> annotations) {

    /** Validate the request */
    public void validate() {
        if (pipeline == null) {
            throw new IllegalArgumentException("pipeline is required");
        }
    }
}

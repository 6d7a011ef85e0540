package conveyor.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("store") String store,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("activeRuns") Integer activeRuns,
        @JsonProperty("inFlightTasks") Integer inFlightTasks) {
    public static HealthResponse healthy(String uptime, String version, int activeRuns, int inFlightTasks) {
        return new HealthResponse("healthy", "ok", uptime, version, activeRuns, inFlightTasks);
    }

    public static HealthResponse unhealthy(String store) {
        return new HealthResponse("unhealthy", store, null, null, null, null);
    }
}

package conveyor.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Declared output port of a component.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutputSpec(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type) {

    public static OutputSpec of(String name) {
        return new OutputSpec(name, null);
    }
}

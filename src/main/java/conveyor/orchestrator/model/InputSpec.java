package conveyor.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Declared input port of a component (or of a pipeline).
 *
 * @param name         port name, unique within the component
 * @param type         optional type name used for compatibility checks
 * @param defaultValue value used when no argument is bound
 * @param optional     the port may stay unbound
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InputSpec(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("default") String defaultValue,
        @JsonProperty("optional") boolean optional) {

    public static InputSpec of(String name) {
        return new InputSpec(name, null, null, false);
    }

    public static InputSpec typed(String name, String type) {
        return new InputSpec(name, type, null, false);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    /** Bound, defaulted or optional: a missing argument is only an error when none of these hold. */
    public boolean isRequired() {
        return !optional && defaultValue == null;
    }
}

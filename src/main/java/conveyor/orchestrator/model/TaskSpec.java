package conveyor.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A component instantiated inside a pipeline with its arguments bound.
 *
 * @param id          task id, unique within the pipeline
 * @param component   component to execute
 * @param arguments   input port name to argument source, in declaration order
 * @param optional    failure of this task does not fail the run
 * @param annotations free-form metadata passed to the launcher
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TaskSpec(
        @JsonProperty("id") String id,
        @JsonProperty("component") ComponentSpec component,
        @JsonProperty("arguments") Map<String, ArgumentSource> arguments,
        @JsonProperty("optional") boolean optional,
        @JsonProperty("annotations") Map<String, Object> annotations) {

    public TaskSpec {
        Objects.requireNonNull(id, "task id is required");
        Objects.requireNonNull(component, "component is required for task " + id);
        arguments = arguments != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                : Map.of();
        annotations = annotations != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(annotations))
                : Map.of();
    }

    /** Ids of the tasks whose outputs this task consumes, in first-use order. */
    public Set<String> upstreamTaskIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (ArgumentSource source : arguments.values()) {
            for (ArgumentSource.TaskOutput ref : source.upstreamOutputs()) {
                ids.add(ref.taskId());
            }
        }
        return ids;
    }

    public static Builder builder(String id, ComponentSpec component) {
        return new Builder(id, component);
    }

    public static final class Builder {
        private final String id;
        private final ComponentSpec component;
        private final Map<String, ArgumentSource> arguments = new LinkedHashMap<>();
        private final Map<String, Object> annotations = new LinkedHashMap<>();
        private boolean optional;

        private Builder(String id, ComponentSpec component) {
            this.id = id;
            this.component = component;
        }

        public Builder argument(String port, ArgumentSource source) {
            arguments.put(port, source);
            return this;
        }

        public Builder literal(String port, String value) {
            return argument(port, ArgumentSource.literal(value));
        }

        public Builder fromTask(String port, String taskId, String outputName) {
            return argument(port, ArgumentSource.taskOutput(taskId, outputName));
        }

        public Builder optional(boolean optional) {
            this.optional = optional;
            return this;
        }

        public Builder annotation(String key, Object value) {
            annotations.put(key, value);
            return this;
        }

        public TaskSpec build() {
            return new TaskSpec(id, component, arguments, optional, annotations);
        }
    }
}

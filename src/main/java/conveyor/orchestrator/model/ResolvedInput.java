package conveyor.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * Concrete value bound to an input port at dispatch time.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ResolvedInput.Value.class, name = "value"),
        @JsonSubTypes.Type(value = ResolvedInput.Artifact.class, name = "artifact"),
        @JsonSubTypes.Type(value = ResolvedInput.Collection.class, name = "collection")
})
public interface ResolvedInput {

    static Value value(String value) {
        return new Value(value);
    }

    static Artifact artifact(String uri) {
        return new Artifact(uri);
    }

    /** Inline constant (literal, pipeline argument or default). */
    record Value(@JsonProperty("value") String value) implements ResolvedInput {
        public Value {
            Objects.requireNonNull(value, "value is required");
        }
    }

    /** Reference to an artifact produced by an upstream task. */
    record Artifact(@JsonProperty("uri") String uri) implements ResolvedInput {
        public Artifact {
            Objects.requireNonNull(uri, "uri is required");
        }
    }

    /** Ordered list of artifact references (fan-in). */
    record Collection(@JsonProperty("items") List<ResolvedInput> items) implements ResolvedInput {
        public Collection {
            items = items != null ? List.copyOf(items) : List.of();
        }
    }
}

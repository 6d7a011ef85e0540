package conveyor.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * Where a task input port gets its value from.
 * Serialized with a {@code "type"} discriminator: {@code literal}, {@code taskOutput},
 * {@code pipelineInput} or {@code collection}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ArgumentSource.Literal.class, name = "literal"),
        @JsonSubTypes.Type(value = ArgumentSource.TaskOutput.class, name = "taskOutput"),
        @JsonSubTypes.Type(value = ArgumentSource.PipelineInput.class, name = "pipelineInput"),
        @JsonSubTypes.Type(value = ArgumentSource.Collection.class, name = "collection")
})
public interface ArgumentSource {

    /** Upstream task outputs this source consumes, in declaration order. */
    List<TaskOutput> upstreamOutputs();

    static Literal literal(String value) {
        return new Literal(value);
    }

    static TaskOutput taskOutput(String taskId, String outputName) {
        return new TaskOutput(taskId, outputName);
    }

    static PipelineInput pipelineInput(String inputName) {
        return new PipelineInput(inputName);
    }

    static Collection collection(TaskOutput... members) {
        return new Collection(List.of(members));
    }

    /** Constant value. */
    record Literal(@JsonProperty("value") String value) implements ArgumentSource {
        public Literal {
            Objects.requireNonNull(value, "literal value is required");
        }

        @Override
        public List<TaskOutput> upstreamOutputs() {
            return List.of();
        }
    }

    /** Output port of another task in the same pipeline. */
    record TaskOutput(
            @JsonProperty("taskId") String taskId,
            @JsonProperty("outputName") String outputName) implements ArgumentSource {
        public TaskOutput {
            Objects.requireNonNull(taskId, "taskId is required");
            Objects.requireNonNull(outputName, "outputName is required");
        }

        @Override
        public List<TaskOutput> upstreamOutputs() {
            return List.of(this);
        }

        @Override
        public String toString() {
            return taskId + "." + outputName;
        }
    }

    /** Argument supplied to the run (or the pipeline input's default). */
    record PipelineInput(@JsonProperty("inputName") String inputName) implements ArgumentSource {
        public PipelineInput {
            Objects.requireNonNull(inputName, "inputName is required");
        }

        @Override
        public List<TaskOutput> upstreamOutputs() {
            return List.of();
        }
    }

    /** Ordered fan-in of several task outputs. */
    record Collection(@JsonProperty("members") List<TaskOutput> members) implements ArgumentSource {
        public Collection {
            members = members != null ? List.copyOf(members) : List.of();
        }

        @Override
        public List<TaskOutput> upstreamOutputs() {
            return members;
        }
    }
}

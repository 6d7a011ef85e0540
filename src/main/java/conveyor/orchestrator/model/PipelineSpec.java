package conveyor.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Directed acyclic graph of tasks, immutable once submitted.
 * Task order is the declaration order and is used as the topological tie-breaker.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record PipelineSpec(
        @JsonProperty("name") String name,
        @JsonProperty("inputs") List<InputSpec> inputs,
        @JsonProperty("outputs") Map<String, ArgumentSource.TaskOutput> outputs,
        @JsonProperty("tasks") List<TaskSpec> tasks,
        @JsonProperty("annotations") Map<String, Object> annotations) {

    public PipelineSpec {
        Objects.requireNonNull(name, "pipeline name is required");
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(outputs)) : Map.of();
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        annotations = annotations != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(annotations))
                : Map.of();
    }

    public Optional<TaskSpec> task(String taskId) {
        return tasks.stream().filter(t -> t.id().equals(taskId)).findFirst();
    }

    public Optional<InputSpec> input(String inputName) {
        return inputs.stream().filter(i -> i.name().equals(inputName)).findFirst();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private final List<InputSpec> inputs = new ArrayList<>();
        private final Map<String, ArgumentSource.TaskOutput> outputs = new LinkedHashMap<>();
        private final List<TaskSpec> tasks = new ArrayList<>();
        private final Map<String, Object> annotations = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder input(InputSpec input) {
            inputs.add(input);
            return this;
        }

        public Builder output(String name, String taskId, String outputName) {
            outputs.put(name, ArgumentSource.taskOutput(taskId, outputName));
            return this;
        }

        public Builder task(TaskSpec task) {
            tasks.add(task);
            return this;
        }

        public Builder annotation(String key, Object value) {
            annotations.put(key, value);
            return this;
        }

        public PipelineSpec build() {
            return new PipelineSpec(name, inputs, outputs, tasks, annotations);
        }
    }
}

package conveyor.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Container implementation of a component.
 * Command and args may contain {@code {{inputValue:NAME}}}, {@code {{inputPath:NAME}}}
 * and {@code {{outputPath:NAME}}} placeholders.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ContainerSpec(
        @JsonProperty("image") String image,
        @JsonProperty("command") List<String> command,
        @JsonProperty("args") List<String> args,
        @JsonProperty("env") Map<String, String> env) {

    public ContainerSpec {
        command = command != null ? List.copyOf(command) : List.of();
        args = args != null ? List.copyOf(args) : List.of();
        env = env != null ? Map.copyOf(env) : Map.of();
    }

    public static ContainerSpec of(String image, List<String> command) {
        return new ContainerSpec(image, command, List.of(), Map.of());
    }
}

package conveyor.orchestrator.launcher;

import conveyor.orchestrator.model.ResolvedInput;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a backend needs to start one attempt of a task.
 *
 * @param executionId unique id of this attempt
 * @param command     command template, placeholders not yet substituted
 * @param args        argument template, placeholders not yet substituted
 * @param inputs      resolved input port bindings
 * @param outputUris  output port name to the URI the attempt must write
 * @param logUri      where the attempt's log goes
 * @param annotations merged default, run and task annotations
 */
public record LaunchSpec(
        String runId,
        String taskId,
        String executionId,
        String image,
        List<String> command,
        List<String> args,
        Map<String, ResolvedInput> inputs,
        Map<String, String> outputUris,
        String logUri,
        Map<String, String> env,
        Map<String, Object> annotations) {

    public LaunchSpec {
        command = command != null ? List.copyOf(command) : List.of();
        args = args != null ? List.copyOf(args) : List.of();
        inputs = inputs != null ? Map.copyOf(inputs) : Map.of();
        outputUris = outputUris != null ? Map.copyOf(outputUris) : Map.of();
        env = env != null ? Map.copyOf(env) : Map.of();
        annotations = annotations != null ? Collections.unmodifiableMap(new LinkedHashMap<>(annotations)) : Map.of();
    }
}

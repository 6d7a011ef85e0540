package conveyor.orchestrator.launcher;

import conveyor.orchestrator.model.ResolvedInput;
import conveyor.orchestrator.util.Json;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{inputValue:NAME}}}, {@code {{inputPath:NAME}}} and
 * {@code {{outputPath:NAME}}} placeholders in a command line.
 * <p>
 * An argument that references an input which was not bound (an optional input
 * left empty) is dropped from the command line as a whole.
 */
public final class CommandLineResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(inputValue|inputPath|outputPath):([^}]+)}}");

    /**
     * How a backend materializes port bindings.
     */
    public interface PortBindings {
        String inputValue(String name, ResolvedInput input);

        String inputPath(String name, ResolvedInput input);

        String outputPath(String name, String uri);
    }

    private final PortBindings bindings;

    public CommandLineResolver(PortBindings bindings) {
        this.bindings = bindings;
    }

    /**
     * Resolve command followed by args into a single command line.
     *
     * @throws LaunchFailureException if a placeholder names an undeclared output
     */
    public List<String> resolve(LaunchSpec spec) {
        List<String> resolved = new ArrayList<>();
        for (String part : spec.command()) {
            resolvePart(part, spec, resolved);
        }
        for (String part : spec.args()) {
            resolvePart(part, spec, resolved);
        }
        return resolved;
    }

    private void resolvePart(String template, LaunchSpec spec, List<String> out) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String kind = m.group(1);
            String name = m.group(2).trim();
            String replacement;
            if ("outputPath".equals(kind)) {
                String uri = spec.outputUris().get(name);
                if (uri == null) {
                    throw new LaunchFailureException("Command references undeclared output '" + name + "'");
                }
                replacement = bindings.outputPath(name, uri);
            } else {
                ResolvedInput input = spec.inputs().get(name);
                if (input == null) {
                    return;
                }
                replacement = "inputValue".equals(kind)
                        ? bindings.inputValue(name, input)
                        : bindings.inputPath(name, input);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        out.add(sb.toString());
    }

    /**
     * Bindings that treat artifact URIs as paths and pass values inline.
     * Collections are rendered as a JSON array of their items.
     */
    public static PortBindings uriBindings() {
        return new PortBindings() {
            @Override
            public String inputValue(String name, ResolvedInput input) {
                return render(input);
            }

            @Override
            public String inputPath(String name, ResolvedInput input) {
                return render(input);
            }

            @Override
            public String outputPath(String name, String uri) {
                return uri;
            }
        };
    }

    static String render(ResolvedInput input) {
        if (input instanceof ResolvedInput.Value value) {
            return value.value();
        }
        if (input instanceof ResolvedInput.Artifact artifact) {
            return artifact.uri();
        }
        ResolvedInput.Collection collection = (ResolvedInput.Collection) input;
        List<String> items = new ArrayList<>();
        for (ResolvedInput item : collection.items()) {
            items.add(render(item));
        }
        return Json.write(items);
    }

    /** Placeholder-free view of the bindings, for logging. */
    public static String describe(Map<String, ResolvedInput> inputs) {
        StringBuilder sb = new StringBuilder("{");
        inputs.forEach((name, input) -> {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(name).append('=').append(render(input));
        });
        return sb.append('}').toString();
    }
}

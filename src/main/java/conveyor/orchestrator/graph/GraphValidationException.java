package conveyor.orchestrator.graph;

import java.util.List;

/**
 * Submitted pipeline is structurally invalid. Carries every problem found, not just the first.
 */
public class GraphValidationException extends RuntimeException {

    private final List<String> problems;

    public GraphValidationException(List<String> problems) {
        super("Invalid pipeline: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public GraphValidationException(String problem) {
        this(List.of(problem));
    }

    public List<String> problems() {
        return problems;
    }
}

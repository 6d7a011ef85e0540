package conveyor.orchestrator.launcher;

import java.util.Map;

/**
 * Result of polling a launched container.
 *
 * @param outputs output name to produced artifact URI, set on success
 * @param message failure reason
 */
public record PollResult(LaunchStatus status, Map<String, String> outputs, String message) {

    public PollResult {
        outputs = outputs != null ? Map.copyOf(outputs) : Map.of();
    }

    public static PollResult running() {
        return new PollResult(LaunchStatus.RUNNING, Map.of(), null);
    }

    public static PollResult succeeded(Map<String, String> outputs) {
        return new PollResult(LaunchStatus.SUCCEEDED, outputs, null);
    }

    public static PollResult failed(String message) {
        return new PollResult(LaunchStatus.FAILED, Map.of(), message);
    }

    public static PollResult unknown(String message) {
        return new PollResult(LaunchStatus.UNKNOWN, Map.of(), message);
    }

    public boolean isFinished() {
        return status != LaunchStatus.RUNNING;
    }
}

package conveyor.orchestrator.util;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Attempt ids that sort by creation time: 12 hex digits of epoch millis
 * followed by 8 random hex digits.
 */
public final class ExecutionIds {

    private static final SecureRandom RANDOM = new SecureRandom();

    private ExecutionIds() {
    }

    public static String generate() {
        return generate(System.currentTimeMillis());
    }

    static String generate(long epochMillis) {
        byte[] random = new byte[4];
        RANDOM.nextBytes(random);
        return String.format("%012x", epochMillis) + HexFormat.of().formatHex(random);
    }
}

package conveyor.orchestrator.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Layered annotation maps. Later layers win; nested maps are merged key by key.
 */
public final class Annotations {

    private Annotations() {
    }

    @SafeVarargs
    public static Map<String, Object> merge(Map<String, Object>... layers) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map<String, Object> layer : layers) {
            if (layer != null) {
                mergeInto(result, layer);
            }
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static void mergeInto(Map<String, Object> target, Map<String, Object> source) {
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            Object existing = target.get(entry.getKey());
            Object incoming = entry.getValue();
            if (existing instanceof Map<?, ?> existingMap && incoming instanceof Map<?, ?> incomingMap) {
                Map<String, Object> merged = new LinkedHashMap<>((Map<String, Object>) existingMap);
                mergeInto(merged, (Map<String, Object>) incomingMap);
                target.put(entry.getKey(), merged);
            } else {
                target.put(entry.getKey(), incoming);
            }
        }
    }
}

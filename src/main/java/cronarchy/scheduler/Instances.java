package cronarchy.scheduler;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide lookup of scheduler instances by instance id.
 * The daemon finds its instance here once the environment is loaded.
 */
public final class Instances {

    private static final Map<String, Cronarchy> REGISTRY = new ConcurrentHashMap<>();

    private Instances() {
    }

    public static void register(String instanceId, Cronarchy instance) {
        REGISTRY.put(instanceId, instance);
    }

    public static Optional<Cronarchy> lookup(String instanceId) {
        if (instanceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(REGISTRY.get(instanceId));
    }

    public static boolean contains(String instanceId) {
        return instanceId != null && REGISTRY.containsKey(instanceId);
    }

    public static Collection<Cronarchy> all() {
        return List.copyOf(REGISTRY.values());
    }

    public static void unregister(String instanceId) {
        REGISTRY.remove(instanceId);
    }

    public static void clear() {
        REGISTRY.clear();
    }
}

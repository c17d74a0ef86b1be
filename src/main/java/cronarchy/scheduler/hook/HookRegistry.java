package cronarchy.scheduler.hook;

import cronarchy.scheduler.exceptions.HandlerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process dispatcher backed by a map of registered handlers.
 */
public class HookRegistry implements HookDispatcher {

    private static final Logger log = LoggerFactory.getLogger(HookRegistry.class);

    private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Registry filled by every {@link HookProvider} on the class path.
     */
    public static HookRegistry fromProviders() {
        HookRegistry registry = new HookRegistry();
        for (HookProvider provider : ServiceLoader.load(HookProvider.class)) {
            provider.registerHooks(registry);
            log.debug("Hooks registered by {}", provider.getClass().getName());
        }
        return registry;
    }

    /**
     * Register a handler, replacing any previous handler for the hook.
     */
    public HookRegistry register(String hook, JobHandler handler) {
        Objects.requireNonNull(hook, "hook must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        if (handlers.put(hook, handler) != null) {
            log.warn("Replaced handler for hook {}", hook);
        }
        return this;
    }

    public boolean unregister(String hook) {
        return handlers.remove(hook) != null;
    }

    public Set<String> hooks() {
        return Set.copyOf(handlers.keySet());
    }

    @Override
    public void invoke(String hook, List<Object> args) throws Exception {
        JobHandler handler = handlers.get(hook);
        if (handler == null) {
            throw new HandlerException(hook, "no handler registered");
        }
        handler.handle(args);
    }
}

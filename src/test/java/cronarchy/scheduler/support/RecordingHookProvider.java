package cronarchy.scheduler.support;

import cronarchy.scheduler.hook.HookProvider;
import cronarchy.scheduler.hook.HookRegistry;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Handlers picked up through {@code META-INF/services} by tests that load an
 * environment from a file.
 */
public class RecordingHookProvider implements HookProvider {

    public static final String RECORD_HOOK = "test.record";
    public static final String FAIL_HOOK = "test.fail";

    public static final List<List<Object>> CALLS = new CopyOnWriteArrayList<>();

    @Override
    public void registerHooks(HookRegistry registry) {
        registry.register(RECORD_HOOK, CALLS::add);
        registry.register(FAIL_HOOK, args -> {
            throw new IllegalStateException("handler failure requested");
        });
    }
}

package cronarchy.scheduler.hook;

/**
 * Service provider that contributes job handlers when an environment is loaded.
 * Implementations are listed in {@code META-INF/services/cronarchy.scheduler.hook.HookProvider}.
 */
public interface HookProvider {

    void registerHooks(HookRegistry registry);
}

package cronarchy.scheduler.repository;

/**
 * Process-wide key-value store that survives restarts.
 * Single writes are atomic; there are no multi-key transactions.
 */
public interface OptionStore {

    /**
     * Read an option.
     *
     * @param name         option name
     * @param defaultValue returned when the option is not set
     * @return stored value or the default
     */
    long get(String name, long defaultValue);

    /**
     * Create or overwrite an option.
     *
     * @param name  option name
     * @param value new value
     */
    void set(String name, long value);
}

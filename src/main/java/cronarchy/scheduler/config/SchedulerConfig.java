package cronarchy.scheduler.config;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for one scheduler instance.
 * All settings have sensible defaults and are never changed by the scheduler itself.
 */
public final class SchedulerConfig {

    public static final String DEFAULT_INSTANCE_ID = "cronarchy";
    public static final String DAEMON_PATH_PREFIX = "/internal/v1/daemon/";

    // Instance
    private String instanceId = DEFAULT_INSTANCE_ID;

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/cronarchy;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 5;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";
    private String daemonUrl = null; // derived from port and instance when unset

    // Runner settings
    private Duration runInterval = Duration.ofSeconds(10);
    private Duration maxJobRunTime = Duration.ofSeconds(60);
    private Duration maxTotalRunTime = Duration.ofSeconds(600);
    private boolean retainFailedJobs = true;
    private boolean selfPinging = false;

    // Daemon settings
    private boolean loggingEnabled = false;
    private String logFilePath = "./cronarchy.log";
    private int maxDirSearch = 10;

    SchedulerConfig() {
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig();
    }

    public static SchedulerConfig fromEnv() {
        SchedulerConfig config = new SchedulerConfig();

        // Override from environment variables
        String instance = System.getenv("CRONARCHY_INSTANCE_ID");
        if (instance != null && !instance.isBlank()) {
            config.instanceId = instance;
        }

        String dbUrl = System.getenv("CRONARCHY_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("CRONARCHY_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String daemon = System.getenv("CRONARCHY_DAEMON_URL");
        if (daemon != null && !daemon.isBlank()) {
            config.daemonUrl = daemon;
        }

        String interval = System.getenv("CRONARCHY_RUN_INTERVAL");
        if (interval != null && !interval.isBlank()) {
            config.runInterval = Duration.ofSeconds(Long.parseLong(interval));
        }

        String selfPing = System.getenv("CRONARCHY_SELF_PINGING");
        if (selfPing != null && !selfPing.isBlank()) {
            config.selfPinging = Boolean.parseBoolean(selfPing);
        }

        String logging = System.getenv("CRONARCHY_LOGGING_ENABLED");
        if (logging != null && !logging.isBlank()) {
            config.loggingEnabled = Boolean.parseBoolean(logging);
        }

        String logFile = System.getenv("CRONARCHY_LOG_FILE");
        if (logFile != null && !logFile.isBlank()) {
            config.logFilePath = logFile;
        }

        String dirSearch = System.getenv("CRONARCHY_MAX_DIR_SEARCH");
        if (dirSearch != null && !dirSearch.isBlank()) {
            config.maxDirSearch = Integer.parseInt(dirSearch);
        }

        return config;
    }

    /**
     * Load config from a key=value environment file.
     */
    public static SchedulerConfig fromFile(Path file) throws IOException {
        return ConfigFileParser.parse(file);
    }

    /**
     * Write this config as a key=value environment file.
     */
    public void save(Path file) throws IOException {
        ConfigFileParser.write(this, file);
    }

    // Getters
    public String instanceId() {
        return instanceId;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String daemonUrl() {
        if (daemonUrl != null && !daemonUrl.isBlank()) {
            return daemonUrl;
        }
        return "http://127.0.0.1:" + serverPort + DAEMON_PATH_PREFIX + instanceId;
    }

    public Duration runInterval() {
        return runInterval;
    }

    public Duration maxJobRunTime() {
        return maxJobRunTime;
    }

    public Duration maxTotalRunTime() {
        return maxTotalRunTime;
    }

    public boolean retainFailedJobs() {
        return retainFailedJobs;
    }

    public boolean selfPinging() {
        return selfPinging;
    }

    public boolean loggingEnabled() {
        return loggingEnabled;
    }

    public String logFilePath() {
        return logFilePath;
    }

    public int maxDirSearch() {
        return maxDirSearch;
    }

    /** Name of the jobs table for this instance */
    public String jobsTable() {
        return instanceId.replaceAll("[^A-Za-z0-9_]", "_") + "_jobs";
    }

    /** Prefix of the option names holding this instance's runner state */
    public String optionPrefix() {
        return instanceId + "_";
    }

    // Fluent setters for testing/customization
    public SchedulerConfig withInstanceId(String instanceId) {
        this.instanceId = instanceId;
        return this;
    }

    public SchedulerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public SchedulerConfig withDatabasePoolSize(int size) {
        this.databasePoolSize = size;
        return this;
    }

    public SchedulerConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public SchedulerConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public SchedulerConfig withDaemonUrl(String url) {
        this.daemonUrl = url;
        return this;
    }

    public SchedulerConfig withRunInterval(Duration interval) {
        this.runInterval = interval;
        return this;
    }

    public SchedulerConfig withMaxJobRunTime(Duration time) {
        this.maxJobRunTime = time;
        return this;
    }

    public SchedulerConfig withMaxTotalRunTime(Duration time) {
        this.maxTotalRunTime = time;
        return this;
    }

    public SchedulerConfig withRetainFailedJobs(boolean retain) {
        this.retainFailedJobs = retain;
        return this;
    }

    public SchedulerConfig withSelfPinging(boolean selfPinging) {
        this.selfPinging = selfPinging;
        return this;
    }

    public SchedulerConfig withLoggingEnabled(boolean enabled) {
        this.loggingEnabled = enabled;
        return this;
    }

    public SchedulerConfig withLogFilePath(String path) {
        this.logFilePath = path;
        return this;
    }

    public SchedulerConfig withMaxDirSearch(int levels) {
        this.maxDirSearch = levels;
        return this;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "instanceId='" + instanceId + '\'' +
                ", databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", runInterval=" + runInterval.toSeconds() + "s" +
                ", maxJobRunTime=" + maxJobRunTime.toSeconds() + "s" +
                ", maxTotalRunTime=" + maxTotalRunTime.toSeconds() + "s" +
                ", retainFailedJobs=" + retainFailedJobs +
                ", selfPinging=" + selfPinging +
                '}';
    }
}

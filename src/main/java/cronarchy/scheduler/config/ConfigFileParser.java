package cronarchy.scheduler.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the key=value environment file.
 * Unknown keys are ignored, malformed numbers fall back to the default.
 */
public final class ConfigFileParser {

    private static final Logger log = LoggerFactory.getLogger(ConfigFileParser.class);

    private ConfigFileParser() {
    }

    public static SchedulerConfig parse(Path file) throws IOException {
        var cfg = SchedulerConfig.defaults();
        for (var line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#") || !line.contains("=")) continue;
            var kv = line.split("=", 2);
            var k = kv[0].trim().toLowerCase();
            var v = kv[1].trim();

            switch (k) {
                case "instance_id" -> cfg.withInstanceId(v);
                case "db_url" -> cfg.withDatabaseUrl(v);
                case "db_pool_size" -> cfg.withDatabasePoolSize(toInt(v, cfg.databasePoolSize()));
                case "server_host" -> cfg.withServerHost(v);
                case "server_port" -> cfg.withServerPort(toInt(v, cfg.serverPort()));
                case "daemon_url" -> cfg.withDaemonUrl(v);
                case "run_interval" -> cfg.withRunInterval(toSeconds(v, cfg.runInterval()));
                case "max_job_run_time" -> cfg.withMaxJobRunTime(toSeconds(v, cfg.maxJobRunTime()));
                case "max_total_run_time" -> cfg.withMaxTotalRunTime(toSeconds(v, cfg.maxTotalRunTime()));
                case "retain_failed_jobs" -> cfg.withRetainFailedJobs(Boolean.parseBoolean(v));
                case "delete_failed_jobs" -> cfg.withRetainFailedJobs(!Boolean.parseBoolean(v));
                case "self_pinging" -> cfg.withSelfPinging(Boolean.parseBoolean(v));
                case "logging_enabled" -> cfg.withLoggingEnabled(Boolean.parseBoolean(v));
                case "log_file_path" -> cfg.withLogFilePath(v);
                case "max_dir_search" -> cfg.withMaxDirSearch(toInt(v, cfg.maxDirSearch()));
                default -> {
                }
            }
        }
        return cfg;
    }

    public static void write(SchedulerConfig cfg, Path file) throws IOException {
        List<String> lines = new ArrayList<>();
        lines.add("# cronarchy environment");
        lines.add("instance_id=" + cfg.instanceId());
        lines.add("db_url=" + cfg.databaseUrl());
        lines.add("db_pool_size=" + cfg.databasePoolSize());
        lines.add("server_host=" + cfg.serverHost());
        lines.add("server_port=" + cfg.serverPort());
        lines.add("daemon_url=" + cfg.daemonUrl());
        lines.add("run_interval=" + cfg.runInterval().toSeconds());
        lines.add("max_job_run_time=" + cfg.maxJobRunTime().toSeconds());
        lines.add("max_total_run_time=" + cfg.maxTotalRunTime().toSeconds());
        lines.add("retain_failed_jobs=" + cfg.retainFailedJobs());
        lines.add("self_pinging=" + cfg.selfPinging());
        lines.add("logging_enabled=" + cfg.loggingEnabled());
        lines.add("log_file_path=" + cfg.logFilePath());
        lines.add("max_dir_search=" + cfg.maxDirSearch());
        Files.write(file, lines, StandardCharsets.UTF_8);
    }

    private static int toInt(String s, int def) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed number '{}', using {}", s, def);
            return def;
        }
    }

    private static Duration toSeconds(String s, Duration def) {
        try {
            return Duration.ofSeconds(Long.parseLong(s));
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed duration '{}', using {}s", s, def.toSeconds());
            return def;
        }
    }
}

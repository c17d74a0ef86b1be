package cronarchy.scheduler.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConfigFileParserTest {

    @TempDir
    Path dir;

    @Test
    void parsesKnownKeys() throws Exception {
        Path file = Files.writeString(dir.resolve("cronarchy.conf"), """
                # site environment
                instance_id = shop
                db_url=jdbc:h2:mem:shop
                server_port=9090
                run_interval=30
                max_job_run_time=15
                max_total_run_time=120
                retain_failed_jobs=false
                self_pinging=true
                logging_enabled=true
                log_file_path=/var/log/shop-cron.log
                max_dir_search=4
                """);

        SchedulerConfig cfg = ConfigFileParser.parse(file);

        assertEquals("shop", cfg.instanceId());
        assertEquals("jdbc:h2:mem:shop", cfg.databaseUrl());
        assertEquals(9090, cfg.serverPort());
        assertEquals(Duration.ofSeconds(30), cfg.runInterval());
        assertEquals(Duration.ofSeconds(15), cfg.maxJobRunTime());
        assertEquals(Duration.ofSeconds(120), cfg.maxTotalRunTime());
        assertFalse(cfg.retainFailedJobs());
        assertTrue(cfg.selfPinging());
        assertTrue(cfg.loggingEnabled());
        assertEquals("/var/log/shop-cron.log", cfg.logFilePath());
        assertEquals(4, cfg.maxDirSearch());
        assertEquals("http://127.0.0.1:9090/internal/v1/daemon/shop", cfg.daemonUrl());
    }

    @Test
    void deleteFailedJobsIsTheInverseOfRetain() throws Exception {
        Path file = Files.writeString(dir.resolve("legacy.conf"), "delete_failed_jobs=true\n");

        assertFalse(ConfigFileParser.parse(file).retainFailedJobs());
    }

    @Test
    void unknownKeysAndBadNumbersFallBackToDefaults() throws Exception {
        Path file = Files.writeString(dir.resolve("odd.conf"), """
                colour=blue
                run_interval=soon
                not a setting
                """);

        SchedulerConfig cfg = ConfigFileParser.parse(file);

        assertEquals(Duration.ofSeconds(10), cfg.runInterval());
        assertEquals(SchedulerConfig.DEFAULT_INSTANCE_ID, cfg.instanceId());
    }

    @Test
    void savedConfigLoadsBackEqual() throws Exception {
        SchedulerConfig original = SchedulerConfig.defaults()
                .withInstanceId("blog")
                .withRunInterval(Duration.ofSeconds(45))
                .withRetainFailedJobs(false)
                .withSelfPinging(true)
                .withMaxDirSearch(3);
        Path file = dir.resolve("saved.conf");

        original.save(file);
        SchedulerConfig loaded = SchedulerConfig.fromFile(file);

        assertEquals(original.instanceId(), loaded.instanceId());
        assertEquals(original.runInterval(), loaded.runInterval());
        assertEquals(original.retainFailedJobs(), loaded.retainFailedJobs());
        assertEquals(original.selfPinging(), loaded.selfPinging());
        assertEquals(original.maxDirSearch(), loaded.maxDirSearch());
        assertEquals(original.daemonUrl(), loaded.daemonUrl());
    }
}

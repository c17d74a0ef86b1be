package cronarchy.scheduler.daemon;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transcript of one daemon run. Lines are indented four spaces per nested
 * phase and go to the {@code cronarchy.daemon.<instance>} logger, which is
 * bound to an append-only file when logging is enabled.
 */
public final class DaemonLog {

    static final String LOGGER_PREFIX = "cronarchy.daemon.";
    private static final String FILE_PATTERN = "[%d{dd MMM yy - HH:mm:ss}] %msg%n";
    private static final Set<String> ATTACHED = ConcurrentHashMap.newKeySet();

    private final Logger logger;
    private final boolean enabled;
    private int depth;

    private DaemonLog(Logger logger, boolean enabled) {
        this.logger = logger;
        this.enabled = enabled;
    }

    /**
     * Create the log of a run, attaching the file appender on first use.
     */
    public static DaemonLog open(String instanceId, boolean enabled, String filePath) {
        String name = LOGGER_PREFIX + instanceId;
        if (enabled && filePath != null && !filePath.isBlank()) {
            attachFile(name, filePath);
        }
        return new DaemonLog(LoggerFactory.getLogger(name), enabled);
    }

    public void line(String text) {
        if (enabled) {
            logger.info("{}{}", " ".repeat(depth * 4), text);
        }
    }

    /** Log a line and nest the following lines one level deeper */
    public void enter(String text) {
        line(text);
        depth++;
    }

    /** Log a line and return to the enclosing level */
    public void exit(String text) {
        line(text);
        exit();
    }

    public void exit() {
        depth = Math.max(0, depth - 1);
    }

    public void error(String text, Throwable t) {
        if (enabled) {
            logger.error("{}{}", " ".repeat(depth * 4), text, t);
        }
    }

    /** Drop back to the top level, e.g. when a run ends abnormally */
    public void reset() {
        depth = 0;
    }

    int depth() {
        return depth;
    }

    private static void attachFile(String loggerName, String filePath) {
        if (!ATTACHED.add(loggerName + "|" + filePath)) {
            return;
        }
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            LoggerFactory.getLogger(DaemonLog.class)
                    .warn("SLF4J is not bound to Logback; daemon log stays on the default appenders");
            return;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(FILE_PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName("daemon-file-" + loggerName);
        appender.setFile(filePath);
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();

        context.getLogger(loggerName).addAppender(appender);
    }
}

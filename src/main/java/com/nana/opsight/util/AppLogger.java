package com.nana.opsight.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * AppLogger - run-level logging helpers.
 *
 * <p>Classes log through their own SLF4J logger:
 * <pre>
 *     private static final Logger log = LoggerFactory.getLogger(MyClass.class);
 * </pre>
 * {@code AppLogger} adds what does not belong to any one class:
 * <ul>
 *   <li>start and finish banners that mark each run in the log file,</li>
 *   <li>structured {@code [EVENT]} lines for notable outcomes
 *       (schema created, chunk committed, load aborted),</li>
 *   <li>MDC keys for the current operation, run and chunk, which the
 *       Logback pattern prints on every line.</li>
 * </ul>
 *
 * <p>MDC is thread-local. Everything here runs on the main thread, but each
 * {@code set...Context} call should still be paired with a clear in a
 * {@code finally} block.
 */
public final class AppLogger {

    // -----------------------------------------------------------------------
    // PRIVATE CONSTANTS
    // -----------------------------------------------------------------------

    private static final Logger APP_LOG = LoggerFactory.getLogger("com.nana.opsight.APP");

    private static final DateTimeFormatter EVENT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /** MDC key for the current operation name. */
    public static final String MDC_OPERATION = "operation";

    /** MDC key identifying one process run. */
    public static final String MDC_SESSION = "session";

    /** MDC key for the chunk number during a load. */
    public static final String MDC_CHUNK = "chunk";

    private AppLogger() {
        throw new UnsupportedOperationException("AppLogger is a static utility class.");
    }

    // -----------------------------------------------------------------------
    // STARTUP / SHUTDOWN BANNERS
    // -----------------------------------------------------------------------

    /**
     * Logs a banner marking the start of a run, with version and JVM details.
     *
     * @param command the CLI command being run
     */
    public static void logStartup(String command) {
        BuildInfo build = BuildInfo.getInstance();
        String separator = "=".repeat(60);
        APP_LOG.info(separator);
        APP_LOG.info("  {} v{} (built for Java {})",
                build.getAppName(), build.getVersion(), build.getJavaVersion());
        APP_LOG.info("  Command: {} ({})", command, LocalDateTime.now().format(EVENT_FORMAT));
        APP_LOG.info("  Java:    {} ({})",
                System.getProperty("java.version"),
                System.getProperty("java.vendor"));
        APP_LOG.info("  OS:      {} {} ({})",
                System.getProperty("os.name"),
                System.getProperty("os.version"),
                System.getProperty("os.arch"));
        APP_LOG.info(separator);
    }

    /**
     * Logs a banner marking the end of a run.
     *
     * @param startTime when the run started; null logs a zero duration
     * @param exitCode  the process exit code about to be returned
     */
    public static void logShutdown(LocalDateTime startTime, int exitCode) {
        long seconds = 0;
        if (startTime != null) {
            seconds = Duration.between(startTime, LocalDateTime.now()).getSeconds();
        }
        String separator = "-".repeat(60);
        APP_LOG.info(separator);
        APP_LOG.info("  Finished with exit code {} after {}h {}m {}s",
                exitCode, seconds / 3600, (seconds % 3600) / 60, seconds % 60);
        APP_LOG.info(separator);
    }

    // -----------------------------------------------------------------------
    // STRUCTURED EVENT LOGGING
    // -----------------------------------------------------------------------

    /**
     * Format: {@code [EVENT] <eventName> | <details>}
     *
     * @param eventName a short event label (e.g., "CHUNK_COMMITTED")
     * @param details   additional context (e.g., "chunk=3, events=50000")
     */
    public static void logEvent(String eventName, String details) {
        APP_LOG.info("[EVENT] {} | {}", eventName, details);
    }

    public static void logWarningEvent(String eventName, String details) {
        APP_LOG.warn("[WARN_EVENT] {} | {}", eventName, details);
    }

    public static void logErrorEvent(String eventName, String details, Throwable throwable) {
        APP_LOG.error("[ERROR_EVENT] {} | {}", eventName, details, throwable);
    }

    // -----------------------------------------------------------------------
    // MDC CONTEXT MANAGEMENT
    // -----------------------------------------------------------------------

    public static void setOperationContext(String operationName) {
        MDC.put(MDC_OPERATION, operationName);
    }

    public static void clearOperationContext() {
        MDC.remove(MDC_OPERATION);
    }

    public static void setSessionContext(String runId) {
        MDC.put(MDC_SESSION, runId);
    }

    public static void setChunkContext(int chunkNumber) {
        MDC.put(MDC_CHUNK, "chunk=" + chunkNumber);
    }

    public static void clearChunkContext() {
        MDC.remove(MDC_CHUNK);
    }

    /** Clears every MDC key set by this class. */
    public static void clearAllContext() {
        MDC.remove(MDC_OPERATION);
        MDC.remove(MDC_SESSION);
        MDC.remove(MDC_CHUNK);
    }

    /**
     * @return a timestamp-based run id, e.g. "RUN-20250115-143200"
     */
    public static String generateRunId() {
        return "RUN-" + LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss"));
    }
}

package com.nana.opsight.cli;

import com.nana.opsight.repository.IntegrityViolationException;
import com.nana.opsight.repository.SqliteEventRepository;
import com.nana.opsight.repository.SqliteOperatorRepository;
import com.nana.opsight.repository.SqliteSessionRepository;
import com.nana.opsight.service.EventIngestService;
import com.nana.opsight.service.OperatorSessionReconciler;
import com.nana.opsight.service.ValidationException;
import com.nana.opsight.util.AppConfig;
import com.nana.opsight.util.AppLogger;
import com.nana.opsight.util.BuildInfo;
import com.nana.opsight.util.DatabaseManager;
import com.nana.opsight.util.GlobalExceptionHandler;
import com.nana.opsight.util.IngestReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * OpsightCli - command-line entry point.
 *
 * <pre>
 *   opsight init-db [--db &lt;jdbc-url&gt;]
 *   opsight load --csv &lt;path&gt; [--chunksize &lt;n&gt;] [--db &lt;jdbc-url&gt;]
 * </pre>
 *
 * <p>Exit codes: 0 success, 1 the command failed, 2 the command line was
 * wrong. Flags override {@link AppConfig}.
 */
public final class OpsightCli {

    private static final Logger log = LoggerFactory.getLogger(OpsightCli.class);

    public static final int EXIT_OK      = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE   = 2;

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  opsight init-db [--db <jdbc-url>]",
            "  opsight load --csv <path> [--chunksize <n>] [--db <jdbc-url>]",
            "  opsight --version");

    private static final Set<String> INIT_OPTIONS = Set.of("--db");
    private static final Set<String> LOAD_OPTIONS = Set.of("--db", "--csv", "--chunksize");

    private final AppConfig config;

    public OpsightCli(AppConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        GlobalExceptionHandler.install();
        int exitCode = new OpsightCli(AppConfig.getInstance()).run(args, System.out, System.err);
        System.exit(exitCode);
    }

    // -----------------------------------------------------------------------
    // DISPATCH
    // -----------------------------------------------------------------------

    /**
     * Runs one command.
     *
     * @param args the command line, command first
     * @param out  receives progress and results
     * @param err  receives usage and failure messages
     * @return the process exit code
     */
    public int run(String[] args, PrintStream out, PrintStream err) {
        LocalDateTime start = LocalDateTime.now();
        AppLogger.setSessionContext(AppLogger.generateRunId());
        int exitCode = EXIT_FAILURE;
        try {
            if (args == null || args.length == 0) {
                err.println(USAGE);
                exitCode = EXIT_USAGE;
                return exitCode;
            }
            String command = args[0];
            AppLogger.logStartup(command);
            exitCode = switch (command) {
                case "init-db"   -> initDb(parseOptions(args, INIT_OPTIONS), out);
                case "load"      -> load(parseOptions(args, LOAD_OPTIONS), out);
                case "--version" -> printVersion(out);
                case "--help", "-h" -> printUsage(out);
                default -> throw new UsageException("Unknown command: " + command);
            };
        } catch (UsageException ex) {
            err.println("Error: " + ex.getMessage());
            err.println(USAGE);
            exitCode = EXIT_USAGE;
        } catch (ValidationException ex) {
            log.error("Load aborted: {}", ex.getMessage());
            err.println("Error: " + ex.getMessage());
            exitCode = EXIT_FAILURE;
        } catch (IntegrityViolationException ex) {
            log.error("Load stopped by an integrity violation.", ex);
            err.println("Integrity error: " + ex.getMessage());
            exitCode = EXIT_FAILURE;
        } catch (IOException ex) {
            log.error("Input could not be read.", ex);
            err.println("I/O error: " + ex.getMessage());
            exitCode = EXIT_FAILURE;
        } catch (RuntimeException ex) {
            log.error("Command failed unexpectedly.", ex);
            AppLogger.logErrorEvent("COMMAND_FAILED", GlobalExceptionHandler.describe(ex), ex);
            err.println("Error: " + GlobalExceptionHandler.describe(ex));
            exitCode = EXIT_FAILURE;
        } finally {
            AppLogger.logShutdown(start, exitCode);
            AppLogger.clearAllContext();
        }
        return exitCode;
    }

    // -----------------------------------------------------------------------
    // COMMANDS
    // -----------------------------------------------------------------------

    private int initDb(Map<String, String> options, PrintStream out) {
        AppLogger.setOperationContext("INIT_DB");
        try (DatabaseManager db = openDatabase(options)) {
            AppLogger.logEvent("DB_INITIALIZED", "url=" + db.getJdbcUrl()
                    + ", schemaVersion=" + db.getSchemaVersion());
            out.println("DB initialized");
            return EXIT_OK;
        } finally {
            AppLogger.clearOperationContext();
        }
    }

    private int load(Map<String, String> options, PrintStream out)
            throws UsageException, ValidationException, IOException {
        String csv = options.get("--csv");
        if (csv == null || csv.isBlank()) {
            throw new UsageException("load requires --csv <path>");
        }
        int chunkSize = chunkSize(options);
        Path csvPath = Paths.get(csv);

        try (DatabaseManager db = openDatabase(options)) {
            OperatorSessionReconciler reconciler = new OperatorSessionReconciler(
                    new SqliteOperatorRepository(db),
                    new SqliteSessionRepository(db),
                    config.getInactivityThresholdMinutes(),
                    config.getMaxBadShiftExamples());
            EventIngestService service = new EventIngestService(
                    db, reconciler, new SqliteEventRepository(db), chunkSize);

            IngestReport report = service.ingest(csvPath, chunk -> out.println(chunk.toProgressLine()));
            out.println(report.getSummary());
            return EXIT_OK;
        }
    }

    private static int printVersion(PrintStream out) {
        out.println(BuildInfo.getInstance().getBuildSummary());
        return EXIT_OK;
    }

    private static int printUsage(PrintStream out) {
        out.println(USAGE);
        return EXIT_OK;
    }

    // -----------------------------------------------------------------------
    // OPTION PARSING
    // -----------------------------------------------------------------------

    /**
     * Reads {@code --name value} pairs after the command.
     *
     * @throws UsageException on an unknown flag or a flag without a value
     */
    static Map<String, String> parseOptions(String[] args, Set<String> allowed) throws UsageException {
        Map<String, String> options = new HashMap<>();
        for (int i = 1; i < args.length; i++) {
            String name = args[i];
            if (!allowed.contains(name)) {
                throw new UsageException("Unknown option for " + args[0] + ": " + name);
            }
            if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
                throw new UsageException("Option " + name + " needs a value");
            }
            options.put(name, args[++i]);
        }
        return options;
    }

    /**
     * Opens the store named by {@code --db}, or the configured one. Either
     * way the schema exists when this returns.
     */
    private DatabaseManager openDatabase(Map<String, String> options) {
        String url = options.get("--db");
        if (url == null || url.isBlank()) {
            return DatabaseManager.getInstance();
        }
        DatabaseManager db = new DatabaseManager(url);
        db.initializeSchema();
        return db;
    }

    private int chunkSize(Map<String, String> options) throws UsageException {
        String raw = options.get("--chunksize");
        if (raw == null) {
            return config.getChunkSize();
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 1) {
                throw new UsageException("--chunksize must be at least 1, got " + value);
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new UsageException("--chunksize must be a whole number, got '" + raw + "'");
        }
    }

    /** A command line that cannot be run. */
    static final class UsageException extends Exception {

        UsageException(String message) {
            super(message);
        }
    }
}

package com.nana.opsight.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * DatabaseManager - owns the JDBC connection of a run.
 *
 * <p>RESPONSIBILITIES:
 * <ul>
 *   <li>Create the parent directory of a file-based SQLite URL.</li>
 *   <li>Open and hold a single {@link Connection}.</li>
 *   <li>Apply per-connection PRAGMAs (WAL, foreign keys, busy timeout).</li>
 *   <li>Create every table and index of {@link OpsightSchema} in one call
 *       and record the schema version.</li>
 *   <li>Close the connection on {@link #shutdown()}.</li>
 * </ul>
 *
 * <p>The loader is a single-threaded batch job, so one connection shared by
 * all repositories is enough. Each chunk's transaction is demarcated on this
 * connection and the repositories join it by calling
 * {@link #getConnection()}.
 *
 * <p>The process-wide instance comes from {@link #getInstance()} and is
 * configured from {@link AppConfig}; tests and the CLI's {@code --db} flag
 * use the public constructor with an explicit URL instead.
 */
public final class DatabaseManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DatabaseManager.class);

    // -----------------------------------------------------------------------
    // CONSTANTS
    // -----------------------------------------------------------------------

    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    /**
     * Schema version written to new databases. A database recording any
     * other version is refused.
     */
    static final int CURRENT_SCHEMA_VERSION = 1;

    private static final String PRAGMA_WAL  = "PRAGMA journal_mode=WAL;";

    /** SQLite ships with foreign keys off; cascades depend on this. */
    private static final String PRAGMA_FK   = "PRAGMA foreign_keys=ON;";

    private static final String PRAGMA_BUSY = "PRAGMA busy_timeout=5000;";

    // -----------------------------------------------------------------------
    // SINGLETON INSTANCE
    // -----------------------------------------------------------------------

    private static DatabaseManager instance;

    private final String jdbcUrl;

    private Connection connection;

    // -----------------------------------------------------------------------
    // CONSTRUCTION
    // -----------------------------------------------------------------------

    /**
     * Opens a connection to the given URL and configures it.
     *
     * <p>The schema is not created here; call {@link #initializeSchema()}.
     *
     * @param jdbcUrl a {@code jdbc:sqlite:} URL
     * @throws DatabaseInitException if the connection cannot be opened
     */
    public DatabaseManager(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
        log.info("Database URL resolved to: {}", jdbcUrl);
        try {
            initializeDirectory();
            openConnection();
            configurePragmas();
        } catch (SQLException | IOException ex) {
            throw new DatabaseInitException("Failed to open the database at: " + jdbcUrl, ex);
        }
    }

    /**
     * Returns the process-wide manager, opening it on first call with the
     * URL from {@link AppConfig} and creating the schema.
     *
     * @return the shared DatabaseManager
     * @throws DatabaseInitException if initialization failed
     */
    public static synchronized DatabaseManager getInstance() {
        if (instance == null) {
            DatabaseManager manager = new DatabaseManager(AppConfig.getInstance().getDatabaseUrl());
            manager.initializeSchema();
            instance = manager;
        }
        return instance;
    }

    /**
     * Returns the open JDBC {@link Connection}, reopening it if it was closed.
     *
     * @return the open, configured connection
     * @throws DatabaseInitException if the connection cannot be reopened
     */
    public Connection getConnection() {
        try {
            if (connection == null || connection.isClosed()) {
                log.warn("Connection was closed or null; attempting to reopen.");
                openConnection();
                configurePragmas();
            }
        } catch (SQLException ex) {
            throw new DatabaseInitException("Failed to reopen database connection.", ex);
        }
        return connection;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    /**
     * Checkpoints the WAL and closes the connection. Safe to call twice.
     */
    public void shutdown() {
        if (connection == null) {
            return;
        }
        try {
            if (!connection.isClosed()) {
                if (!connection.getAutoCommit()) {
                    connection.rollback();
                    log.warn("Open transaction rolled back during shutdown.");
                }
                try (Statement st = connection.createStatement()) {
                    st.execute("PRAGMA wal_checkpoint(TRUNCATE);");
                }
                connection.close();
                log.info("Database connection closed successfully.");
            }
        } catch (SQLException ex) {
            // Shutdown must not mask the error that ended the run.
            log.error("Error closing database connection during shutdown.", ex);
        }
        if (instance == this) {
            clearInstance();
        }
    }

    private static synchronized void clearInstance() {
        instance = null;
    }

    @Override
    public void close() {
        shutdown();
    }

    // -----------------------------------------------------------------------
    // SCHEMA
    // -----------------------------------------------------------------------

    /**
     * Creates every table and index that does not exist yet and records the
     * schema version on a new database. Idempotent.
     *
     * @throws DatabaseInitException if any DDL statement fails or the stored
     *                               schema version is not the current one
     */
    public void initializeSchema() {
        log.info("Running schema initialization (CREATE TABLE IF NOT EXISTS)...");
        try {
            try (Statement st = getConnection().createStatement()) {
                for (String ddl : OpsightSchema.statements()) {
                    st.execute(ddl);
                }
            }
            checkSchemaVersion();
            ReferenceDataLoader.seedShiftDefinitions(getConnection());
        } catch (SQLException ex) {
            throw new DatabaseInitException("Schema initialization failed for: " + jdbcUrl, ex);
        }
        log.info("Schema initialization complete ({} tables).", OpsightSchema.TABLE_NAMES.size());
    }

    /**
     * @return the stored schema version, or -1 if none has been recorded
     */
    public int getSchemaVersion() {
        try {
            return getStoredSchemaVersion();
        } catch (SQLException ex) {
            throw new DatabaseInitException("Failed to read schema version.", ex);
        }
    }

    // -----------------------------------------------------------------------
    // PRIVATE INITIALIZATION METHODS
    // -----------------------------------------------------------------------

    private void initializeDirectory() throws IOException {
        if (!jdbcUrl.startsWith(SQLITE_PREFIX)) {
            return;
        }
        String location = jdbcUrl.substring(SQLITE_PREFIX.length());
        int query = location.indexOf('?');
        if (query >= 0) {
            location = location.substring(0, query);
        }
        if (location.isBlank() || location.startsWith(":memory:") || location.startsWith("file:")) {
            return;
        }
        Path dir = Paths.get(location).toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
            log.info("Created database directory: {}", dir);
        }
    }

    private void openConnection() throws SQLException {
        connection = DriverManager.getConnection(jdbcUrl);
        DatabaseMetaData meta = connection.getMetaData();
        log.info("Connected to {} {} via driver {}",
                meta.getDatabaseProductName(),
                meta.getDatabaseProductVersion(),
                meta.getDriverVersion());
    }

    private void configurePragmas() throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute(PRAGMA_WAL);
            st.execute(PRAGMA_FK);
            st.execute(PRAGMA_BUSY);
            log.debug("SQLite PRAGMAs configured: WAL mode, FK enforcement, busy timeout.");
        }
    }

    private void checkSchemaVersion() throws SQLException {
        int storedVersion = getStoredSchemaVersion();

        if (storedVersion == -1) {
            insertSchemaVersion(CURRENT_SCHEMA_VERSION);
            log.info("New database. Schema version set to {}.", CURRENT_SCHEMA_VERSION);
            return;
        }
        if (storedVersion != CURRENT_SCHEMA_VERSION) {
            throw new SQLException("Database schema version " + storedVersion
                    + " is not supported by this build (expected " + CURRENT_SCHEMA_VERSION + ").");
        }
        log.debug("Schema is up to date at version {}.", CURRENT_SCHEMA_VERSION);
    }

    private int getStoredSchemaVersion() throws SQLException {
        String sql = "SELECT version FROM schema_version LIMIT 1;";
        try (PreparedStatement ps = getConnection().prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                return rs.getInt("version");
            }
            return -1;
        }
    }

    private void insertSchemaVersion(int version) throws SQLException {
        String sql = "INSERT INTO schema_version (version) VALUES (?);";
        try (PreparedStatement ps = getConnection().prepareStatement(sql)) {
            ps.setInt(1, version);
            ps.executeUpdate();
        }
    }

    // -----------------------------------------------------------------------
    // INNER EXCEPTION CLASS
    // -----------------------------------------------------------------------

    /**
     * Thrown when the database cannot be opened or its schema cannot be
     * created. Nothing can run without the store, so this is unchecked.
     */
    public static final class DatabaseInitException extends RuntimeException {

        public DatabaseInitException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

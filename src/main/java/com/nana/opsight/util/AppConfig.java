package com.nana.opsight.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * AppConfig - Application Configuration Manager
 *
 * <p>Values are resolved in layers, later layers winning:
 * <ol>
 *   <li>the defaults below,</li>
 *   <li>{@code opsight.properties} on the classpath,</li>
 *   <li>the file named by the {@code opsight.config} system property,</li>
 *   <li>JVM system properties with the same key.</li>
 * </ol>
 * Command-line flags are applied on top by the CLI through {@link #set}.
 */
public final class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    public static final String KEY_DB_URL                 = "db.url";
    public static final String KEY_CHUNK_SIZE             = "ingest.chunk.size";
    public static final String KEY_MAX_BAD_SHIFT_EXAMPLES = "ingest.max.bad.shift.examples";
    public static final String KEY_INACTIVITY_THRESHOLD   = "session.inactivity.threshold.minutes";

    /** System property naming an external properties file. */
    public static final String EXTERNAL_CONFIG_PROPERTY = "opsight.config";

    private static final String CLASSPATH_RESOURCE = "/opsight.properties";

    public static final int DEFAULT_CHUNK_SIZE             = 50_000;
    public static final int DEFAULT_INACTIVITY_THRESHOLD   = 10;
    public static final int DEFAULT_MAX_BAD_SHIFT_EXAMPLES = 10;

    private static final Properties DEFAULTS = new Properties();

    static {
        DEFAULTS.setProperty(KEY_DB_URL,                 "jdbc:sqlite:opsight.db");
        DEFAULTS.setProperty(KEY_CHUNK_SIZE,             String.valueOf(DEFAULT_CHUNK_SIZE));
        DEFAULTS.setProperty(KEY_MAX_BAD_SHIFT_EXAMPLES, String.valueOf(DEFAULT_MAX_BAD_SHIFT_EXAMPLES));
        DEFAULTS.setProperty(KEY_INACTIVITY_THRESHOLD,   String.valueOf(DEFAULT_INACTIVITY_THRESHOLD));
    }

    private static AppConfig instance;

    public static synchronized AppConfig getInstance() {
        if (instance == null) {
            instance = new AppConfig();
            instance.loadClasspathProperties();
            instance.loadExternalProperties();
            instance.applySystemOverrides();
            log.info("AppConfig loaded. db.url={}, chunk size={}",
                    instance.getDatabaseUrl(), instance.getChunkSize());
        }
        return instance;
    }

    /**
     * Builds a configuration from defaults plus the given values only,
     * ignoring the classpath, external file and system properties.
     *
     * @param overrides values to apply over the defaults; may be null
     * @return a standalone configuration
     */
    public static AppConfig of(Properties overrides) {
        AppConfig config = new AppConfig();
        if (overrides != null) {
            overrides.stringPropertyNames()
                    .forEach(k -> config.set(k, overrides.getProperty(k)));
        }
        return config;
    }

    private final Properties props;

    private AppConfig() {
        props = new Properties(DEFAULTS);
    }

    public String getString(String key) {
        return props.getProperty(key);
    }

    public int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            log.warn("Config key '{}' is not an integer; using {}.", key, defaultValue);
            return defaultValue;
        }
    }

    public void set(String key, String value) {
        props.setProperty(key, value);
    }

    // -----------------------------------------------------------------------
    // TYPED ACCESSORS
    // -----------------------------------------------------------------------

    public String getDatabaseUrl() {
        return getString(KEY_DB_URL);
    }

    /** @return rows per ingestion chunk, never less than 1 */
    public int getChunkSize() {
        return Math.max(1, getInt(KEY_CHUNK_SIZE, DEFAULT_CHUNK_SIZE));
    }

    public int getInactivityThresholdMinutes() {
        return getInt(KEY_INACTIVITY_THRESHOLD, DEFAULT_INACTIVITY_THRESHOLD);
    }

    public int getMaxBadShiftExamples() {
        return Math.max(1, getInt(KEY_MAX_BAD_SHIFT_EXAMPLES, DEFAULT_MAX_BAD_SHIFT_EXAMPLES));
    }

    // -----------------------------------------------------------------------
    // LOADING
    // -----------------------------------------------------------------------

    private void loadClasspathProperties() {
        try (InputStream in = AppConfig.class.getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in == null) {
                log.debug("{} not on classpath; using defaults.", CLASSPATH_RESOURCE);
                return;
            }
            props.load(in);
        } catch (IOException ex) {
            log.warn("Failed to load {}: {}", CLASSPATH_RESOURCE, ex.getMessage());
        }
    }

    private void loadExternalProperties() {
        String location = System.getProperty(EXTERNAL_CONFIG_PROPERTY);
        if (location == null || location.isBlank()) {
            return;
        }
        Path path = Paths.get(location);
        if (!Files.exists(path)) {
            log.warn("External config file not found: {}", path.toAbsolutePath());
            return;
        }
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
            log.info("External config loaded from {}", path.toAbsolutePath());
        } catch (IOException ex) {
            log.warn("Failed to load external config {}: {}", path, ex.getMessage());
        }
    }

    private void applySystemOverrides() {
        for (String key : DEFAULTS.stringPropertyNames()) {
            String value = System.getProperty(key);
            if (value != null && !value.isBlank()) {
                props.setProperty(key, value);
            }
        }
    }
}

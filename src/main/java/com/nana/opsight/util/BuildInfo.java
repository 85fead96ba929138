package com.nana.opsight.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * BuildInfo - reads the build metadata written into {@code build-info.properties}
 * by Maven resource filtering.
 */
public final class BuildInfo {

    private static final Logger log = LoggerFactory.getLogger(BuildInfo.class);
    private static final String BUILD_INFO_RESOURCE = "/build-info.properties";

    private static BuildInfo instance;

    public static synchronized BuildInfo getInstance() {
        if (instance == null) {
            instance = new BuildInfo();
        }
        return instance;
    }

    private final Properties buildProps = new Properties();

    private BuildInfo() {
        try (InputStream in = BuildInfo.class.getResourceAsStream(BUILD_INFO_RESOURCE)) {
            if (in != null) {
                buildProps.load(in);
                log.debug("BuildInfo loaded: version={}, built={}.", getVersion(), getBuildTimestamp());
            } else {
                log.warn("build-info.properties not found. Run mvn process-resources to generate.");
            }
        } catch (IOException ex) {
            log.warn("Failed to load build-info.properties.", ex);
        }
    }

    public String getVersion()        { return value("app.version", "1.0.0-SNAPSHOT"); }
    public String getAppName()        { return value("app.name", "OpSight Operator Behaviour Store"); }
    public String getBuildTimestamp() { return value("app.build.timestamp", "Unknown"); }
    public String getJavaVersion()    { return value("app.java.version", "Unknown"); }

    public String getBuildSummary() {
        return String.format("%s v%s | Built: %s", getAppName(), getVersion(), getBuildTimestamp());
    }

    /** Unfiltered placeholders (running from an IDE) count as missing. */
    private String value(String key, String fallback) {
        String v = buildProps.getProperty(key);
        if (v == null || v.isBlank() || v.startsWith("${")) {
            return fallback;
        }
        return v;
    }

    @Override
    public String toString() { return "BuildInfo{" + getBuildSummary() + "}"; }
}

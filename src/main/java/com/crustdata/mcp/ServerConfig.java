package com.crustdata.mcp;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server configuration. Values come from {@code crustdata-mcp.properties} on the classpath,
 * overridden by environment variables (key upper-cased, dots and dashes replaced by underscores,
 * e.g. {@code CRUSTDATA_MCP_PORT}), overridden in turn by JVM system properties with the same key.
 */
public final class ServerConfig {
    private static final Logger LOG = LoggerFactory.getLogger(ServerConfig.class);

    static final String RESOURCE_NAME = "crustdata-mcp.properties";

    public static final String PORT_KEY = "crustdata.mcp.port";
    public static final String THREADS_KEY = "crustdata.mcp.threads";
    public static final String BASE_URL_KEY = "crustdata.api.base-url";
    public static final String API_TOKEN_KEY = "crustdata.api.token";
    public static final String TELEMETRY_ENABLED_KEY = "crustdata.mcp.telemetry.enabled";
    public static final String TELEMETRY_DIR_KEY = "crustdata.mcp.telemetry.dir";

    static final int DEFAULT_PORT = 8080;
    static final int DEFAULT_THREADS = 4;
    static final int MAX_PORT = 65535;
    static final String DEFAULT_BASE_URL = "https://api.crustdata.com";

    private static final String[] KEYS = {
        PORT_KEY, THREADS_KEY, BASE_URL_KEY, API_TOKEN_KEY, TELEMETRY_ENABLED_KEY, TELEMETRY_DIR_KEY
    };

    private final int port;
    private final int threads;
    private final String apiBaseUrl;
    private final String apiToken;
    private final boolean telemetryEnabled;
    private final String telemetryDir;

    private ServerConfig(Properties props) {
        this.port = parseInt(props, PORT_KEY, DEFAULT_PORT, 0, MAX_PORT);
        this.threads = parseInt(props, THREADS_KEY, DEFAULT_THREADS, 1, Integer.MAX_VALUE);
        this.apiBaseUrl = props.getProperty(BASE_URL_KEY, DEFAULT_BASE_URL).trim();
        this.apiToken = props.getProperty(API_TOKEN_KEY, "").trim();
        this.telemetryEnabled = Boolean.parseBoolean(props.getProperty(TELEMETRY_ENABLED_KEY, "true").trim());
        final String dir = props.getProperty(TELEMETRY_DIR_KEY, "").trim();
        this.telemetryDir = dir.isEmpty()
            ? Paths.get(System.getProperty("user.home"), ".crustdata_mcp", "telemetry").toString()
            : dir;
    }

    /**
     * Load configuration from the classpath resource, the environment and system properties.
     */
    public static ServerConfig load() {
        return load(System.getenv(), System.getProperties());
    }

    static ServerConfig load(Map<String, String> env, Properties systemProps) {
        final Properties props = new Properties();
        try (InputStream in = ServerConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults", RESOURCE_NAME, e);
        }

        for (final String key : KEYS) {
            final String envValue = env.get(toEnvName(key));
            if (envValue != null) {
                props.setProperty(key, envValue);
            }
            final String sysValue = systemProps.getProperty(key);
            if (sysValue != null) {
                props.setProperty(key, sysValue);
            }
        }
        return new ServerConfig(props);
    }

    /**
     * Build a configuration from explicit properties only; unset keys take their defaults.
     */
    public static ServerConfig fromProperties(Properties props) {
        return new ServerConfig(props);
    }

    static String toEnvName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private static int parseInt(Properties props, String key, int defaultValue, int min, int max) {
        final String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        final int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            LOG.warn("Invalid value '{}' for {}, using {}", raw, key, defaultValue);
            return defaultValue;
        }
        if (value < min || value > max) {
            LOG.warn("Value {} for {} is outside {}..{}, using {}", value, key, min, max, defaultValue);
            return defaultValue;
        }
        return value;
    }

    public int getPort() {
        return port;
    }

    public int getThreads() {
        return threads;
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public String getApiToken() {
        return apiToken;
    }

    public boolean isTelemetryEnabled() {
        return telemetryEnabled;
    }

    public String getTelemetryDir() {
        return telemetryDir;
    }
}

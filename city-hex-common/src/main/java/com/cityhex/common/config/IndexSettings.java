package com.cityhex.common.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Resolved runtime configuration.
 *
 * Layering, lowest to highest precedence:
 *   1. cityhex.properties on the classpath
 *   2. environment variables: CITYHEX_ + key upper-cased, dots to underscores
 *      (store.path -> CITYHEX_STORE_PATH)
 *   3. JVM system properties with the plain key (-Dstore.path=...)
 */
public record IndexSettings(
    int minResolution,
    int maxResolution,
    String separator,
    String storePath,
    String datasetPath,
    String nameProperty,
    int writeBatchSize,
    int maxConsecutiveWriteFailures,
    int progressInterval,
    int queryParallelism,
    long queryTimeoutMillis
) {
    public static final String RESOURCE = "cityhex.properties";

    /** H3 defines resolutions 0..15. */
    public static final int GRID_MAX_RESOLUTION = 15;

    public IndexSettings {
        if (minResolution < 0 || maxResolution > GRID_MAX_RESOLUTION || minResolution > maxResolution) {
            throw new IllegalArgumentException(
                "index resolutions must satisfy 0 <= min <= max <= 15, got min=" + minResolution
                    + " max=" + maxResolution);
        }
        if (separator == null || separator.isEmpty() || separator.chars().anyMatch(IndexSettings::isHexChar)) {
            throw new IllegalArgumentException("index.separator must be non-empty and free of hex characters: '"
                + separator + "'");
        }
        requirePositive("load.batchSize", writeBatchSize);
        requirePositive("load.maxConsecutiveFailures", maxConsecutiveWriteFailures);
        requirePositive("load.progressInterval", progressInterval);
        requirePositive("query.parallelism", queryParallelism);
        requirePositive("query.timeoutMillis", queryTimeoutMillis);
    }

    public static IndexSettings defaults() {
        return new IndexSettings(2, 8, "#", "/tmp/city-hex-index", "usa_cities.geojson", "NAME",
                                 500, 50, 1000, 16, 30_000);
    }

    /** Loads the classpath defaults and applies environment and system-property overrides. */
    public static IndexSettings load() {
        return fromProperties(resolve(classpathDefaults(), System.getenv(), System.getProperties()));
    }

    public static IndexSettings fromProperties(Properties props) {
        var d = defaults();
        return new IndexSettings(
            intValue(props, "index.minResolution", d.minResolution()),
            intValue(props, "index.maxResolution", d.maxResolution()),
            props.getProperty("index.separator", d.separator()),
            props.getProperty("store.path", d.storePath()),
            props.getProperty("load.dataset", d.datasetPath()),
            props.getProperty("load.nameProperty", d.nameProperty()),
            intValue(props, "load.batchSize", d.writeBatchSize()),
            intValue(props, "load.maxConsecutiveFailures", d.maxConsecutiveWriteFailures()),
            intValue(props, "load.progressInterval", d.progressInterval()),
            intValue(props, "query.parallelism", d.queryParallelism()),
            longValue(props, "query.timeoutMillis", d.queryTimeoutMillis())
        );
    }

    static Properties resolve(Properties base, Map<String, String> env, Properties system) {
        var resolved = new Properties();
        resolved.putAll(base);
        for (String key : base.stringPropertyNames()) {
            String fromEnv = env.get(envName(key));
            if (fromEnv != null) {
                resolved.setProperty(key, fromEnv);
            }
            String fromSystem = system.getProperty(key);
            if (fromSystem != null) {
                resolved.setProperty(key, fromSystem);
            }
        }
        return resolved;
    }

    static String envName(String key) {
        return "CITYHEX_" + key.replace('.', '_').toUpperCase(Locale.ROOT);
    }

    private static Properties classpathDefaults() {
        var props = new Properties();
        try (InputStream in = IndexSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return props;
    }

    private static int intValue(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + raw + "'", e);
        }
    }

    private static long longValue(Properties props, String key, long fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + raw + "'", e);
        }
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive, got " + value);
        }
    }

    private static boolean isHexChar(int c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    public IndexSettings withStorePath(String path) {
        return new IndexSettings(minResolution, maxResolution, separator, path, datasetPath, nameProperty,
                                 writeBatchSize, maxConsecutiveWriteFailures, progressInterval,
                                 queryParallelism, queryTimeoutMillis);
    }

    public IndexSettings withDatasetPath(String path) {
        return new IndexSettings(minResolution, maxResolution, separator, storePath, path, nameProperty,
                                 writeBatchSize, maxConsecutiveWriteFailures, progressInterval,
                                 queryParallelism, queryTimeoutMillis);
    }
}

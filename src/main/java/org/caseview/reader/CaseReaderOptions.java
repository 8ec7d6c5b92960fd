package org.caseview.reader;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Reader settings, read from the {@code caseview.reader} section of a Typesafe config.
 *
 * @param preLoad        materialise every case into the caches at open
 * @param cacheByDefault cache policy for lookups that do not state one
 * @param busyTimeoutMs  SQLite busy timeout in milliseconds
 */
public record CaseReaderOptions(boolean preLoad, boolean cacheByDefault, int busyTimeoutMs) {

    public static final String CONFIG_PATH = "caseview.reader";

    private static final int DEFAULT_BUSY_TIMEOUT_MS = 5000;

    public CaseReaderOptions {
        if (busyTimeoutMs < 0) {
            throw new IllegalArgumentException("busy-timeout-ms must not be negative: " + busyTimeoutMs);
        }
    }

    /**
     * Reads options from a root config; missing keys fall back to the built-in defaults.
     */
    public static CaseReaderOptions fromConfig(Config config) {
        Config reader = config.hasPath(CONFIG_PATH) ? config.getConfig(CONFIG_PATH) : ConfigFactory.empty();
        boolean preLoad = reader.hasPath("pre-load") ? reader.getBoolean("pre-load") : false;
        boolean cacheByDefault = reader.hasPath("cache-by-default") ? reader.getBoolean("cache-by-default") : false;
        int busyTimeoutMs = reader.hasPath("busy-timeout-ms") ? reader.getInt("busy-timeout-ms") : DEFAULT_BUSY_TIMEOUT_MS;
        return new CaseReaderOptions(preLoad, cacheByDefault, busyTimeoutMs);
    }

    /**
     * @return options from the application config on the classpath.
     */
    public static CaseReaderOptions defaults() {
        return fromConfig(ConfigFactory.load());
    }

    public CaseReaderOptions withPreLoad(boolean value) {
        return new CaseReaderOptions(value, cacheByDefault, busyTimeoutMs);
    }

    public CaseReaderOptions withCacheByDefault(boolean value) {
        return new CaseReaderOptions(preLoad, value, busyTimeoutMs);
    }
}

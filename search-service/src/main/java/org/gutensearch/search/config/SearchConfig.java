package org.gutensearch.search.config;

import static org.gutensearch.core.config.PropertiesSupport.applyAlias;
import static org.gutensearch.core.config.PropertiesSupport.loadProperties;
import static org.gutensearch.core.config.PropertiesSupport.optionalInt;
import static org.gutensearch.core.config.PropertiesSupport.overlayEnvironment;
import static org.gutensearch.core.config.PropertiesSupport.requireInt;

import java.util.Map;
import java.util.Properties;

import org.gutensearch.core.storage.StorageSettings;

/**
 * Typed configuration for the Search Service.
 *
 * <p>Loads {@code application.properties}, overlays environment variables, then command-line
 * overrides. {@code PORT}, {@code BACKEND_TYPE}, {@code DATABASE_URL} and {@code MONGODB_URI}
 * are accepted as deployment aliases. Missing required keys fail fast with
 * {@link IllegalStateException}.</p>
 */
public record SearchConfig(
    int serverPort,
    int browseDefaultLimit,
    StorageSettings storage
) {
    public static final int DEFAULT_BROWSE_LIMIT = 100;

    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @param overrides {@code key=value} pairs given on the command line
     * @return a fully-initialized {@link SearchConfig}
     */
    public static SearchConfig load(Map<String, String> overrides) {
        Properties properties = loadProperties(SearchConfig.class, "application.properties");
        overlayEnvironment(properties);
        properties.putAll(overrides);
        return from(properties);
    }

    /**
     * Builds the configuration from already merged properties.
     */
    public static SearchConfig from(Properties p) {
        applyAlias(p, "PORT", "server.port");
        applyAlias(p, "BACKEND_TYPE", "storage.type");
        applyAlias(p, "DATABASE_URL", "storage.jdbc.url");
        applyAlias(p, "MONGODB_URI", "storage.mongodb.uri");

        int browseLimit = optionalInt(p, "search.browse.default.limit", DEFAULT_BROWSE_LIMIT);
        if (browseLimit < 1) {
            throw new IllegalStateException("search.browse.default.limit must be positive: " + browseLimit);
        }

        return new SearchConfig(
            requireInt(p, "server.port"),
            browseLimit,
            StorageSettings.from(p)
        );
    }
}

package org.gutensearch.indexing.config;

import static org.gutensearch.core.config.PropertiesSupport.applyAlias;
import static org.gutensearch.core.config.PropertiesSupport.loadProperties;
import static org.gutensearch.core.config.PropertiesSupport.optionalBoolean;
import static org.gutensearch.core.config.PropertiesSupport.optionalString;
import static org.gutensearch.core.config.PropertiesSupport.overlayEnvironment;
import static org.gutensearch.core.config.PropertiesSupport.requireInt;
import static org.gutensearch.core.config.PropertiesSupport.requireString;

import java.util.Map;
import java.util.Properties;

import org.gutensearch.core.storage.StorageSettings;

/**
 * Typed configuration for the Indexing Service.
 *
 * <p>Loads {@code application.properties}, overlays environment variables, then command-line
 * overrides. Deployment aliases are applied on top:
 * <ul>
 *   <li>{@code PORT} overrides {@code server.port}.</li>
 *   <li>{@code BACKEND_TYPE} overrides {@code storage.type}.</li>
 *   <li>{@code DATABASE_URL} and {@code MONGODB_URI} override the backend connection strings.</li>
 *   <li>{@code DATA_VOLUME_PATH} overrides {@code datalake.path}.</li>
 * </ul>
 * Missing required keys fail fast with {@link IllegalStateException}.</p>
 */
public record IndexingConfig(
    int serverPort,
    StorageSettings storage,
    Datalake datalake,
    boolean rebuildOnEmpty
) {
    /** Datalake location and tracking file settings. */
    public record Datalake(String path, String trackingFilename) {}

    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @param overrides {@code key=value} pairs given on the command line
     * @return a fully-initialized {@link IndexingConfig}
     */
    public static IndexingConfig load(Map<String, String> overrides) {
        Properties properties = loadProperties(IndexingConfig.class, "application.properties");
        overlayEnvironment(properties);
        properties.putAll(overrides);
        return from(properties);
    }

    /**
     * Builds the configuration from already merged properties.
     */
    public static IndexingConfig from(Properties p) {
        applyAlias(p, "PORT", "server.port");
        applyAlias(p, "BACKEND_TYPE", "storage.type");
        applyAlias(p, "DATABASE_URL", "storage.jdbc.url");
        applyAlias(p, "MONGODB_URI", "storage.mongodb.uri");
        applyAlias(p, "DATA_VOLUME_PATH", "datalake.path");

        return new IndexingConfig(
            requireInt(p, "server.port"),
            StorageSettings.from(p),
            readDatalake(p),
            optionalBoolean(p, "index.rebuild.on.empty", false)
        );
    }

    private static Datalake readDatalake(Properties p) {
        return new Datalake(
            requireString(p, "datalake.path"),
            optionalString(p, "datalake.tracking.filename", "downloaded_books.txt")
        );
    }
}

package org.gutensearch.core.storage;

import org.gutensearch.core.storage.hazelcast.HazelcastClientConfigFactory;
import org.gutensearch.core.storage.hazelcast.HazelcastConfigFactory;
import org.gutensearch.core.storage.hazelcast.HazelcastStorageBackend;
import org.gutensearch.core.storage.jdbc.PostgreSqlStorageBackend;
import org.gutensearch.core.storage.jdbc.SqliteStorageBackend;
import org.gutensearch.core.storage.mongo.MongoStorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hazelcast.client.HazelcastClient;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastException;
import com.hazelcast.core.HazelcastInstance;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Creates the configured {@link StorageBackend}. Each call returns a new, independently
 * pooled instance owned by the caller.
 */
public final class StorageBackendFactory {
    private static final Logger logger = LoggerFactory.getLogger(StorageBackendFactory.class);

    private static final String SQLITE_URL_PREFIX = "jdbc:sqlite:";

    private StorageBackendFactory() {}

    /**
     * @param settings storage settings
     * @return a backend for {@link StorageSettings#type()}
     * @throws StorageConnectionException if the backend cannot be opened
     */
    public static StorageBackend create(StorageSettings settings) throws StorageConnectionException {
        logger.info("  Storage backend: {}", settings.type());
        logger.info("  Call timeout: {} ms, pool size: {}", settings.callTimeout().toMillis(), settings.poolSize());

        return switch (settings.type()) {
            case HAZELCAST -> createHazelcast(settings);
            case POSTGRESQL -> new PostgreSqlStorageBackend(
                settings.jdbc().url(),
                settings.jdbc().username(),
                settings.jdbc().password(),
                settings.poolSize(),
                settings.callTimeout()
            );
            case SQLITE -> createSqlite(settings);
            case MONGODB -> new MongoStorageBackend(
                settings.mongo().uri(),
                settings.mongo().database(),
                settings.poolSize(),
                settings.callTimeout()
            );
        };
    }

    private static StorageBackend createHazelcast(StorageSettings settings) throws StorageConnectionException {
        StorageSettings.Hazelcast hz = settings.hazelcast();
        logger.info("  Hazelcast: {} of cluster '{}' via {}", hz.mode(), hz.clusterName(), hz.members());

        try {
            HazelcastInstance instance = switch (hz.mode()) {
                case MEMBER -> Hazelcast.newHazelcastInstance(HazelcastConfigFactory.build(hz, settings.callTimeout()));
                case CLIENT -> HazelcastClient.newHazelcastClient(
                    HazelcastClientConfigFactory.build(hz, settings.callTimeout()));
            };
            return new HazelcastStorageBackend(instance, hz.metadataMapName(), hz.invertedIndexName());
        } catch (HazelcastException | IllegalStateException e) {
            throw new StorageConnectionException("Failed to start Hazelcast " + hz.mode(), e);
        }
    }

    private static StorageBackend createSqlite(StorageSettings settings) throws StorageConnectionException {
        String url = settings.jdbc().url();
        if (url.startsWith(SQLITE_URL_PREFIX)) {
            Path parent = Paths.get(url.substring(SQLITE_URL_PREFIX.length())).toAbsolutePath().getParent();
            try {
                if (parent != null) {
                    Files.createDirectories(parent);
                }
            } catch (IOException e) {
                logger.warn("Failed to create datamart directory {}", parent, e);
            }
        }
        logger.info("  SQLite URL: {}", url);
        return new SqliteStorageBackend(url, settings.poolSize(), settings.callTimeout());
    }
}

package org.gutensearch.core.storage;

import static org.gutensearch.core.config.PropertiesSupport.optionalInt;
import static org.gutensearch.core.config.PropertiesSupport.optionalString;
import static org.gutensearch.core.config.PropertiesSupport.requireString;
import static org.gutensearch.core.config.PropertiesSupport.splitCsv;
import static org.gutensearch.core.config.PropertiesSupport.splitCsvInts;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * Storage backend selection and connection settings.
 *
 * <p>Only the section matching {@link #type()} is read; the others are {@code null}.</p>
 */
public record StorageSettings(
    Type type,
    Duration callTimeout,
    int poolSize,
    Hazelcast hazelcast,
    Jdbc jdbc,
    Mongo mongo
) {
    /** Supported backend variants. */
    public enum Type {
        HAZELCAST,
        POSTGRESQL,
        SQLITE,
        MONGODB;

        /**
         * Parses a configured backend name. Also accepts the deployment aliases
         * ({@code postgres}, and {@code redis} for the key-value variant).
         */
        public static Type parse(String value) {
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "hazelcast", "redis", "kv" -> HAZELCAST;
                case "postgresql", "postgres" -> POSTGRESQL;
                case "sqlite" -> SQLITE;
                case "mongodb", "mongo" -> MONGODB;
                default -> throw new IllegalStateException("Unknown storage.type: " + value
                    + ". Valid options: hazelcast, postgresql, sqlite, mongodb");
            };
        }
    }

    /** Whether this process joins the cluster as a member or connects as a client. */
    public enum HazelcastMode { MEMBER, CLIENT }

    /** Hazelcast cluster and data-structure settings. */
    public record Hazelcast(
        HazelcastMode mode,
        String clusterName,
        int port,
        List<Integer> memberPorts,
        int backupCount,
        int asyncBackupCount,
        String currentNodeIp,
        List<String> members,
        String metadataMapName,
        String invertedIndexName,
        Duration connectTimeout
    ) {}

    /** JDBC connection settings for the relational variants. */
    public record Jdbc(String url, String username, String password) {}

    /** MongoDB connection settings. */
    public record Mongo(String uri, String database) {}

    public static final int DEFAULT_CALL_TIMEOUT_MS = 5000;
    public static final int DEFAULT_POOL_SIZE = 10;
    public static final int DEFAULT_HAZELCAST_CONNECT_TIMEOUT_MS = 10000;

    /**
     * Reads the {@code storage.*} keys.
     *
     * @param p merged properties and environment
     * @return settings for the selected backend
     */
    public static StorageSettings from(Properties p) {
        Type type = Type.parse(optionalString(p, "storage.type", "hazelcast"));
        Duration callTimeout = Duration.ofMillis(optionalInt(p, "storage.call.timeout.ms", DEFAULT_CALL_TIMEOUT_MS));
        int poolSize = optionalInt(p, "storage.pool.size", DEFAULT_POOL_SIZE);
        if (poolSize <= 0) {
            throw new IllegalStateException("storage.pool.size must be positive: " + poolSize);
        }

        return switch (type) {
            case HAZELCAST -> new StorageSettings(type, callTimeout, poolSize, readHazelcast(p), null, null);
            case POSTGRESQL -> new StorageSettings(type, callTimeout, poolSize, null, readPostgres(p), null);
            case SQLITE -> new StorageSettings(type, callTimeout, poolSize, null, readSqlite(p), null);
            case MONGODB -> new StorageSettings(type, callTimeout, poolSize, null, null, readMongo(p));
        };
    }

    private static Hazelcast readHazelcast(Properties p) {
        String currentNodeIp = optionalString(p, "CURRENT_NODE_IP", "127.0.0.1");
        return new Hazelcast(
            HazelcastMode.valueOf(optionalString(p, "storage.hazelcast.mode", "member").toUpperCase(Locale.ROOT)),
            optionalString(p, "storage.hazelcast.cluster.name", "gutensearch"),
            optionalInt(p, "storage.hazelcast.port", 5701),
            splitCsvInts(p.getProperty("storage.hazelcast.member.ports"), List.of()),
            optionalInt(p, "storage.hazelcast.backup.count", 1),
            optionalInt(p, "storage.hazelcast.async.backup.count", 0),
            currentNodeIp,
            splitCsv(optionalString(p, "CLUSTER_NODES_LIST", currentNodeIp)),
            optionalString(p, "storage.hazelcast.map.metadata.name", "book-metadata"),
            optionalString(p, "storage.hazelcast.multimap.index.name", "inverted-index"),
            Duration.ofMillis(optionalInt(p, "storage.hazelcast.connect.timeout.ms", DEFAULT_HAZELCAST_CONNECT_TIMEOUT_MS))
        );
    }

    private static Jdbc readPostgres(Properties p) {
        return new Jdbc(
            requireString(p, "storage.jdbc.url"),
            optionalString(p, "storage.jdbc.username", null),
            optionalString(p, "storage.jdbc.password", null)
        );
    }

    private static Jdbc readSqlite(Properties p) {
        String url = optionalString(p, "storage.jdbc.url", null);
        if (url == null) {
            url = "jdbc:sqlite:" + optionalString(p, "storage.sqlite.path", "../datamart/gutensearch.sqlite");
        }
        return new Jdbc(url, null, null);
    }

    private static Mongo readMongo(Properties p) {
        return new Mongo(
            optionalString(p, "storage.mongodb.uri", "mongodb://localhost:27017"),
            optionalString(p, "storage.mongodb.database", "gutensearch")
        );
    }
}

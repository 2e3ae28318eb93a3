package org.gutensearch.indexing.bootstrap;

import java.util.Map;

import org.gutensearch.core.storage.StorageBackend;
import org.gutensearch.core.storage.StorageBackendFactory;
import org.gutensearch.core.storage.StorageException;
import org.gutensearch.core.text.MetadataExtractor;
import org.gutensearch.core.text.Tokenizer;
import org.gutensearch.indexing.config.IndexingConfig;
import org.gutensearch.indexing.controller.IndexingController;
import org.gutensearch.indexing.service.IndexingService;
import org.gutensearch.indexing.service.RebuildReport;
import org.gutensearch.indexing.source.DatalakeBookSource;
import org.gutensearch.indexing.web.IndexingHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.Javalin;

/**
 * Application bootstrapper for the Indexing Service.
 *
 * <p>Loads configuration, opens and verifies the storage backend, optionally rebuilds an
 * empty index, starts the HTTP server and registers a JVM shutdown hook.</p>
 */
public final class IndexingBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(IndexingBootstrap.class);

    private IndexingBootstrap() {}

    /**
     * Starts the Indexing Service.
     *
     * <p>On startup failure, logs the error and exits with code {@code 1}.</p>
     */
    public static void run(Map<String, String> overrides) {
        try {
            start(overrides);
        } catch (Exception e) {
            logger.error("Failed to start Indexing Service", e);
            System.exit(1);
        }
    }

    private static void start(Map<String, String> overrides) throws Exception {
        IndexingConfig cfg = IndexingConfig.load(overrides);
        logger.info("Starting Indexing Service...");
        logger.info("  Port: {}", cfg.serverPort());
        logger.info("  Datalake Path: {}", cfg.datalake().path());

        StorageBackend storage = openStorage(cfg);
        try {
            IndexingService service = buildService(storage, cfg);
            if (cfg.rebuildOnEmpty()) {
                runStartupConsistencyCheck(service);
            }
            Javalin app = IndexingHttpServer.start(cfg.serverPort(), new IndexingController(service));
            addShutdownHook(storage, app);
        } catch (Exception e) {
            storage.close();
            throw e;
        }
        logger.info("Indexing Service started on port {} using {} storage", cfg.serverPort(), storage.name());
    }

    private static StorageBackend openStorage(IndexingConfig cfg) throws StorageException {
        StorageBackend storage = StorageBackendFactory.create(cfg.storage());
        try {
            storage.testConnection();
        } catch (StorageException e) {
            storage.close();
            throw e;
        }
        return storage;
    }

    private static IndexingService buildService(StorageBackend storage, IndexingConfig cfg) {
        return new IndexingService(
            new DatalakeBookSource(cfg.datalake().path(), cfg.datalake().trackingFilename()),
            new MetadataExtractor(),
            new Tokenizer(),
            storage
        );
    }

    private static void runStartupConsistencyCheck(IndexingService service) throws Exception {
        if (!service.isIndexEmpty()) {
            return;
        }

        logger.warn("Index is empty. Entering re-indexing mode...");
        RebuildReport report = service.rebuildIndex();
        logger.info("Re-indexing mode complete. Indexed {} books, {} failed.",
            report.booksProcessed(), report.booksFailed());
    }

    private static void addShutdownHook(StorageBackend storage, Javalin app) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(storage, app)));
    }

    private static void shutdown(StorageBackend storage, Javalin app) {
        logger.info("Shutting down Indexing Service...");
        app.stop();
        storage.close();
        logger.info("Indexing Service stopped.");
    }
}

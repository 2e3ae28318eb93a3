package org.gutensearch.search.bootstrap;

import java.util.Map;

import org.gutensearch.core.storage.StorageBackend;
import org.gutensearch.core.storage.StorageBackendFactory;
import org.gutensearch.core.storage.StorageException;
import org.gutensearch.core.text.Tokenizer;
import org.gutensearch.search.config.SearchConfig;
import org.gutensearch.search.controller.SearchController;
import org.gutensearch.search.service.SearchService;
import org.gutensearch.search.web.SearchHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.Javalin;

/**
 * Application bootstrapper for the Search Service.
 *
 * <p>Loads configuration, opens and verifies the storage backend, starts the HTTP API and
 * registers a JVM shutdown hook.</p>
 */
public final class SearchBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(SearchBootstrap.class);

    private SearchBootstrap() {}

    /**
     * Starts the Search Service.
     *
     * <p>On startup failure, logs the error and exits with code {@code 1}.</p>
     */
    public static void run(Map<String, String> overrides) {
        try {
            start(overrides);
        } catch (Exception e) {
            logger.error("Failed to start Search Service", e);
            System.exit(1);
        }
    }

    private static void start(Map<String, String> overrides) throws Exception {
        SearchConfig cfg = SearchConfig.load(overrides);
        logger.info("Starting Search Service...");
        logger.info("  Port: {}", cfg.serverPort());

        StorageBackend storage = openStorage(cfg);
        try {
            Javalin app = startHttp(cfg, storage);
            addShutdownHook(storage, app);
        } catch (Exception e) {
            storage.close();
            throw e;
        }
        logger.info("Search Service started on port {} using {} storage", cfg.serverPort(), storage.name());
    }

    private static StorageBackend openStorage(SearchConfig cfg) throws StorageException {
        StorageBackend storage = StorageBackendFactory.create(cfg.storage());
        try {
            storage.testConnection();
        } catch (StorageException e) {
            storage.close();
            throw e;
        }
        return storage;
    }

    private static Javalin startHttp(SearchConfig cfg, StorageBackend storage) {
        SearchService service = new SearchService(new Tokenizer(), storage);
        SearchController controller = new SearchController(service, cfg.browseDefaultLimit());
        return SearchHttpServer.start(cfg.serverPort(), controller);
    }

    private static void addShutdownHook(StorageBackend storage, Javalin app) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(storage, app)));
    }

    private static void shutdown(StorageBackend storage, Javalin app) {
        logger.info("Shutting down Search Service...");
        app.stop();
        storage.close();
        logger.info("Search Service stopped.");
    }
}

package org.gutensearch.indexing.web;

import org.gutensearch.indexing.controller.IndexingController;

import io.javalin.Javalin;

/** HTTP server wiring for the Indexing Service. */
public final class IndexingHttpServer {
    private IndexingHttpServer() {}

    /**
     * Starts the Javalin HTTP server and registers routes.
     *
     * @param port port to bind, {@code 0} for any free port
     * @param controller route handlers
     * @return started {@link Javalin} instance
     */
    public static Javalin start(int port, IndexingController controller) {
        Javalin app = Javalin.create(cfg -> {
            cfg.http.defaultContentType = "application/json";
            cfg.showJavalinBanner = false;
        });
        controller.registerRoutes(app);
        return app.start(port);
    }
}

package org.gutensearch.search.web;

import org.gutensearch.search.controller.SearchController;

import io.javalin.Javalin;

/** HTTP server wiring for the Search Service. */
public final class SearchHttpServer {
    private SearchHttpServer() {}

    /**
     * Starts the Javalin HTTP server and registers routes.
     *
     * @param port port to bind, {@code 0} for any free port
     * @param controller route handlers
     * @return started {@link Javalin} instance
     */
    public static Javalin start(int port, SearchController controller) {
        Javalin app = Javalin.create(cfg -> {
            cfg.http.defaultContentType = "application/json";
            cfg.showJavalinBanner = false;
        });
        controller.registerRoutes(app);
        return app.start(port);
    }
}

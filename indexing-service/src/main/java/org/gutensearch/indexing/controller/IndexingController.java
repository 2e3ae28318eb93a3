package org.gutensearch.indexing.controller;

import com.google.gson.Gson;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.gutensearch.core.json.GsonFactory;
import org.gutensearch.core.model.IndexStats;
import org.gutensearch.core.model.ServiceStatus;
import org.gutensearch.indexing.model.IndexFailureResponse;
import org.gutensearch.indexing.model.IndexResponse;
import org.gutensearch.indexing.model.IndexStatusResponse;
import org.gutensearch.indexing.model.RebuildResponse;
import org.gutensearch.indexing.service.IndexingService;
import org.gutensearch.indexing.service.RebuildReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

public class IndexingController {
	private static final Logger logger = LoggerFactory.getLogger(IndexingController.class);
	private static final Gson gson = GsonFactory.create();
	private static final String SERVICE_NAME = "indexing-service";

	private final IndexingService indexingService;

	public IndexingController(IndexingService indexingService) {
		this.indexingService = indexingService;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/status", this::handleStatus);

		app.post("/index/update/{book_id}", this::handleIndexUpdate);

		app.post("/index/rebuild", this::handleIndexRebuild);

		app.get("/index/status", this::handleIndexStatus);

		logger.info("Indexing routes registered");
	}

	/**
	 * GET /status
	 * Liveness check, does not touch the backend
	 */
	private void handleStatus(Context ctx) {
		ServiceStatus status = ServiceStatus.running(SERVICE_NAME, indexingService.backendName());
		ctx.result(gson.toJson(status));
	}

	/**
	 * POST /index/update/{book_id}
	 * Index a specific book
	 */
	private void handleIndexUpdate(Context ctx) {
		int bookId;
		try {
			bookId = Integer.parseInt(ctx.pathParam("book_id"));
		} catch (NumberFormatException e) {
			IndexFailureResponse response = IndexFailureResponse.of(-1, "Invalid book_id format. Must be an integer.");
			ctx.status(400).result(gson.toJson(response));
			logger.warn("Invalid book_id format in request: {}", ctx.pathParam("book_id"));
			return;
		}

		try {
			logger.info("Received index update request for book {}", bookId);

			indexingService.indexBook(bookId);

			ctx.status(200).result(gson.toJson(IndexResponse.updated(bookId)));
			logger.info("Successfully indexed book {}", bookId);

		} catch (Exception e) {
			IndexFailureResponse response = IndexFailureResponse.of(bookId, e.getMessage());
			ctx.status(500).result(gson.toJson(response));
			logger.error("Failed to index book {}: {}", bookId, e.getMessage());
		}
	}

	/**
	 * POST /index/rebuild
	 * Rebuild entire index from all books in datalake
	 */
	private void handleIndexRebuild(Context ctx) {
		try {
			logger.info("Received index rebuild request");

			RebuildReport report = indexingService.rebuildIndex();

			ctx.status(200).result(gson.toJson(RebuildResponse.from(report)));
			logger.info("Rebuilt index with {} books ({} failed)", report.booksProcessed(), report.booksFailed());

		} catch (Exception e) {
			Map<String, String> error = new HashMap<>();
			error.put("status", "failed");
			error.put("error", e.getMessage());
			ctx.status(500).result(gson.toJson(error));
			logger.error("Failed to rebuild index: {}", e.getMessage(), e);
		}
	}

	/**
	 * GET /index/status
	 * Get indexing statistics
	 */
	private void handleIndexStatus(Context ctx) {
		try {
			IndexStats stats = indexingService.getStats();

			IndexStatusResponse response = IndexStatusResponse.from(stats, LocalDateTime.now().toString());

			ctx.status(200).result(gson.toJson(response));
			logger.debug("Retrieved index status: {} books, {} MB",
					stats.booksIndexed(), stats.indexSizeMb());

		} catch (Exception e) {
			Map<String, String> error = new HashMap<>();
			error.put("error", "Failed to retrieve index status: " + e.getMessage());
			ctx.status(500).result(gson.toJson(error));
			logger.error("Failed to get index status: {}", e.getMessage());
		}
	}
}

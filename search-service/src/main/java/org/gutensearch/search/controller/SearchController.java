package org.gutensearch.search.controller;

import com.google.gson.Gson;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.gutensearch.core.json.GsonFactory;
import org.gutensearch.core.model.ServiceStatus;
import org.gutensearch.search.model.SearchFilters;
import org.gutensearch.search.model.SearchResponse;
import org.gutensearch.search.model.SearchResult;
import org.gutensearch.search.service.InvalidQueryException;
import org.gutensearch.search.service.SearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class SearchController {
	private static final Logger logger = LoggerFactory.getLogger(SearchController.class);
	private static final Gson gson = GsonFactory.create();
	private static final String SERVICE_NAME = "search-service";

	private final SearchService searchService;
	private final int browseDefaultLimit;

	public SearchController(SearchService searchService, int browseDefaultLimit) {
		this.searchService = searchService;
		this.browseDefaultLimit = browseDefaultLimit;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/status", this::handleStatus);

		app.get("/search", this::handleSearch);

		app.get("/books", this::handleBrowse);

		app.get("/stats", this::handleStats);

		logger.info("Search routes registered");
	}

	/**
	 * GET /status
	 * Liveness check, does not touch the backend
	 */
	private void handleStatus(Context ctx) {
		ctx.result(gson.toJson(ServiceStatus.running(SERVICE_NAME, searchService.backendName())));
	}

	/**
	 * GET /search?q={query}&author={author}&language={lang}&year={year}&limit={limit}
	 * Search for books
	 */
	private void handleSearch(Context ctx) {
		try {
			String query = ctx.queryParam("q");
			Integer year = parseOptionalInt(ctx.queryParam("year"));
			Integer limit = parseOptionalInt(ctx.queryParam("limit"));
			SearchFilters filters = new SearchFilters(ctx.queryParam("author"), ctx.queryParam("language"), year);

			logger.info("Search request: q='{}', filters={}, limit={}", query, filters.asMap(), limit);

			SearchResponse response = searchService.search(query, filters, limit);

			ctx.status(200).result(gson.toJson(response));

		} catch (NumberFormatException e) {
			badRequest(ctx, "Invalid year or limit format. Must be an integer.");
		} catch (InvalidQueryException e) {
			badRequest(ctx, e.getMessage());
		} catch (Exception e) {
			Map<String, String> error = new HashMap<>();
			error.put("error", "Search failed: " + e.getMessage());
			ctx.status(500).result(gson.toJson(error));
			logger.error("Search failed", e);
		}
	}

	/**
	 * GET /books?limit={limit}
	 * Browse books by id (no search query)
	 */
	private void handleBrowse(Context ctx) {
		try {
			Integer limitParam = parseOptionalInt(ctx.queryParam("limit"));
			int limit = limitParam == null ? browseDefaultLimit : limitParam;
			if (limit < 1) {
				badRequest(ctx, "Limit must be positive.");
				return;
			}

			logger.info("Browse request: limit={}", limit);

			List<SearchResult> books = searchService.browse(limit);

			Map<String, Object> response = new HashMap<>();
			response.put("count", books.size());
			response.put("books", books);

			ctx.status(200).result(gson.toJson(response));
			logger.info("Returned {} books for browsing", books.size());

		} catch (NumberFormatException e) {
			badRequest(ctx, "Invalid limit format. Must be an integer.");
		} catch (Exception e) {
			Map<String, String> error = new HashMap<>();
			error.put("error", "Browse failed: " + e.getMessage());
			ctx.status(500).result(gson.toJson(error));
			logger.error("Browse failed", e);
		}
	}

	/**
	 * GET /stats
	 * Get index statistics
	 */
	private void handleStats(Context ctx) {
		try {
			ctx.status(200).result(gson.toJson(searchService.getStats()));
			logger.debug("Retrieved search statistics");

		} catch (Exception e) {
			Map<String, String> error = new HashMap<>();
			error.put("error", "Failed to retrieve statistics: " + e.getMessage());
			ctx.status(500).result(gson.toJson(error));
			logger.error("Failed to get statistics", e);
		}
	}

	private static Integer parseOptionalInt(String value) {
		if (value == null || value.isBlank()) {
			return null;
		}
		return Integer.parseInt(value.trim());
	}

	private static void badRequest(Context ctx, String message) {
		Map<String, String> error = new HashMap<>();
		error.put("error", message);
		ctx.status(400).result(gson.toJson(error));
		logger.warn("Rejected request {}: {}", ctx.fullUrl(), message);
	}
}

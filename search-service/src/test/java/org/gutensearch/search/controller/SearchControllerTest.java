package org.gutensearch.search.controller;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.javalin.Javalin;
import org.gutensearch.core.storage.jdbc.SqliteStorageBackend;
import org.gutensearch.core.text.Tokenizer;
import org.gutensearch.search.service.SearchFixtures;
import org.gutensearch.search.service.SearchService;
import org.gutensearch.search.web.SearchHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class SearchControllerTest {

	@TempDir
	Path tempDir;

	private final HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
	private SqliteStorageBackend storage;
	private Javalin app;
	private String baseUrl;

	@BeforeEach
	public void setUp() throws Exception {
		storage = new SqliteStorageBackend("jdbc:sqlite:" + tempDir.resolve("index.sqlite"), 4, Duration.ofSeconds(5));
		SearchFixtures.seed(storage);
		SearchService service = new SearchService(new Tokenizer(), storage);

		app = SearchHttpServer.start(0, new SearchController(service, 3));
		baseUrl = "http://localhost:" + app.port();
	}

	@AfterEach
	public void tearDown() {
		app.stop();
		storage.close();
	}

	private HttpResponse<String> get(String pathAndQuery) throws Exception {
		HttpRequest request = HttpRequest.newBuilder()
				.uri(URI.create(baseUrl + pathAndQuery))
				.timeout(Duration.ofSeconds(10))
				.GET()
				.build();
		return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
	}

	private static JsonObject json(HttpResponse<String> response) {
		return JsonParser.parseString(response.body()).getAsJsonObject();
	}

	@Test
	public void testSearch() throws Exception {
		HttpResponse<String> response = get("/search?q=pride&language=en");

		assertEquals(200, response.statusCode());
		assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
		JsonObject body = json(response);
		assertEquals("pride", body.get("query").getAsString());
		assertEquals("en", body.getAsJsonObject("filters").get("language").getAsString());
		assertEquals(1, body.get("count").getAsInt());

		JsonObject result = body.getAsJsonArray("results").get(0).getAsJsonObject();
		assertEquals(1342, result.get("book_id").getAsInt());
		assertEquals("Jane Austen", result.get("author").getAsString());
		assertEquals(1813, result.get("year").getAsInt());
		assertEquals(1, result.get("score").getAsInt());
		assertEquals("pride", result.getAsJsonArray("matches").get(0).getAsString());
	}

	@Test
	public void testMissingYearIsSerializedAsNull() throws Exception {
		JsonObject body = json(get("/search?q=monde"));

		JsonObject result = body.getAsJsonArray("results").get(0).getAsJsonObject();
		assertEquals(5000, result.get("book_id").getAsInt());
		assertTrue(result.get("year").isJsonNull());
	}

	@Test
	public void testUnknownWordReturnsEmptyResults() throws Exception {
		HttpResponse<String> response = get("/search?q=xyzneverexistingword");

		assertEquals(200, response.statusCode());
		assertEquals(0, json(response).get("count").getAsInt());
		assertEquals(0, json(response).getAsJsonArray("results").size());
	}

	@Test
	public void testBadRequests() throws Exception {
		for (String query : new String[] {"/search", "/search?q=", "/search?q=%20%20",
				"/search?q=alice&year=abc", "/search?q=alice&limit=ten", "/search?q=alice&limit=-1"}) {
			HttpResponse<String> response = get(query);

			assertEquals(400, response.statusCode(), query);
			assertTrue(json(response).has("error"), query);
		}
	}

	@Test
	public void testLimit() throws Exception {
		JsonObject body = json(get("/search?q=alice%20wonderland&limit=1"));

		assertEquals(1, body.get("count").getAsInt());
		assertEquals(11, body.getAsJsonArray("results").get(0).getAsJsonObject().get("book_id").getAsInt());
	}

	@Test
	public void testBrowse() throws Exception {
		JsonObject defaultPage = json(get("/books"));
		JsonObject firstTwo = json(get("/books?limit=2"));

		assertEquals(3, defaultPage.get("count").getAsInt());
		JsonArray books = firstTwo.getAsJsonArray("books");
		assertEquals(2, books.size());
		assertEquals(11, books.get(0).getAsJsonObject().get("book_id").getAsInt());
		assertEquals(400, get("/books?limit=0").statusCode());
	}

	@Test
	public void testStats() throws Exception {
		HttpResponse<String> response = get("/stats");

		assertEquals(200, response.statusCode());
		JsonObject body = json(response);
		assertEquals(5, body.get("books_indexed").getAsInt());
		assertTrue(body.get("unique_words").getAsInt() > 0);
		assertTrue(body.has("index_size_mb"));
	}

	@Test
	public void testStatus() throws Exception {
		JsonObject body = json(get("/status"));

		assertEquals("search-service", body.get("service").getAsString());
		assertEquals("running", body.get("status").getAsString());
		assertEquals("sqlite", body.get("backend").getAsString());
	}
}

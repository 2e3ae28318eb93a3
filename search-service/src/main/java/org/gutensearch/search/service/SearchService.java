package org.gutensearch.search.service;

import org.gutensearch.core.model.BookMetadata;
import org.gutensearch.core.model.IndexStats;
import org.gutensearch.core.storage.StorageBackend;
import org.gutensearch.core.storage.StorageException;
import org.gutensearch.core.text.Tokenizer;
import org.gutensearch.search.model.SearchFilters;
import org.gutensearch.search.model.SearchResponse;
import org.gutensearch.search.model.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Query engine over the shared storage backend.
 *
 * <p>Candidates are the union of the books indexed under any query word. Ranking does not
 * look at the index: a candidate scores one point per query word found in its title or
 * author, so a book matched through its body alone ranks with score 0.</p>
 */
public class SearchService {
	private static final Logger logger = LoggerFactory.getLogger(SearchService.class);

	private static final Comparator<SearchResult> RANKING =
			Comparator.comparingInt(SearchResult::score).reversed()
					.thenComparingInt(SearchResult::bookId);

	private final Tokenizer tokenizer;
	private final StorageBackend storage;

	public SearchService(Tokenizer tokenizer, StorageBackend storage) {
		this.tokenizer = tokenizer;
		this.storage = storage;
	}

	/**
	 * Search books matching any word of the query
	 * @param limit maximum number of results, {@code null} for all
	 * @throws InvalidQueryException if the query is blank or the limit negative
	 */
	public SearchResponse search(String query, SearchFilters filters, Integer limit) throws StorageException {
		if (query == null || query.isBlank()) {
			throw new InvalidQueryException("Query parameter 'q' is required.");
		}
		if (limit != null && limit < 0) {
			throw new InvalidQueryException("Limit must not be negative.");
		}
		String trimmed = query.trim();
		SearchFilters active = filters == null ? SearchFilters.none() : filters;

		// Sorted so that matches come out in ascending order.
		Set<String> queryWords = new TreeSet<>(tokenizer.tokenize(trimmed));
		if (queryWords.isEmpty()) {
			logger.info("Query '{}' has no searchable words", trimmed);
			return new SearchResponse(trimmed, active.asMap(), 0, List.of());
		}

		Set<Integer> candidates = new TreeSet<>();
		for (String word : queryWords) {
			candidates.addAll(storage.getBooksForWord(word));
		}
		logger.debug("Query '{}' produced {} candidates", trimmed, candidates.size());

		List<SearchResult> results = new ArrayList<>();
		for (int bookId : candidates) {
			Optional<BookMetadata> metadata = storage.getBookMetadata(bookId);
			if (metadata.isEmpty()) {
				logger.warn("Book {} is indexed but has no metadata, skipping", bookId);
				continue;
			}
			BookMetadata book = metadata.get();
			if (active.matches(book)) {
				results.add(rank(book, queryWords));
			}
		}

		results.sort(RANKING);
		if (limit != null && results.size() > limit) {
			results = new ArrayList<>(results.subList(0, limit));
		}

		logger.info("Search '{}' returned {} results", trimmed, results.size());
		return new SearchResponse(trimmed, active.asMap(), results.size(), results);
	}

	private SearchResult rank(BookMetadata book, Set<String> queryWords) {
		String haystack = (nullToEmpty(book.title()) + " " + nullToEmpty(book.author())).toLowerCase(Locale.ROOT);
		List<String> matches = new ArrayList<>();
		for (String word : queryWords) {
			if (haystack.contains(word)) {
				matches.add(word);
			}
		}
		return SearchResult.fromMetadata(book, matches.size(), matches);
	}

	/**
	 * List books by ascending id without a query
	 */
	public List<SearchResult> browse(int limit) throws StorageException {
		return storage.listBooks(limit).stream()
				.map(book -> SearchResult.fromMetadata(book, 0, List.of()))
				.toList();
	}

	public IndexStats getStats() throws StorageException {
		return storage.stats();
	}

	public String backendName() {
		return storage.name();
	}

	private static String nullToEmpty(String value) {
		return value == null ? "" : value;
	}
}

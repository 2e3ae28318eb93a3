package org.gutensearch.indexing.service;

import org.gutensearch.core.model.BookMetadata;
import org.gutensearch.core.model.IndexStats;
import org.gutensearch.core.storage.StorageBackend;
import org.gutensearch.core.storage.StorageException;
import org.gutensearch.core.text.MetadataExtractor;
import org.gutensearch.core.text.Tokenizer;
import org.gutensearch.indexing.source.BookSource;
import org.gutensearch.indexing.source.BookText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class IndexingService {
	private static final Logger logger = LoggerFactory.getLogger(IndexingService.class);

	private final BookSource bookSource;
	private final MetadataExtractor metadataExtractor;
	private final Tokenizer tokenizer;
	private final StorageBackend storage;

	public IndexingService(BookSource bookSource, MetadataExtractor metadataExtractor,
						   Tokenizer tokenizer, StorageBackend storage) {
		this.bookSource = bookSource;
		this.metadataExtractor = metadataExtractor;
		this.tokenizer = tokenizer;
		this.storage = storage;
	}

	/**
	 * Index a single book: metadata first, then every distinct body and title word.
	 */
	public void indexBook(int bookId) throws IOException, StorageException {
		logger.info("Starting indexing for book {} into {}", bookId, storage.name());

		BookText text = bookSource.locate(bookId);

		BookMetadata extracted = metadataExtractor.extractMetadata(bookId, text.header());
		Set<String> bodyWords = tokenizer.tokenize(text.body());
		Set<String> titleWords = tokenizer.tokenize(extracted.title());

		// unique_words counts body words only; title words are still searchable.
		BookMetadata metadata = extracted.withCounts(tokenizer.countWords(text.body()), bodyWords.size());
		storage.storeBookMetadata(metadata);
		logger.info("Saved metadata for book {}: {}", bookId, metadata.title());

		Set<String> words = new HashSet<>(bodyWords);
		words.addAll(titleWords);
		for (String word : words) {
			storage.addWordToIndex(word, bookId);
		}
		logger.info("Indexed {} unique words for book {}", words.size(), bookId);
	}

	/**
	 * Clear the index and re-index every book the datalake knows about.
	 * Individual failures are logged and reported, never propagated.
	 */
	public RebuildReport rebuildIndex() throws IOException, StorageException {
		logger.info("Starting full index rebuild...");
		long start = System.nanoTime();

		storage.clearIndex();
		List<Integer> bookIds = bookSource.listKnownIds();
		logger.info("Found {} books to index", bookIds.size());

		int successCount = 0;
		List<Integer> failed = new ArrayList<>();
		for (int bookId : bookIds) {
			try {
				indexBook(bookId);
				successCount++;
			} catch (IOException | StorageException | RuntimeException e) {
				failed.add(bookId);
				logger.error("Failed to index book {}: {}", bookId, e.getMessage(), e);
			}
		}

		Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
		logger.info("Index rebuild complete: {} books succeeded, {} failed in {} ms",
				successCount, failed.size(), elapsed.toMillis());
		return new RebuildReport(successCount, List.copyOf(failed), elapsed);
	}

	public IndexStats getStats() throws StorageException {
		return storage.stats();
	}

	public boolean isIndexEmpty() throws StorageException {
		return storage.stats().booksIndexed() == 0;
	}

	public String backendName() {
		return storage.name();
	}
}

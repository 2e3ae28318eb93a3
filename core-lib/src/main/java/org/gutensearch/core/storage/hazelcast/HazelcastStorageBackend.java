package org.gutensearch.core.storage.hazelcast;

import com.hazelcast.core.HazelcastException;
import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import com.hazelcast.multimap.MultiMap;
import org.gutensearch.core.model.BookMetadata;
import org.gutensearch.core.model.IndexStats;
import org.gutensearch.core.storage.StorageBackend;
import org.gutensearch.core.storage.StorageConnectionException;
import org.gutensearch.core.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Key-value backend on a Hazelcast cluster.
 *
 * <p>Metadata lives in an {@link IMap} keyed by book id; the inverted index is a
 * {@link MultiMap} whose value collection is a set. The Hazelcast instance is thread-safe
 * and owns its own connection handling, so a single backend serves all request threads.</p>
 */
public class HazelcastStorageBackend implements StorageBackend {
	private static final Logger logger = LoggerFactory.getLogger(HazelcastStorageBackend.class);

	// Rough per-entry footprints used for the size estimate.
	private static final int METADATA_ENTRY_BYTES = 256;
	private static final int WORD_KEY_BYTES = 48;
	private static final int POSTING_BYTES = 16;

	private final HazelcastInstance hazelcast;
	private final String metadataMapName;
	private final String invertedIndexName;

	public HazelcastStorageBackend(HazelcastInstance hazelcast, String metadataMapName, String invertedIndexName) {
		this.hazelcast = hazelcast;
		this.metadataMapName = metadataMapName;
		this.invertedIndexName = invertedIndexName;
	}

	@Override
	public void testConnection() throws StorageConnectionException {
		try {
			if (!hazelcast.getLifecycleService().isRunning()) {
				throw new StorageConnectionException("Hazelcast instance is not running");
			}
			int books = metadata().size();
			logger.info("Hazelcast instance '{}' reachable ({} books in '{}')",
					hazelcast.getName(), books, metadataMapName);
		} catch (HazelcastException | IllegalStateException e) {
			throw new StorageConnectionException("Hazelcast cluster unreachable: " + e.getMessage(), e);
		}
	}

	@Override
	public void storeBookMetadata(BookMetadata metadata) throws StorageException {
		try {
			metadata().set(metadata.bookId(), metadata);
			logger.debug("Saved metadata for book {}", metadata.bookId());
		} catch (HazelcastException | IllegalStateException e) {
			throw new StorageException("Failed to save metadata for book " + metadata.bookId(), e);
		}
	}

	@Override
	public void addWordToIndex(String word, int bookId) throws StorageException {
		try {
			invertedIndex().put(word, bookId);
		} catch (HazelcastException | IllegalStateException e) {
			throw new StorageException("Failed to index word '" + word + "' for book " + bookId, e);
		}
	}

	@Override
	public Set<Integer> getBooksForWord(String word) throws StorageException {
		try {
			Collection<Integer> books = invertedIndex().get(word);
			return books == null ? new HashSet<>() : new HashSet<>(books);
		} catch (HazelcastException | IllegalStateException e) {
			throw new StorageException("Failed to look up word '" + word + "'", e);
		}
	}

	@Override
	public Optional<BookMetadata> getBookMetadata(int bookId) throws StorageException {
		try {
			return Optional.ofNullable(metadata().get(bookId));
		} catch (HazelcastException | IllegalStateException e) {
			throw new StorageException("Failed to find book " + bookId, e);
		}
	}

	@Override
	public List<BookMetadata> listBooks(int limit) throws StorageException {
		try {
			return metadata().values().stream()
					.sorted(Comparator.comparingInt(BookMetadata::bookId))
					.limit(limit > 0 ? limit : Long.MAX_VALUE)
					.toList();
		} catch (HazelcastException | IllegalStateException e) {
			throw new StorageException("Failed to list books", e);
		}
	}

	@Override
	public void clearIndex() throws StorageException {
		try {
			metadata().clear();
			invertedIndex().clear();
			logger.info("Cleared '{}' and '{}'", metadataMapName, invertedIndexName);
		} catch (HazelcastException | IllegalStateException e) {
			throw new StorageException("Failed to clear index", e);
		}
	}

	@Override
	public IndexStats stats() throws StorageException {
		try {
			int books = metadata().size();
			MultiMap<String, Integer> index = invertedIndex();
			int words = index.keySet().size();
			long postings = index.size();
			long bytes = (long) books * METADATA_ENTRY_BYTES + (long) words * WORD_KEY_BYTES + postings * POSTING_BYTES;
			return new IndexStats(books, words, bytes / (1024.0 * 1024.0));
		} catch (HazelcastException | IllegalStateException e) {
			throw new StorageException("Failed to read index statistics", e);
		}
	}

	@Override
	public String name() {
		return "hazelcast";
	}

	@Override
	public void close() {
		hazelcast.shutdown();
		logger.info("Hazelcast instance shut down");
	}

	private IMap<Integer, BookMetadata> metadata() {
		return hazelcast.getMap(metadataMapName);
	}

	private MultiMap<String, Integer> invertedIndex() {
		return hazelcast.getMultiMap(invertedIndexName);
	}
}

package org.gutensearch.core.storage;

import org.gutensearch.core.model.BookMetadata;
import org.gutensearch.core.model.IndexStats;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence capability shared by the indexing and search services.
 *
 * <p>Implementations are handed out once per process and used by every request thread
 * concurrently, so they must be thread-safe and pool their underlying connections. Writes
 * are idempotent: storing the same metadata or adding the same word twice leaves the
 * backend in the same state as doing it once. No transactional guarantees beyond that
 * are offered; a reader running alongside {@link #clearIndex()} may see a partially
 * cleared index.</p>
 */
public interface StorageBackend extends AutoCloseable {
	/**
	 * Verify the backend is reachable
	 */
	void testConnection() throws StorageConnectionException;

	/**
	 * Insert or overwrite the metadata for {@code metadata.bookId()}
	 */
	void storeBookMetadata(BookMetadata metadata) throws StorageException;

	/**
	 * Add a book to the set of books containing a word, no-op if already present
	 */
	void addWordToIndex(String word, int bookId) throws StorageException;

	/**
	 * Get the ids of the books containing a word
	 * @return Set of book IDs, empty if the word is not indexed
	 */
	Set<Integer> getBooksForWord(String word) throws StorageException;

	/**
	 * Find book metadata by ID
	 */
	Optional<BookMetadata> getBookMetadata(int bookId) throws StorageException;

	/**
	 * List stored metadata ordered by book id
	 * @param limit maximum number of books, or a non-positive value for all of them
	 */
	List<BookMetadata> listBooks(int limit) throws StorageException;

	/**
	 * Remove all metadata and word entries
	 */
	void clearIndex() throws StorageException;

	/**
	 * Get aggregate counts
	 */
	IndexStats stats() throws StorageException;

	/**
	 * Short backend name used in logs and status payloads
	 */
	String name();

	/**
	 * Release pooled connections
	 */
	@Override
	void close();
}

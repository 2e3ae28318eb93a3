package org.gutensearch.indexing.source;

import java.io.IOException;
import java.util.List;

/**
 * Read access to the books collected by the ingestion service.
 */
public interface BookSource {
	/**
	 * Resolve header and body text of a book
	 * @throws BookNotFoundException if the book is unknown
	 */
	BookText locate(int bookId) throws IOException;

	/**
	 * Get all known book IDs, distinct and ascending
	 */
	List<Integer> listKnownIds() throws IOException;
}

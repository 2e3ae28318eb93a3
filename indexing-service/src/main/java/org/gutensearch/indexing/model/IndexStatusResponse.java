package org.gutensearch.indexing.model;

import org.gutensearch.core.model.IndexStats;

/**
 * Payload of {@code GET /index/status}. {@code total_books}, {@code total_words} and
 * {@code last_updated} repeat the counts under the names older clients read.
 */
public record IndexStatusResponse(
		int totalBooks,
		int totalWords,
		String lastUpdated,
		int booksIndexed,
		int uniqueWords,
		String lastUpdate,
		double indexSizeMb
) {
	public static IndexStatusResponse from(IndexStats stats, String timestamp) {
		return new IndexStatusResponse(
				stats.booksIndexed(),
				stats.uniqueWords(),
				timestamp,
				stats.booksIndexed(),
				stats.uniqueWords(),
				timestamp,
				stats.indexSizeMb()
		);
	}
}

package org.gutensearch.core.model;

/**
 * Aggregate counts reported by a storage backend.
 *
 * @param booksIndexed number of books with stored metadata
 * @param uniqueWords number of distinct words in the inverted index
 * @param indexSizeMb approximate storage footprint in megabytes
 */
public record IndexStats(int booksIndexed, int uniqueWords, double indexSizeMb) {}

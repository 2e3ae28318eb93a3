package org.gutensearch.indexing.source;

/**
 * Raw header and body of a book as stored by the ingestion service.
 */
public record BookText(int bookId, String header, String body) {}

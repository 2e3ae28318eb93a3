package org.gutensearch.search.model;

import org.gutensearch.core.model.BookMetadata;

import java.util.List;

public record SearchResult(
		int bookId,
		String title,
		String author,
		String language,
		Integer year,
		int score,
		List<String> matches
) {
	public static SearchResult fromMetadata(BookMetadata metadata, int score, List<String> matches) {
		return new SearchResult(
				metadata.bookId(),
				metadata.title(),
				metadata.author(),
				metadata.language(),
				metadata.year(),
				score,
				matches
		);
	}
}

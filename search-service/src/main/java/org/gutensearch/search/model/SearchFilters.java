package org.gutensearch.search.model;

import org.gutensearch.core.model.BookMetadata;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Optional metadata constraints, all of which must hold. Blank strings count as unset.
 *
 * @param author case-insensitive substring of the book author
 * @param language case-insensitive exact language
 * @param year exact release year
 */
public record SearchFilters(String author, String language, Integer year) {

	public SearchFilters {
		author = blankToNull(author);
		language = blankToNull(language);
	}

	public static SearchFilters none() {
		return new SearchFilters(null, null, null);
	}

	public boolean matches(BookMetadata book) {
		if (author != null && !lower(book.author()).contains(author.toLowerCase(Locale.ROOT))) {
			return false;
		}
		if (language != null && !language.equalsIgnoreCase(book.language())) {
			return false;
		}
		return year == null || year.equals(book.year());
	}

	/**
	 * Filters that were set, in a stable order, for echoing back to the client
	 */
	public Map<String, Object> asMap() {
		Map<String, Object> map = new LinkedHashMap<>();
		if (author != null) {
			map.put("author", author);
		}
		if (language != null) {
			map.put("language", language);
		}
		if (year != null) {
			map.put("year", year);
		}
		return map;
	}

	private static String lower(String value) {
		return value == null ? "" : value.toLowerCase(Locale.ROOT);
	}

	private static String blankToNull(String value) {
		return value == null || value.isBlank() ? null : value.trim();
	}
}

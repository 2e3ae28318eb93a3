package org.gutensearch.core.text;

import org.gutensearch.core.model.BookMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort parser for the free-form header of a book.
 *
 * <p>Every field is optional: a header without a recognizable label produces empty strings,
 * the default language and no year. Word counts are left at zero for the indexer to fill in.</p>
 */
public class MetadataExtractor {
	private static final Logger logger = LoggerFactory.getLogger(MetadataExtractor.class);

	static final int MAX_FIELD_LENGTH = 500;

	private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;
	private static final Pattern TITLE_PATTERN = Pattern.compile("^[ \\t]*title[ \\t]*:[ \\t]*(.+)$", FLAGS);
	private static final Pattern AUTHOR_PATTERN = Pattern.compile("^[ \\t]*author[ \\t]*:[ \\t]*(.+)$", FLAGS);
	private static final Pattern LANGUAGE_PATTERN = Pattern.compile("^[ \\t]*language[ \\t]*:[ \\t]*(.+)$", FLAGS);
	private static final Pattern DATE_LINE_PATTERN = Pattern.compile(
			"^[^:\\r\\n]*?\\b(?:release date|posting date|release|date)[ \\t]*:(.*)$", FLAGS);
	private static final Pattern YEAR_PATTERN = Pattern.compile("(?<!\\d)(\\d{4})(?!\\d)");

	/**
	 * Extract metadata from book header
	 */
	public BookMetadata extractMetadata(int bookId, String header) {
		String text = header == null ? "" : header;

		String title = orEmpty(cleanString(extractField(TITLE_PATTERN, text)));
		String author = orEmpty(cleanString(extractField(AUTHOR_PATTERN, text)));
		String language = cleanString(extractField(LANGUAGE_PATTERN, text));
		Integer year = extractYear(text);

		if (language == null || language.isEmpty()) {
			language = BookMetadata.DEFAULT_LANGUAGE;
		}

		BookMetadata metadata = new BookMetadata(bookId, title, author, language, year, 0, 0);
		logger.debug("Extracted metadata: {}", metadata);

		return metadata;
	}

	private String extractField(Pattern pattern, String header) {
		Matcher matcher = pattern.matcher(header);
		if (matcher.find()) {
			return matcher.group(1).trim();
		}
		return null;
	}

	private Integer extractYear(String header) {
		Matcher dateLine = DATE_LINE_PATTERN.matcher(header);
		while (dateLine.find()) {
			Matcher year = YEAR_PATTERN.matcher(dateLine.group(1));
			if (year.find()) {
				return Integer.parseInt(year.group(1));
			}
		}
		return null;
	}

	/**
	 * Clean and normalize extracted string
	 */
	private String cleanString(String str) {
		if (str == null) {
			return null;
		}

		str = str.replaceAll("\\s+", " ").trim();

		if (str.length() > MAX_FIELD_LENGTH) {
			str = str.substring(0, MAX_FIELD_LENGTH - 3) + "...";
		}

		return str;
	}

	private static String orEmpty(String value) {
		return value == null ? "" : value;
	}
}

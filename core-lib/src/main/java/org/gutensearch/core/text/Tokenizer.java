package org.gutensearch.core.text;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes text into the vocabulary used by the inverted index.
 *
 * <p>The same instance serves book bodies, titles and search queries, so a word is
 * indexed and queried in exactly the same form.</p>
 */
public class Tokenizer {
	public static final int MIN_WORD_LENGTH = 3;

	private static final Pattern WORD_PATTERN = Pattern.compile("(?<!\\p{L})[a-z]+(?!\\p{L})");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	/**
	 * Lowercases the text and returns the distinct alphabetic runs longer than two characters.
	 * Only ASCII words count; a run touching any other letter (as in {@code café}) is skipped
	 * whole rather than cut into fragments.
	 */
	public Set<String> tokenize(String text) {
		Set<String> words = new HashSet<>();
		if (text == null || text.isBlank()) {
			return words;
		}

		Matcher matcher = WORD_PATTERN.matcher(text.toLowerCase(Locale.ROOT));
		while (matcher.find()) {
			String word = matcher.group();
			if (word.length() >= MIN_WORD_LENGTH) {
				words.add(word);
			}
		}

		return words;
	}

	/**
	 * Counts whitespace-delimited tokens of the raw text, before any normalization.
	 */
	public int countWords(String text) {
		if (text == null) {
			return 0;
		}
		String trimmed = text.strip();
		if (trimmed.isEmpty()) {
			return 0;
		}
		return WHITESPACE.split(trimmed).length;
	}
}

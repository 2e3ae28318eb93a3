package org.gutensearch.benchmarks;

import java.util.Random;

/**
 * Deterministic book-like text so the benchmarks run without a downloaded datalake.
 */
final class SyntheticBooks {
	private static final String[] VOCABULARY = {
			"truth", "universally", "acknowledged", "single", "man", "possession", "good", "fortune",
			"wife", "alice", "rabbit", "wonderland", "queen", "hearts", "whale", "ocean", "captain",
			"monster", "creature", "science", "letter", "house", "garden", "river", "night", "morning",
			"daughter", "father", "mother", "sister", "brother", "love", "pride", "prejudice", "journey",
			"ship", "island", "castle", "forest", "village", "road", "king", "war", "peace", "winter"
	};

	private SyntheticBooks() {}

	static String header(int bookId) {
		return "The Project Gutenberg eBook\n\n"
				+ "Title: " + VOCABULARY[bookId % VOCABULARY.length] + " and the " + VOCABULARY[(bookId * 7) % VOCABULARY.length] + "\n\n"
				+ "Author: Author " + (bookId % 50) + "\n\n"
				+ "Release Date: March " + (1 + bookId % 28) + ", " + (1990 + bookId % 30) + " [EBook #" + bookId + "]\n\n"
				+ "Language: " + (bookId % 5 == 0 ? "French" : "English") + "\n";
	}

	static String body(int bookId, int words) {
		Random random = new Random(bookId);
		StringBuilder sb = new StringBuilder(words * 8);
		for (int i = 0; i < words; i++) {
			sb.append(VOCABULARY[random.nextInt(VOCABULARY.length)]);
			sb.append(i % 12 == 11 ? ".\n" : " ");
		}
		return sb.toString();
	}
}

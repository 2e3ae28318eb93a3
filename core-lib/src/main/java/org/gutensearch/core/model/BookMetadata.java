package org.gutensearch.core.model;

import org.jetbrains.annotations.NotNull;

import java.io.Serial;
import java.io.Serializable;

/**
 * Metadata stored once per book. Re-indexing a book overwrites every field.
 */
public record BookMetadata(
        int bookId,
        String title,
        String author,
        String language,
        Integer year,
        int wordCount,
        int uniqueWords
) implements Serializable {

    public static final String DEFAULT_LANGUAGE = "en";

    /**
     * Returns a copy carrying the word counts computed from the book body.
     */
    public BookMetadata withCounts(int wordCount, int uniqueWords) {
        return new BookMetadata(bookId, title, author, language, year, wordCount, uniqueWords);
    }

    @NotNull
    @Override
    public String toString() {
        return String.format("BookMetadata{id=%d, title='%s', author='%s', lang='%s', year=%s, words=%d, unique=%d}",
                bookId, title, author, language, year, wordCount, uniqueWords);
    }

    @Serial
    private static final long serialVersionUID = 2L;
}

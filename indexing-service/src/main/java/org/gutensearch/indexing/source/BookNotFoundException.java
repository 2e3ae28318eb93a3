package org.gutensearch.indexing.source;

import java.io.IOException;

public class BookNotFoundException extends IOException {
	public BookNotFoundException(int bookId) {
		super("Book " + bookId + " not found in datalake");
	}
}

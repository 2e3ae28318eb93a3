package org.gutensearch.indexing.model;

public record IndexResponse(
		int bookId,
		String status
) {
	public static IndexResponse updated(int bookId) {
		return new IndexResponse(bookId, "updated");
	}
}

package org.gutensearch.indexing.model;

public record IndexFailureResponse(
		int bookId,
		String status,
		String message
) {
	public static IndexFailureResponse of(int bookId, String message) {
		return new IndexFailureResponse(bookId, "failed", message);
	}
}

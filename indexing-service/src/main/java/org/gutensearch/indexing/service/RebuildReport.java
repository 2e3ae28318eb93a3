package org.gutensearch.indexing.service;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a completed rebuild. Books that failed are listed instead of failing the run.
 */
public record RebuildReport(int booksProcessed, List<Integer> failedBookIds, Duration elapsed) {

	public int booksFailed() {
		return failedBookIds.size();
	}
}

package org.gutensearch.indexing.model;

import org.gutensearch.indexing.service.RebuildReport;

import java.util.List;
import java.util.Locale;

public record RebuildResponse(
		String status,
		int indexedCount,
		int booksProcessed,
		int booksFailed,
		List<Integer> failedBookIds,
		String elapsedTime
) {
	public static RebuildResponse from(RebuildReport report) {
		double seconds = report.elapsed().toMillis() / 1000.0;
		return new RebuildResponse(
				"rebuilt",
				report.booksProcessed(),
				report.booksProcessed(),
				report.booksFailed(),
				report.failedBookIds(),
				String.format(Locale.ROOT, "%.2fs", seconds)
		);
	}
}

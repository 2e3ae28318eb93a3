package org.gutensearch.indexing.source;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DatalakeBookSourceTest {

	@TempDir
	Path datalake;

	private void writeBook(String folder, int bookId, String header, String body) throws IOException {
		Path dir = Files.createDirectories(datalake.resolve(folder));
		Files.writeString(dir.resolve(bookId + "_header.txt"), header);
		Files.writeString(dir.resolve(bookId + "_body.txt"), body);
	}

	@Test
	public void testLocatesBookInNestedFolders() throws Exception {
		writeBook("20240101/13", 1342, "Title: Pride and Prejudice", "It is a truth");

		BookText text = new DatalakeBookSource(datalake.toString(), "downloaded_books.txt").locate(1342);

		assertEquals(1342, text.bookId());
		assertEquals("Title: Pride and Prejudice", text.header());
		assertEquals("It is a truth", text.body());
	}

	@Test
	public void testMissingBodyIsNotFound() throws Exception {
		Path dir = Files.createDirectories(datalake.resolve("bucket_0"));
		Files.writeString(dir.resolve("7_header.txt"), "Title: Half a book");

		DatalakeBookSource source = new DatalakeBookSource(datalake.toString(), "downloaded_books.txt");

		assertThrows(BookNotFoundException.class, () -> source.locate(7));
		assertThrows(BookNotFoundException.class, () -> source.locate(8));
	}

	@Test
	public void testCatalogFromTrackingFile() throws Exception {
		Files.writeString(datalake.resolve("downloaded_books.txt"),
				"1342|2024-01-01T10:00\n11|2024-01-01T10:05\nnot-a-number|x\n\n1342|2024-01-02T09:00\n84\n");

		List<Integer> ids = new DatalakeBookSource(datalake.toString(), "downloaded_books.txt").listKnownIds();

		assertEquals(List.of(11, 84, 1342), ids);
	}

	@Test
	public void testCatalogFallsBackToHeaderScan() throws Exception {
		writeBook("a", 84, "h", "b");
		writeBook("b/c", 11, "h", "b");
		Files.writeString(datalake.resolve("notes_header.txt"), "ignored");

		List<Integer> ids = new DatalakeBookSource(datalake.toString(), "downloaded_books.txt").listKnownIds();

		assertEquals(List.of(11, 84), ids);
	}

	@Test
	public void testMissingDatalakeHasNoBooks() throws Exception {
		DatalakeBookSource source = new DatalakeBookSource(datalake.resolve("nope").toString(), "downloaded_books.txt");

		assertTrue(source.listKnownIds().isEmpty());
		assertThrows(IOException.class, () -> source.locate(1));
	}
}

package org.gutensearch.core.storage.jdbc;

import org.gutensearch.core.storage.StorageBackend;
import org.gutensearch.core.storage.StorageBackendContract;
import org.gutensearch.core.storage.StorageConnectionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class SqliteStorageBackendTest extends StorageBackendContract {

	@TempDir
	Path tempDir;

	@Override
	protected StorageBackend createBackend() throws Exception {
		return open(tempDir.resolve("index.sqlite"));
	}

	private static SqliteStorageBackend open(Path file) throws StorageConnectionException {
		return new SqliteStorageBackend("jdbc:sqlite:" + file, 4, Duration.ofSeconds(5));
	}

	@Test
	public void testDataSurvivesReopen() throws Exception {
		Path file = tempDir.resolve("reopen.sqlite");
		try (SqliteStorageBackend first = open(file)) {
			first.storeBookMetadata(book(84, "Frankenstein", "Mary Shelley", "en", 1818));
			first.addWordToIndex("monster", 84);
		}

		try (SqliteStorageBackend second = open(file)) {
			assertEquals("Frankenstein", second.getBookMetadata(84).orElseThrow().title());
			assertTrue(second.getBooksForWord("monster").contains(84));
		}
		assertTrue(Files.exists(file));
	}

	@Test
	public void testSizeIsReportedFromFile() throws Exception {
		backend.storeBookMetadata(book(1, "One", "", "en", null));

		assertTrue(backend.stats().indexSizeMb() > 0.0);
		assertEquals("sqlite", backend.name());
	}
}

package org.gutensearch.indexing.service;

import org.gutensearch.core.model.BookMetadata;
import org.gutensearch.core.storage.jdbc.SqliteStorageBackend;
import org.gutensearch.core.text.MetadataExtractor;
import org.gutensearch.core.text.Tokenizer;
import org.gutensearch.indexing.source.BookNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class IndexingServiceTest {

	static final String PRIDE_HEADER = """
            The Project Gutenberg eBook of Pride and Prejudice

            Title: Pride and Prejudice

            Author: Jane Austen

            Release Date: August 26, 2008 [EBook #1342]

            Language: English
            """;

	static final String PRIDE_BODY =
			"It is a truth universally acknowledged, that a single man in possession of a good fortune, must be in want of a wife.";

	@TempDir
	Path tempDir;

	private SqliteStorageBackend storage;
	private InMemoryBookSource source;
	private IndexingService service;

	@BeforeEach
	public void setUp() throws Exception {
		storage = new SqliteStorageBackend("jdbc:sqlite:" + tempDir.resolve("index.sqlite"), 4, Duration.ofSeconds(5));
		source = new InMemoryBookSource();
		service = new IndexingService(source, new MetadataExtractor(), new Tokenizer(), storage);
	}

	@AfterEach
	public void tearDown() {
		storage.close();
	}

	@Test
	public void testIndexBookStoresMetadataAndWords() throws Exception {
		source.add(1342, PRIDE_HEADER, PRIDE_BODY);

		service.indexBook(1342);

		BookMetadata metadata = storage.getBookMetadata(1342).orElseThrow();
		assertEquals("Pride and Prejudice", metadata.title());
		assertEquals("Jane Austen", metadata.author());
		assertEquals("English", metadata.language());
		assertEquals(2008, metadata.year());
		assertEquals(23, metadata.wordCount());
		assertEquals(new Tokenizer().tokenize(PRIDE_BODY).size(), metadata.uniqueWords());

		assertEquals(Set.of(1342), storage.getBooksForWord("truth"));
		assertEquals(Set.of(1342), storage.getBooksForWord("fortune"));
		assertTrue(storage.getBooksForWord("a").isEmpty());

		System.out.println("✅ Indexed " + metadata);
	}

	@Test
	public void testTitleWordsAreIndexedButNotCounted() throws Exception {
		source.add(1342, PRIDE_HEADER, PRIDE_BODY);

		service.indexBook(1342);

		// "pride", "and", "prejudice" only appear in the title
		assertEquals(Set.of(1342), storage.getBooksForWord("pride"));
		assertEquals(Set.of(1342), storage.getBooksForWord("prejudice"));
		assertEquals(Set.of(1342), storage.getBooksForWord("and"));

		int bodyWords = new Tokenizer().tokenize(PRIDE_BODY).size();
		assertEquals(bodyWords, storage.getBookMetadata(1342).orElseThrow().uniqueWords());
		assertEquals(bodyWords + 3, storage.stats().uniqueWords());
	}

	@Test
	public void testIndexingTwiceIsIdempotent() throws Exception {
		source.add(1342, PRIDE_HEADER, PRIDE_BODY);

		service.indexBook(1342);
		BookMetadata first = storage.getBookMetadata(1342).orElseThrow();
		int wordsAfterFirst = storage.stats().uniqueWords();
		service.indexBook(1342);

		assertEquals(first, storage.getBookMetadata(1342).orElseThrow());
		assertEquals(1, storage.stats().booksIndexed());
		assertEquals(wordsAfterFirst, storage.stats().uniqueWords());

		Tokenizer tokenizer = new Tokenizer();
		Set<String> vocabulary = new HashSet<>(tokenizer.tokenize(PRIDE_BODY));
		vocabulary.addAll(tokenizer.tokenize(first.title()));
		assertEquals(vocabulary.size(), storage.stats().uniqueWords());
		for (String word : vocabulary) {
			assertEquals(Set.of(1342), storage.getBooksForWord(word), "postings for " + word);
		}
	}

	@Test
	public void testUnknownBookFailsWithNotFound() {
		assertThrows(BookNotFoundException.class, () -> service.indexBook(424242));
	}

	@Test
	public void testBookWithoutHeaderFieldsGetsDefaults() throws Exception {
		source.add(5, "", "   ");

		service.indexBook(5);

		BookMetadata metadata = storage.getBookMetadata(5).orElseThrow();
		assertEquals("", metadata.title());
		assertEquals("en", metadata.language());
		assertNull(metadata.year());
		assertEquals(0, metadata.wordCount());
		assertEquals(0, metadata.uniqueWords());
	}

	@Test
	public void testRebuildCountsSuccessesAndReportsFailures() throws Exception {
		source.add(11, "Title: Alice's Adventures in Wonderland\nAuthor: Lewis Carroll", "Down the rabbit hole")
				.add(1342, PRIDE_HEADER, PRIDE_BODY)
				.listWithoutText(99);

		RebuildReport report = service.rebuildIndex();

		assertEquals(2, report.booksProcessed());
		assertEquals(List.of(99), report.failedBookIds());
		assertEquals(1, report.booksFailed());
		assertFalse(report.elapsed().isNegative());
		assertEquals(2, storage.stats().booksIndexed());
	}

	@Test
	public void testRebuildClearsBooksNoLongerInCatalog() throws Exception {
		storage.storeBookMetadata(new BookMetadata(777, "Stale", "", "en", null, 1, 1));
		storage.addWordToIndex("stale", 777);
		source.add(1342, PRIDE_HEADER, PRIDE_BODY);

		service.rebuildIndex();

		assertTrue(storage.getBookMetadata(777).isEmpty());
		assertTrue(storage.getBooksForWord("stale").isEmpty());
		assertTrue(storage.getBookMetadata(1342).isPresent());
	}

	@Test
	public void testEmptyIndexDetection() throws Exception {
		assertTrue(service.isIndexEmpty());

		source.add(1342, PRIDE_HEADER, PRIDE_BODY);
		service.indexBook(1342);

		assertFalse(service.isIndexEmpty());
		assertEquals(1, service.getStats().booksIndexed());
		assertEquals("sqlite", service.backendName());
	}
}

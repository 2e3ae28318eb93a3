package org.gutensearch.benchmarks;

import org.gutensearch.core.storage.StorageException;
import org.gutensearch.core.storage.jdbc.SqliteStorageBackend;
import org.gutensearch.core.text.MetadataExtractor;
import org.gutensearch.core.text.Tokenizer;
import org.gutensearch.indexing.service.IndexingService;
import org.gutensearch.indexing.source.BookNotFoundException;
import org.gutensearch.indexing.source.BookSource;
import org.gutensearch.indexing.source.BookText;
import org.gutensearch.search.model.SearchFilters;
import org.gutensearch.search.model.SearchResponse;
import org.gutensearch.search.service.SearchService;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * End-to-end benchmarks against a SQLite index in a temporary file:
 * indexing one book, and running queries over an index of {@code bookCount} books.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class IndexAndSearchBenchmark {

	private static final int BODY_WORDS = 2000;

	@Param({"10", "100"})
	private int bookCount;

	private Path workDir;
	private SqliteStorageBackend storage;
	private IndexingService indexingService;
	private SearchService searchService;

	@Setup(Level.Trial)
	public void setup() throws IOException, StorageException {
		workDir = Files.createTempDirectory("gutensearch-bench");
		storage = new SqliteStorageBackend("jdbc:sqlite:" + workDir.resolve("bench.sqlite"), 4, Duration.ofSeconds(30));

		List<Integer> ids = IntStream.rangeClosed(1, bookCount).boxed().collect(Collectors.toList());
		BookSource source = new BookSource() {
			@Override
			public BookText locate(int bookId) throws IOException {
				if (bookId < 1 || bookId > bookCount) {
					throw new BookNotFoundException(bookId);
				}
				return new BookText(bookId, SyntheticBooks.header(bookId), SyntheticBooks.body(bookId, BODY_WORDS));
			}

			@Override
			public List<Integer> listKnownIds() {
				return ids;
			}
		};

		Tokenizer tokenizer = new Tokenizer();
		indexingService = new IndexingService(source, new MetadataExtractor(), tokenizer, storage);
		searchService = new SearchService(tokenizer, storage);

		indexingService.rebuildIndex();
		System.out.println("Indexed " + bookCount + " synthetic books into " + workDir);
	}

	@TearDown(Level.Trial)
	public void tearDown() throws IOException {
		storage.close();
		try (var files = Files.walk(workDir)) {
			for (Path p : files.sorted(Comparator.reverseOrder()).toList()) {
				Files.deleteIfExists(p);
			}
		}
	}

	/**
	 * Benchmark: Re-index a single book (idempotent upserts)
	 */
	@Benchmark
	public void indexSingleBook() throws IOException, StorageException {
		indexingService.indexBook(1);
	}

	/**
	 * Benchmark: Single-word query
	 */
	@Benchmark
	public void searchSingleWord(Blackhole blackhole) throws StorageException {
		SearchResponse response = searchService.search("fortune", SearchFilters.none(), null);
		blackhole.consume(response);
	}

	/**
	 * Benchmark: Multi-word query with filters
	 */
	@Benchmark
	public void searchMultiWordFiltered(Blackhole blackhole) throws StorageException {
		SearchResponse response = searchService.search("alice rabbit queen", new SearchFilters(null, "english", null), 10);
		blackhole.consume(response);
	}
}

package org.gutensearch.benchmarks;

import org.gutensearch.core.model.BookMetadata;
import org.gutensearch.core.text.MetadataExtractor;
import org.gutensearch.core.text.Tokenizer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for pure text processing (no I/O): tokenization and metadata extraction.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class TextProcessingBenchmark {

	private final Tokenizer tokenizer = new Tokenizer();
	private final MetadataExtractor metadataExtractor = new MetadataExtractor();

	private String header;
	private String body;

	@Param({"1000", "10000", "100000"})
	private int bodyWords;

	@Setup(Level.Trial)
	public void setup() {
		header = SyntheticBooks.header(1342);
		body = SyntheticBooks.body(1342, bodyWords);
	}

	/**
	 * Benchmark: Tokenize a single book body
	 */
	@Benchmark
	public void tokenizeBody(Blackhole blackhole) {
		Set<String> words = tokenizer.tokenize(body);
		blackhole.consume(words);
	}

	/**
	 * Benchmark: Count raw words of a single book body
	 */
	@Benchmark
	public void countBodyWords(Blackhole blackhole) {
		blackhole.consume(tokenizer.countWords(body));
	}

	/**
	 * Benchmark: Extract metadata from a single book header
	 */
	@Benchmark
	public void extractMetadata(Blackhole blackhole) {
		BookMetadata metadata = metadataExtractor.extractMetadata(1342, header);
		blackhole.consume(metadata);
	}
}

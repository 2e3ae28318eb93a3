package org.gutensearch.indexing.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Reads books from the datalake written by the ingestion service.
 *
 * <p>Each book is stored as {@code <id>_header.txt} and {@code <id>_body.txt} somewhere below the
 * datalake root (bucket or timestamp folders). The catalog is the tracking file, one
 * {@code id|...} entry per line; without it the tree is scanned for header files.</p>
 */
public class DatalakeBookSource implements BookSource {
	private static final Logger logger = LoggerFactory.getLogger(DatalakeBookSource.class);

	private static final String HEADER_SUFFIX = "_header.txt";
	private static final String BODY_SUFFIX = "_body.txt";

	private final Path datalakeDir;
	private final String trackingFilename;

	public DatalakeBookSource(String datalakePath, String trackingFilename) {
		this.datalakeDir = Paths.get(datalakePath);
		this.trackingFilename = trackingFilename;
	}

	@Override
	public BookText locate(int bookId) throws IOException {
		Path headerPath = findBookFile(bookId, HEADER_SUFFIX);
		Path bodyPath = findBookFile(bookId, BODY_SUFFIX);
		if (headerPath == null || bodyPath == null) {
			throw new BookNotFoundException(bookId);
		}

		return new BookText(bookId, Files.readString(headerPath), Files.readString(bodyPath));
	}

	@Override
	public List<Integer> listKnownIds() throws IOException {
		if (!Files.isDirectory(datalakeDir)) {
			logger.warn("Datalake directory not found: {}", datalakeDir);
			return List.of();
		}

		Path trackingFile = datalakeDir.resolve(trackingFilename);
		TreeSet<Integer> bookIds = Files.exists(trackingFile)
				? readTrackingFile(trackingFile)
				: scanHeaders();

		logger.info("Found {} downloaded books in datalake", bookIds.size());
		return new ArrayList<>(bookIds);
	}

	/**
	 * Get list of all downloaded book IDs from the tracking file
	 */
	private TreeSet<Integer> readTrackingFile(Path trackingFile) throws IOException {
		TreeSet<Integer> bookIds = new TreeSet<>();
		for (String line : Files.readAllLines(trackingFile)) {
			String bookIdStr = line.split("\\|")[0].trim();
			if (bookIdStr.isEmpty()) {
				continue;
			}
			try {
				bookIds.add(Integer.parseInt(bookIdStr));
			} catch (NumberFormatException e) {
				logger.warn("Invalid book ID in tracking file: {}", line);
			}
		}
		return bookIds;
	}

	private TreeSet<Integer> scanHeaders() throws IOException {
		logger.warn("Tracking file {} not found, scanning {} for headers", trackingFilename, datalakeDir);
		TreeSet<Integer> bookIds = new TreeSet<>();
		try (Stream<Path> paths = Files.walk(datalakeDir)) {
			paths.filter(Files::isRegularFile)
					.map(p -> p.getFileName().toString())
					.filter(name -> name.endsWith(HEADER_SUFFIX))
					.map(name -> name.substring(0, name.length() - HEADER_SUFFIX.length()))
					.filter(prefix -> prefix.matches("\\d+"))
					.forEach(prefix -> bookIds.add(Integer.parseInt(prefix)));
		}
		return bookIds;
	}

	/**
	 * Find a book file with a specific suffix (searches all bucket/timestamp structures)
	 */
	private Path findBookFile(int bookId, String suffix) throws IOException {
		if (!Files.isDirectory(datalakeDir)) {
			throw new IOException("Datalake directory not found: " + datalakeDir);
		}

		String fileName = bookId + suffix;
		try (Stream<Path> paths = Files.walk(datalakeDir)) {
			return paths
					.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().equals(fileName))
					.findFirst()
					.orElse(null);
		}
	}
}

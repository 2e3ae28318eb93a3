package org.gutensearch.core.storage.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.model.Updates;
import org.bson.Document;
import org.gutensearch.core.model.BookMetadata;
import org.gutensearch.core.model.IndexStats;
import org.gutensearch.core.storage.StorageBackend;
import org.gutensearch.core.storage.StorageConnectionException;
import org.gutensearch.core.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Document-store backend on MongoDB.
 *
 * <p>{@code books} holds one document per book keyed by id; {@code words} holds one
 * document per word whose {@code books} array is maintained with {@code $addToSet}. The
 * driver pools connections internally, so one client serves all request threads.</p>
 */
public class MongoStorageBackend implements StorageBackend {
	private static final Logger logger = LoggerFactory.getLogger(MongoStorageBackend.class);

	private final MongoClient mongoClient;
	private final MongoDatabase database;
	private final MongoCollection<Document> booksCollection;
	private final MongoCollection<Document> wordsCollection;

	public MongoStorageBackend(String uri, String databaseName, int poolSize, Duration callTimeout) {
		long timeoutMs = callTimeout.toMillis();
		MongoClientSettings settings = MongoClientSettings.builder()
				.applyConnectionString(new ConnectionString(uri))
				.applyToConnectionPoolSettings(pool -> pool
						.maxSize(poolSize)
						.maxWaitTime(timeoutMs, TimeUnit.MILLISECONDS))
				.applyToSocketSettings(socket -> socket
						.connectTimeout((int) timeoutMs, TimeUnit.MILLISECONDS)
						.readTimeout((int) timeoutMs, TimeUnit.MILLISECONDS))
				.applyToClusterSettings(cluster -> cluster
						.serverSelectionTimeout(timeoutMs, TimeUnit.MILLISECONDS))
				.build();

		this.mongoClient = MongoClients.create(settings);
		this.database = mongoClient.getDatabase(databaseName);
		this.booksCollection = database.getCollection("books");
		this.wordsCollection = database.getCollection("words");
		logger.info("Created MongoDB client: {} / {}", uri, databaseName);
	}

	private void createIndexes() {
		try {
			booksCollection.createIndex(Indexes.ascending("author"));
			booksCollection.createIndex(Indexes.ascending("language"));
			booksCollection.createIndex(Indexes.ascending("year"));
			logger.info("MongoDB indexes created/verified");
		} catch (MongoException e) {
			logger.warn("Failed to create indexes (may already exist)", e);
		}
	}

	@Override
	public void testConnection() throws StorageConnectionException {
		try {
			database.runCommand(new Document("ping", 1));
			createIndexes();
		} catch (MongoException e) {
			throw new StorageConnectionException("MongoDB unreachable: " + e.getMessage(), e);
		}
	}

	@Override
	public void storeBookMetadata(BookMetadata metadata) throws StorageException {
		try {
			Document doc = new Document("_id", metadata.bookId())
					.append("book_id", metadata.bookId())
					.append("title", metadata.title())
					.append("author", metadata.author())
					.append("language", metadata.language())
					.append("year", metadata.year())
					.append("word_count", metadata.wordCount())
					.append("unique_words", metadata.uniqueWords())
					.append("indexed_at", new Date());

			booksCollection.replaceOne(
					Filters.eq("_id", metadata.bookId()),
					doc,
					new ReplaceOptions().upsert(true)
			);

			logger.debug("Saved metadata for book {}", metadata.bookId());
		} catch (MongoException e) {
			throw new StorageException("Failed to save metadata for book " + metadata.bookId(), e);
		}
	}

	@Override
	public void addWordToIndex(String word, int bookId) throws StorageException {
		try {
			wordsCollection.updateOne(
					Filters.eq("_id", word),
					Updates.addToSet("books", bookId),
					new UpdateOptions().upsert(true)
			);
		} catch (MongoException e) {
			throw new StorageException("Failed to index word '" + word + "' for book " + bookId, e);
		}
	}

	@Override
	public Set<Integer> getBooksForWord(String word) throws StorageException {
		try {
			Document doc = wordsCollection.find(Filters.eq("_id", word)).first();
			if (doc == null) {
				return new HashSet<>();
			}
			return new HashSet<>(doc.getList("books", Integer.class, List.of()));
		} catch (MongoException e) {
			throw new StorageException("Failed to look up word '" + word + "'", e);
		}
	}

	@Override
	public Optional<BookMetadata> getBookMetadata(int bookId) throws StorageException {
		try {
			Document doc = booksCollection.find(Filters.eq("_id", bookId)).first();
			return Optional.ofNullable(doc).map(this::documentToMetadata);
		} catch (MongoException e) {
			throw new StorageException("Failed to find book " + bookId, e);
		}
	}

	@Override
	public List<BookMetadata> listBooks(int limit) throws StorageException {
		try {
			List<BookMetadata> books = new ArrayList<>();
			booksCollection.find()
					.sort(Indexes.ascending("_id"))
					.limit(Math.max(limit, 0))
					.forEach(doc -> books.add(documentToMetadata(doc)));
			return books;
		} catch (MongoException e) {
			throw new StorageException("Failed to list books", e);
		}
	}

	@Override
	public void clearIndex() throws StorageException {
		try {
			long books = booksCollection.deleteMany(new Document()).getDeletedCount();
			long words = wordsCollection.deleteMany(new Document()).getDeletedCount();
			logger.info("Cleared {} books and {} words", books, words);
		} catch (MongoException e) {
			throw new StorageException("Failed to clear index", e);
		}
	}

	@Override
	public IndexStats stats() throws StorageException {
		try {
			int books = (int) booksCollection.countDocuments();
			int words = (int) wordsCollection.countDocuments();
			Document dbStats = database.runCommand(new Document("dbStats", 1));
			Number dataSize = dbStats.get("dataSize", Number.class);
			double sizeMb = dataSize == null ? 0.0 : dataSize.doubleValue() / (1024.0 * 1024.0);
			return new IndexStats(books, words, sizeMb);
		} catch (MongoException e) {
			throw new StorageException("Failed to read index statistics", e);
		}
	}

	@Override
	public String name() {
		return "mongodb";
	}

	@Override
	public void close() {
		mongoClient.close();
		logger.info("Closed MongoDB connection");
	}

	private BookMetadata documentToMetadata(Document doc) {
		int bookId = doc.getInteger("book_id");
		String title = doc.getString("title");
		String author = doc.getString("author");
		String language = doc.getString("language");
		Integer year = doc.getInteger("year");
		int wordCount = doc.getInteger("word_count", 0);
		int uniqueWords = doc.getInteger("unique_words", 0);

		return new BookMetadata(bookId, title, author, language, year, wordCount, uniqueWords);
	}
}

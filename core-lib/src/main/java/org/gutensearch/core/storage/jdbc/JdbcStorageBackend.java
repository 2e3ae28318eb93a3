package org.gutensearch.core.storage.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import org.gutensearch.core.model.BookMetadata;
import org.gutensearch.core.model.IndexStats;
import org.gutensearch.core.storage.StorageBackend;
import org.gutensearch.core.storage.StorageConnectionException;
import org.gutensearch.core.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Relational backend over a fixed-size HikariCP connection pool.
 *
 * <p>Two tables: {@code books} holds one metadata row per book and {@code word_index} one
 * row per (word, book) pair with a composite primary key, so both writes are idempotent
 * upserts. Each call leases its own connection; a slow database therefore queues callers
 * on the pool rather than blocking the whole process. Dialect differences (DDL, size
 * estimate, clearing) are left to subclasses.</p>
 */
public abstract class JdbcStorageBackend implements StorageBackend {
	private static final Logger logger = LoggerFactory.getLogger(JdbcStorageBackend.class);

	private static final String SELECT_BOOK =
			"SELECT book_id, title, author, language, year, word_count, unique_words FROM books";

	private static final String UPSERT_BOOK = """
            INSERT INTO books (book_id, title, author, language, year, word_count, unique_words, indexed_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)
            ON CONFLICT (book_id) DO UPDATE SET
                title = excluded.title,
                author = excluded.author,
                language = excluded.language,
                year = excluded.year,
                word_count = excluded.word_count,
                unique_words = excluded.unique_words,
                indexed_at = CURRENT_TIMESTAMP
        """;

	private static final String INSERT_WORD =
			"INSERT INTO word_index (word, book_id) VALUES (?, ?) ON CONFLICT (word, book_id) DO NOTHING";

	protected final HikariDataSource dataSource;
	private final int queryTimeoutSeconds;

	protected JdbcStorageBackend(HikariConfig poolConfig, Duration callTimeout) throws StorageConnectionException {
		this.queryTimeoutSeconds = (int) Math.max(1, callTimeout.toSeconds());
		try {
			this.dataSource = new HikariDataSource(poolConfig);
		} catch (HikariPool.PoolInitializationException e) {
			throw new StorageConnectionException("Failed to open connection pool for " + poolConfig.getJdbcUrl(), e);
		}

		try {
			createTablesIfNotExist();
			logger.info("Connected to {} database: {} (pool size {})",
					name(), poolConfig.getJdbcUrl(), poolConfig.getMaximumPoolSize());
		} catch (SQLException e) {
			dataSource.close();
			throw new StorageConnectionException("Failed to initialize schema for " + poolConfig.getJdbcUrl(), e);
		}
	}

	/**
	 * Base pool settings shared by the dialects.
	 */
	protected static HikariConfig poolConfig(String poolName, String url, String username, String password,
											 int poolSize, Duration callTimeout) {
		HikariConfig config = new HikariConfig();
		config.setJdbcUrl(url);
		if (username != null) {
			config.setUsername(username);
		}
		if (password != null) {
			config.setPassword(password);
		}
		config.setMaximumPoolSize(poolSize);
		config.setConnectionTimeout(Math.max(250, callTimeout.toMillis()));
		config.setPoolName(poolName);
		return config;
	}

	/**
	 * DDL for the {@code books} and {@code word_index} tables and their indexes
	 */
	protected abstract List<String> schemaStatements();

	/**
	 * Approximate on-disk size of both tables in bytes
	 */
	protected abstract long sizeInBytes(Connection connection) throws SQLException;

	private void createTablesIfNotExist() throws SQLException {
		try (Connection connection = dataSource.getConnection();
			 Statement stmt = connection.createStatement()) {
			for (String sql : schemaStatements()) {
				stmt.execute(sql);
			}
			logger.info("{} tables and indexes created/verified", name());
		}
	}

	@Override
	public void testConnection() throws StorageConnectionException {
		try (Connection connection = dataSource.getConnection()) {
			if (!connection.isValid(queryTimeoutSeconds)) {
				throw new StorageConnectionException(name() + " connection is not valid");
			}
		} catch (SQLException e) {
			throw new StorageConnectionException(name() + " database unreachable: " + e.getMessage(), e);
		}
	}

	@Override
	public void storeBookMetadata(BookMetadata metadata) throws StorageException {
		try (Connection connection = dataSource.getConnection();
			 PreparedStatement stmt = prepare(connection, UPSERT_BOOK)) {
			stmt.setInt(1, metadata.bookId());
			stmt.setString(2, metadata.title());
			stmt.setString(3, metadata.author());
			stmt.setString(4, metadata.language());

			if (metadata.year() != null) {
				stmt.setInt(5, metadata.year());
			} else {
				stmt.setNull(5, Types.INTEGER);
			}

			stmt.setInt(6, metadata.wordCount());
			stmt.setInt(7, metadata.uniqueWords());

			int rowsAffected = stmt.executeUpdate();
			logger.debug("Saved metadata for book {}: {} rows affected", metadata.bookId(), rowsAffected);
		} catch (SQLException e) {
			throw new StorageException("Failed to save metadata for book " + metadata.bookId(), e);
		}
	}

	@Override
	public void addWordToIndex(String word, int bookId) throws StorageException {
		try (Connection connection = dataSource.getConnection();
			 PreparedStatement stmt = prepare(connection, INSERT_WORD)) {
			stmt.setString(1, word);
			stmt.setInt(2, bookId);
			stmt.executeUpdate();
		} catch (SQLException e) {
			throw new StorageException("Failed to index word '" + word + "' for book " + bookId, e);
		}
	}

	@Override
	public Set<Integer> getBooksForWord(String word) throws StorageException {
		Set<Integer> books = new HashSet<>();

		try (Connection connection = dataSource.getConnection();
			 PreparedStatement stmt = prepare(connection, "SELECT book_id FROM word_index WHERE word = ?")) {
			stmt.setString(1, word);

			try (ResultSet rs = stmt.executeQuery()) {
				while (rs.next()) {
					books.add(rs.getInt(1));
				}
			}
		} catch (SQLException e) {
			throw new StorageException("Failed to look up word '" + word + "'", e);
		}

		return books;
	}

	@Override
	public Optional<BookMetadata> getBookMetadata(int bookId) throws StorageException {
		try (Connection connection = dataSource.getConnection();
			 PreparedStatement stmt = prepare(connection, SELECT_BOOK + " WHERE book_id = ?")) {
			stmt.setInt(1, bookId);

			try (ResultSet rs = stmt.executeQuery()) {
				if (rs.next()) {
					return Optional.of(mapResultSetToMetadata(rs));
				}
			}
		} catch (SQLException e) {
			throw new StorageException("Failed to find book " + bookId, e);
		}

		return Optional.empty();
	}

	@Override
	public List<BookMetadata> listBooks(int limit) throws StorageException {
		List<BookMetadata> books = new ArrayList<>();
		String sql = SELECT_BOOK + " ORDER BY book_id" + (limit > 0 ? " LIMIT " + limit : "");

		try (Connection connection = dataSource.getConnection();
			 PreparedStatement stmt = prepare(connection, sql);
			 ResultSet rs = stmt.executeQuery()) {

			while (rs.next()) {
				books.add(mapResultSetToMetadata(rs));
			}
		} catch (SQLException e) {
			throw new StorageException("Failed to list books", e);
		}

		return books;
	}

	@Override
	public void clearIndex() throws StorageException {
		try (Connection connection = dataSource.getConnection();
			 Statement stmt = connection.createStatement()) {
			stmt.setQueryTimeout(queryTimeoutSeconds);
			int words = stmt.executeUpdate("DELETE FROM word_index");
			int books = stmt.executeUpdate("DELETE FROM books");
			logger.info("Cleared {} books and {} word entries", books, words);
		} catch (SQLException e) {
			throw new StorageException("Failed to clear index", e);
		}
	}

	@Override
	public IndexStats stats() throws StorageException {
		try (Connection connection = dataSource.getConnection();
			 Statement stmt = connection.createStatement()) {
			stmt.setQueryTimeout(queryTimeoutSeconds);
			int books = singleInt(stmt, "SELECT COUNT(*) FROM books");
			int words = singleInt(stmt, "SELECT COUNT(DISTINCT word) FROM word_index");
			long bytes = sizeInBytes(connection);
			return new IndexStats(books, words, bytes / (1024.0 * 1024.0));
		} catch (SQLException e) {
			throw new StorageException("Failed to read index statistics", e);
		}
	}

	@Override
	public void close() {
		if (!dataSource.isClosed()) {
			dataSource.close();
			logger.info("Closed {} connection pool", name());
		}
	}

	protected static long singleLong(Statement stmt, String sql) throws SQLException {
		try (ResultSet rs = stmt.executeQuery(sql)) {
			return rs.next() ? rs.getLong(1) : 0L;
		}
	}

	private static int singleInt(Statement stmt, String sql) throws SQLException {
		return (int) singleLong(stmt, sql);
	}

	private PreparedStatement prepare(Connection connection, String sql) throws SQLException {
		PreparedStatement stmt = connection.prepareStatement(sql);
		stmt.setQueryTimeout(queryTimeoutSeconds);
		return stmt;
	}

	private BookMetadata mapResultSetToMetadata(ResultSet rs) throws SQLException {
		int bookId = rs.getInt("book_id");
		String title = rs.getString("title");
		String author = rs.getString("author");
		String language = rs.getString("language");
		Integer year = rs.getInt("year");
		if (rs.wasNull()) {
			year = null;
		}
		int wordCount = rs.getInt("word_count");
		int uniqueWords = rs.getInt("unique_words");

		return new BookMetadata(bookId, title, author, language, year, wordCount, uniqueWords);
	}
}

package org.gutensearch.core.storage.jdbc;

import com.zaxxer.hikari.HikariConfig;
import org.gutensearch.core.storage.StorageConnectionException;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;

/**
 * SQLite flavour of the relational backend, mainly for single-host deployments and tests.
 *
 * <p>Runs in WAL mode with a busy timeout so concurrent writers wait for the file lock
 * instead of failing immediately.</p>
 */
public class SqliteStorageBackend extends JdbcStorageBackend {

	public SqliteStorageBackend(String url, int poolSize, Duration callTimeout) throws StorageConnectionException {
		super(sqliteConfig(url, poolSize, callTimeout), callTimeout);
	}

	private static HikariConfig sqliteConfig(String url, int poolSize, Duration callTimeout) {
		HikariConfig config = poolConfig("gutensearch-sqlite", url, null, null, poolSize, callTimeout);
		config.addDataSourceProperty("journal_mode", "WAL");
		config.addDataSourceProperty("busy_timeout", String.valueOf(callTimeout.toMillis()));
		return config;
	}

	@Override
	protected List<String> schemaStatements() {
		return List.of(
				"""
				CREATE TABLE IF NOT EXISTS books (
				    book_id INTEGER PRIMARY KEY,
				    title TEXT,
				    author TEXT,
				    language TEXT,
				    year INTEGER,
				    word_count INTEGER NOT NULL DEFAULT 0,
				    unique_words INTEGER NOT NULL DEFAULT 0,
				    indexed_at DATETIME DEFAULT CURRENT_TIMESTAMP
				)
				""",
				"""
				CREATE TABLE IF NOT EXISTS word_index (
				    word TEXT NOT NULL,
				    book_id INTEGER NOT NULL,
				    PRIMARY KEY (word, book_id)
				)
				""",
				"CREATE INDEX IF NOT EXISTS idx_author ON books(author)",
				"CREATE INDEX IF NOT EXISTS idx_language ON books(language)",
				"CREATE INDEX IF NOT EXISTS idx_year ON books(year)"
		);
	}

	@Override
	protected long sizeInBytes(Connection connection) throws SQLException {
		try (Statement stmt = connection.createStatement()) {
			long pageCount = singleLong(stmt, "PRAGMA page_count");
			long pageSize = singleLong(stmt, "PRAGMA page_size");
			return pageCount * pageSize;
		}
	}

	@Override
	public String name() {
		return "sqlite";
	}
}

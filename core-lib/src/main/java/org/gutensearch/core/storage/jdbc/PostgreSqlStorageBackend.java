package org.gutensearch.core.storage.jdbc;

import org.gutensearch.core.storage.StorageConnectionException;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;

public class PostgreSqlStorageBackend extends JdbcStorageBackend {

	public PostgreSqlStorageBackend(String url, String username, String password, int poolSize, Duration callTimeout)
			throws StorageConnectionException {
		super(poolConfig("gutensearch-postgresql", url, username, password, poolSize, callTimeout), callTimeout);
	}

	@Override
	protected List<String> schemaStatements() {
		return List.of(
				"""
				CREATE TABLE IF NOT EXISTS books (
				    book_id INT PRIMARY KEY,
				    title VARCHAR(500),
				    author VARCHAR(500),
				    language VARCHAR(500),
				    year INT,
				    word_count INT NOT NULL DEFAULT 0,
				    unique_words INT NOT NULL DEFAULT 0,
				    indexed_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
				)
				""",
				"""
				CREATE TABLE IF NOT EXISTS word_index (
				    word TEXT NOT NULL,
				    book_id INT NOT NULL,
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
			return singleLong(stmt,
					"SELECT pg_total_relation_size('books') + pg_total_relation_size('word_index')");
		}
	}

	@Override
	public String name() {
		return "postgresql";
	}
}

package org.cellar.core.vocabulary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link VocabularyStore} in a relational database (SQLite or PostgreSQL).
 *
 * <p>Terms are inserted with {@code ON CONFLICT DO NOTHING}; the trigram table is the inverted index and the
 * shared-trigram count is computed by the database.</p>
 */
public class JdbcVocabularyStore implements VocabularyStore {
	private static final Logger logger = LoggerFactory.getLogger(JdbcVocabularyStore.class);

	private static final String CREATE_VOCABULARY = """
			CREATE TABLE IF NOT EXISTS vocabulary (
			    term VARCHAR(100) PRIMARY KEY,
			    trigram_count INTEGER NOT NULL
			)""";
	private static final String CREATE_TRIGRAMS = """
			CREATE TABLE IF NOT EXISTS vocabulary_trigram (
			    trigram VARCHAR(3) NOT NULL,
			    term VARCHAR(100) NOT NULL,
			    PRIMARY KEY (trigram, term)
			)""";
	private static final String INSERT_TERM =
			"INSERT INTO vocabulary (term, trigram_count) VALUES (?, ?) ON CONFLICT (term) DO NOTHING";
	private static final String INSERT_TRIGRAM =
			"INSERT INTO vocabulary_trigram (trigram, term) VALUES (?, ?) ON CONFLICT (trigram, term) DO NOTHING";

	private final Connection connection;

	public JdbcVocabularyStore(String url, String username, String password) throws SQLException {
		try {
			this.connection = username == null
					? DriverManager.getConnection(url)
					: DriverManager.getConnection(url, username, password);
			logger.info("Connected to vocabulary database: {}", url);
		} catch (SQLException e) {
			logger.error("Failed to connect to vocabulary database: {}", url, e);
			throw e;
		}
		createSchema();
	}

	public JdbcVocabularyStore(String url) throws SQLException {
		this(url, null, null);
	}

	private void createSchema() throws SQLException {
		try (Statement stmt = connection.createStatement()) {
			stmt.execute(CREATE_VOCABULARY);
			stmt.execute(CREATE_TRIGRAMS);
		}
	}

	@Override
	public synchronized boolean insertIfAbsent(String term, Set<String> trigrams) throws IOException {
		try {
			connection.setAutoCommit(false);
			try {
				boolean inserted = insertTerm(term, trigrams.size());
				if (inserted) {
					insertTrigrams(term, trigrams);
				}
				connection.commit();
				return inserted;
			} catch (SQLException e) {
				connection.rollback();
				throw e;
			} finally {
				connection.setAutoCommit(true);
			}
		} catch (SQLException e) {
			throw new IOException("Failed to insert vocabulary term '" + term + "'", e);
		}
	}

	private boolean insertTerm(String term, int trigramCount) throws SQLException {
		try (PreparedStatement stmt = connection.prepareStatement(INSERT_TERM)) {
			stmt.setString(1, term);
			stmt.setInt(2, trigramCount);
			return stmt.executeUpdate() > 0;
		}
	}

	private void insertTrigrams(String term, Set<String> trigrams) throws SQLException {
		try (PreparedStatement stmt = connection.prepareStatement(INSERT_TRIGRAM)) {
			for (String trigram : trigrams) {
				stmt.setString(1, trigram);
				stmt.setString(2, term);
				stmt.addBatch();
			}
			stmt.executeBatch();
		}
	}

	@Override
	public synchronized List<TrigramMatch> findBySharedTrigrams(Set<String> trigrams) throws IOException {
		List<TrigramMatch> matches = new ArrayList<>();
		if (trigrams.isEmpty()) {
			return matches;
		}

		String placeholders = trigrams.stream().map(t -> "?").collect(Collectors.joining(","));
		String sql = "SELECT v.term, v.trigram_count, COUNT(*) AS shared "
				+ "FROM vocabulary_trigram t JOIN vocabulary v ON v.term = t.term "
				+ "WHERE t.trigram IN (" + placeholders + ") "
				+ "GROUP BY v.term, v.trigram_count";

		try (PreparedStatement stmt = connection.prepareStatement(sql)) {
			int i = 1;
			for (String trigram : trigrams) {
				stmt.setString(i++, trigram);
			}

			try (ResultSet rs = stmt.executeQuery()) {
				while (rs.next()) {
					matches.add(new TrigramMatch(rs.getString("term"), rs.getInt("trigram_count"), rs.getInt("shared")));
				}
			}
		} catch (SQLException e) {
			throw new IOException("Failed to look up vocabulary trigrams", e);
		}

		return matches;
	}

	@Override
	public synchronized boolean contains(String term) throws IOException {
		try (PreparedStatement stmt = connection.prepareStatement("SELECT 1 FROM vocabulary WHERE term = ?")) {
			stmt.setString(1, term);
			try (ResultSet rs = stmt.executeQuery()) {
				return rs.next();
			}
		} catch (SQLException e) {
			throw new IOException("Failed to look up vocabulary term '" + term + "'", e);
		}
	}

	@Override
	public synchronized int size() throws IOException {
		try (Statement stmt = connection.createStatement();
			 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM vocabulary")) {
			return rs.next() ? rs.getInt(1) : 0;
		} catch (SQLException e) {
			throw new IOException("Failed to count vocabulary", e);
		}
	}

	@Override
	public synchronized void close() throws IOException {
		try {
			if (connection != null && !connection.isClosed()) {
				connection.close();
				logger.info("Closed vocabulary database connection");
			}
		} catch (SQLException e) {
			throw new IOException("Failed to close vocabulary database", e);
		}
	}
}

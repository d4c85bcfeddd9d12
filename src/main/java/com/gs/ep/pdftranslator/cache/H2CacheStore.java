package com.gs.ep.pdftranslator.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

/**
 * File-backed translation store on an embedded H2 database.
 *
 * <p>
 * Rows live in one table with a unique (engine, params, original_text) key and
 * are written with {@code MERGE ... KEY}, so a second write of a key replaces the
 * first atomically. The database is opened with {@code AUTO_SERVER=TRUE}: the
 * first process to open the file serves it to every other process, which keeps
 * concurrent translator runs on one cache consistent.
 * </p>
 */
public class H2CacheStore implements CacheStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(H2CacheStore.class);

    static final String TABLE = "translation_cache";
    private static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS " + TABLE + " ("
            + "id BIGINT AUTO_INCREMENT PRIMARY KEY, "
            + "translate_engine VARCHAR(20) NOT NULL, "
            + "translate_engine_params VARCHAR NOT NULL, "
            + "original_text VARCHAR NOT NULL, "
            + "translation VARCHAR NOT NULL, "
            + "CONSTRAINT translation_cache_key UNIQUE (translate_engine, translate_engine_params, original_text))";
    private static final String FIND = "SELECT translation FROM " + TABLE
            + " WHERE translate_engine = ? AND translate_engine_params = ? AND original_text = ?";
    private static final String UPSERT = "MERGE INTO " + TABLE
            + " (translate_engine, translate_engine_params, original_text, translation)"
            + " KEY (translate_engine, translate_engine_params, original_text) VALUES (?, ?, ?, ?)";
    private static final String COUNT = "SELECT COUNT(*) FROM " + TABLE;
    private static final String CLEAR = "DELETE FROM " + TABLE;
    private static final int UPSERT_ATTEMPTS = 3;

    private final Path database;
    private final Connection connection;

    /**
     * @param database database file without H2's {@code .mv.db} suffix
     */
    public H2CacheStore(Path database) throws IOException {
        this.database = database.toAbsolutePath();
        Path parent = this.database.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try {
            this.connection = DriverManager.getConnection(jdbcUrl(this.database), "sa", "");
            try (Statement statement = connection.createStatement()) {
                statement.execute(CREATE_TABLE);
            }
        } catch (SQLException e) {
            throw new IOException("Unable to open translation cache " + this.database + ": " + e.getMessage(), e);
        }
        LOGGER.debug("Translation cache opened at {}", this.database);
    }

    static String jdbcUrl(Path database) {
        return "jdbc:h2:file:" + database.toString().replace('\\', '/') + ";AUTO_SERVER=TRUE;LOCK_TIMEOUT=10000";
    }

    @Override
    public Optional<String> find(String engine, String params, String originalText) throws IOException {
        try (PreparedStatement statement = connection.prepareStatement(FIND)) {
            statement.setString(1, engine);
            statement.setString(2, params);
            statement.setString(3, originalText);
            try (ResultSet rows = statement.executeQuery()) {
                return rows.next() ? Optional.of(rows.getString(1)) : Optional.<String>empty();
            }
        } catch (SQLException e) {
            throw new IOException("Translation cache lookup failed", e);
        }
    }

    @Override
    public void upsert(String engine, String params, String originalText, String translation) throws IOException {
        for (int attempt = 1; ; attempt++) {
            try (PreparedStatement statement = connection.prepareStatement(UPSERT)) {
                statement.setString(1, engine);
                statement.setString(2, params);
                statement.setString(3, originalText);
                statement.setString(4, translation);
                statement.executeUpdate();
                return;
            } catch (SQLException e) {
                if (attempt >= UPSERT_ATTEMPTS || !isWriteConflict(e)) {
                    throw new IOException("Translation cache write failed", e);
                }
                LOGGER.debug("Translation cache write conflict on attempt {}, retrying: {}", attempt, e.getMessage());
            }
        }
    }

    /**
     * Two sessions inserting the same new key race on the unique index; the loser
     * sees a duplicate key or a lock timeout and its retry takes the update path.
     */
    static boolean isWriteConflict(SQLException e) {
        String state = e.getSQLState();
        return "23505".equals(state) || "40001".equals(state) || "HYT00".equals(state);
    }

    @Override
    public long count() throws IOException {
        try (Statement statement = connection.createStatement(); ResultSet rows = statement.executeQuery(COUNT)) {
            rows.next();
            return rows.getLong(1);
        } catch (SQLException e) {
            throw new IOException("Translation cache count failed", e);
        }
    }

    @Override
    public void clear() throws IOException {
        try (Statement statement = connection.createStatement()) {
            int removed = statement.executeUpdate(CLEAR);
            LOGGER.info("Translation cache {} cleared, {} rows removed", database, removed);
        } catch (SQLException e) {
            throw new IOException("Translation cache clear failed", e);
        }
    }

    @Override
    public void close() throws IOException {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new IOException("Failed to close translation cache " + database, e);
        }
    }

    public Path getDatabase() {
        return database;
    }
}

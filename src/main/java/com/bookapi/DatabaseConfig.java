package com.bookapi;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Owns the process-wide connection pool. Construction fails fast when the
 * database cannot be reached.
 */
public class DatabaseConfig {

    private static final Logger log = LoggerFactory.getLogger(DatabaseConfig.class);

    static final String SCHEMA = """
            CREATE TABLE IF NOT EXISTS books (
                id SERIAL PRIMARY KEY,
                title VARCHAR(255) NOT NULL,
                author VARCHAR(255) NOT NULL,
                summary BYTEA
            )
            """;

    private static final String[][] SAMPLE_BOOKS = {
            {"The Go Programming Language", "Alan A. A. Donovan", "A comprehensive guide to Go programming"},
            {"Clean Code", "Robert C. Martin", "A handbook of agile software craftsmanship"},
    };

    private final HikariDataSource dataSource;

    public DatabaseConfig(AppConfig.DatabaseSettings settings, int poolSize) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(settings.jdbcUrl());
        if (settings.username() != null) {
            config.setUsername(settings.username());
        }
        if (settings.password() != null) {
            config.setPassword(settings.password());
        }
        config.setMaximumPoolSize(poolSize);
        config.setPoolName("bookapi-db");
        config.setInitializationFailTimeout(1);

        log.info("Connecting to {}", settings.jdbcUrl());
        this.dataSource = new HikariDataSource(config);
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public void runMigrations() {
        runMigrations(dataSource);
    }

    static void runMigrations(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(SCHEMA);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to run migrations", e);
        }
    }

    /** Inserts the sample books when the table is empty. */
    public void seedSampleData() {
        try (Connection conn = dataSource.getConnection()) {
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM books")) {
                rs.next();
                if (rs.getLong(1) > 0) {
                    log.info("Skipping sample data, books table is not empty");
                    return;
                }
            }
            try (PreparedStatement insert = conn.prepareStatement(
                    "INSERT INTO books (title, author, summary) VALUES (?, ?, ?)")) {
                for (String[] book : SAMPLE_BOOKS) {
                    insert.setString(1, book[0]);
                    insert.setString(2, book[1]);
                    insert.setBytes(3, book[2].getBytes(StandardCharsets.UTF_8));
                    insert.addBatch();
                }
                insert.executeBatch();
            }
            log.info("Seeded {} sample books", SAMPLE_BOOKS.length);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to seed sample data", e);
        }
    }

    public void close() {
        dataSource.close();
    }
}

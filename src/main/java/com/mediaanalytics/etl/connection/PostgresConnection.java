package com.mediaanalytics.etl.connection;

import com.mediaanalytics.etl.config.DatabaseConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * PostgreSQL connection manager using a HikariCP pool with the standard PostgreSQL JDBC driver.
 *
 * The pool is created on first use. The pipeline is single-threaded, so the pool stays small;
 * there is no retry on connection failure.
 */
public class PostgresConnection implements DatabaseConnection {
    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresConnection.class);

    private static final long CONNECTION_TIMEOUT_MS = 10000;
    private static final long VALIDATION_TIMEOUT_MS = 5000;

    private final DatabaseConfig config;
    private HikariDataSource dataSource;

    public PostgresConnection(DatabaseConfig config) {
        this.config = config;
    }

    @Override
    public Connection getConnection() throws SQLException {
        if (dataSource == null || dataSource.isClosed()) {
            synchronized (this) {
                if (dataSource == null || dataSource.isClosed()) {
                    createConnectionPool();
                }
            }
        }
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            LOGGER.error("Error connecting to PostgreSQL database at {}:{}/{}: {}",
                        config.getHost(), config.getPort(), config.getDatabase(), e.getMessage());
            throw e;
        }
    }

    private void createConnectionPool() throws SQLException {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.jdbcUrl());
        hikari.setDriverClassName("org.postgresql.Driver");
        hikari.setUsername(config.getUser());
        hikari.setPassword(config.getPassword());

        hikari.setMaximumPoolSize(config.getPoolMaxSize());
        hikari.setMinimumIdle(0);
        hikari.setConnectionTimeout(CONNECTION_TIMEOUT_MS);
        hikari.setValidationTimeout(VALIDATION_TIMEOUT_MS);
        hikari.setPoolName("interaction-etl-pool");
        // Fail on first getConnection() rather than in the constructor
        hikari.setInitializationFailTimeout(-1);

        hikari.addDataSourceProperty("cachePrepStmts", "true");
        hikari.addDataSourceProperty("prepStmtCacheSize", "250");
        hikari.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");

        try {
            dataSource = new HikariDataSource(hikari);
        } catch (RuntimeException e) {
            throw new SQLException("Failed to create connection pool for " + config.jdbcUrl(), e);
        }
        LOGGER.info("Created connection pool for {} (pool size: {})", config.jdbcUrl(), config.getPoolMaxSize());
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            LOGGER.info("Closed connection pool");
        }
    }
}

package com.mediaanalytics.etl.connection;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of connections to the interaction store.
 * Callers own each connection they obtain and close it with try-with-resources.
 */
public interface DatabaseConnection extends AutoCloseable {
    /**
     * Get a connection from the pool.
     * @return A database connection
     * @throws SQLException if the store is unreachable
     */
    Connection getConnection() throws SQLException;

    /**
     * Close the pool and release resources.
     */
    @Override
    void close();
}

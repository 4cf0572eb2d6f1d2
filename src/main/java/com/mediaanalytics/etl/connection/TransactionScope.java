package com.mediaanalytics.etl.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Block-scoped transaction on a single connection.
 *
 * <pre>
 * try (Connection conn = db.getConnection(); TransactionScope tx = TransactionScope.begin(conn)) {
 *     ...
 *     tx.commit();
 * }
 * </pre>
 *
 * Leaving the block without {@link #commit()} rolls everything back.
 */
public final class TransactionScope implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(TransactionScope.class);

    private final Connection connection;
    private final boolean previousAutoCommit;
    private boolean committed;

    private TransactionScope(Connection connection, boolean previousAutoCommit) {
        this.connection = connection;
        this.previousAutoCommit = previousAutoCommit;
    }

    public static TransactionScope begin(Connection connection) throws SQLException {
        boolean previous = connection.getAutoCommit();
        connection.setAutoCommit(false);
        return new TransactionScope(connection, previous);
    }

    public void commit() throws SQLException {
        connection.commit();
        committed = true;
    }

    public boolean isCommitted() {
        return committed;
    }

    @Override
    public void close() throws SQLException {
        try {
            if (!committed) {
                LOGGER.warn("Rolling back uncommitted transaction");
                connection.rollback();
            }
        } finally {
            connection.setAutoCommit(previousAutoCommit);
        }
    }
}

package com.mediaanalytics.etl.load;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Idempotent DDL for the interactions table: the range-partitioned parent, its indexes,
 * and one partition per calendar month, created on demand.
 *
 * All methods run on the caller's connection and take part in the caller's transaction.
 */
public class SchemaManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaManager.class);

    private static final List<String> INDEXED_COLUMNS = Collections.unmodifiableList(
        Arrays.asList("user_id", "event_date", "content_category", "article_id"));
    private static final List<String> PARTITION_INDEXED_COLUMNS = Collections.unmodifiableList(
        Arrays.asList("user_id", "article_id"));

    private static final String CREATE_TABLE_SQL =
        "CREATE TABLE IF NOT EXISTS %s (" +
        "    interaction_id TEXT NOT NULL," +
        "    user_id TEXT NOT NULL," +
        "    session_id TEXT NOT NULL," +
        "    timestamp TIMESTAMP NOT NULL," +
        "    page_url TEXT NOT NULL," +
        "    action TEXT NOT NULL," +
        "    device_type TEXT," +
        "    referrer TEXT," +
        "    event_date DATE NOT NULL," +
        "    event_time TIME NOT NULL," +
        "    event_hour TEXT," +
        "    event_day TEXT," +
        "    event_month TEXT," +
        "    event_year TEXT," +
        "    event_dayofweek TEXT," +
        "    is_weekend BOOLEAN," +
        "    content_category TEXT," +
        "    article_id TEXT," +
        "    referrer_category TEXT," +
        "    time_spent_seconds TEXT," +
        "    scroll_depth TEXT," +
        "    PRIMARY KEY (interaction_id, event_date)" +
        ") PARTITION BY RANGE (event_date)";

    private static final String PARTITION_EXISTS_SQL =
        "SELECT EXISTS (SELECT 1 FROM pg_tables WHERE schemaname = current_schema() AND tablename = ?)";

    private static final String CREATE_PARTITION_SQL =
        "CREATE TABLE IF NOT EXISTS %s PARTITION OF %s FOR VALUES FROM ('%s') TO ('%s')";

    private static final String CREATE_INDEX_SQL = "CREATE INDEX IF NOT EXISTS idx_%s_%s ON %s (%s)";

    private final String table;

    /**
     * @param table parent table name; must already be a validated plain identifier
     */
    public SchemaManager(String table) {
        this.table = table;
    }

    public String getTable() {
        return table;
    }

    /**
     * Create the parent table and its secondary indexes if absent.
     */
    public void ensureSchema(Connection conn) throws SQLException {
        LOGGER.info("Creating database schema for {} if not exists", table);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(String.format(CREATE_TABLE_SQL, table));
            for (String column : INDEXED_COLUMNS) {
                stmt.execute(String.format(CREATE_INDEX_SQL, table, column, table, column));
            }
        } catch (SQLException e) {
            LOGGER.error("Error creating database schema for {}: {}", table, e.getMessage());
            throw e;
        }
        LOGGER.info("Database schema for {} is ready", table);
    }

    /**
     * Create every missing partition in {@code partitions}, with its per-partition indexes.
     *
     * @return number of partitions created
     */
    public int ensurePartitions(Connection conn, Collection<MonthlyPartition> partitions) throws SQLException {
        int created = 0;
        for (MonthlyPartition partition : partitions) {
            if (partitionExists(conn, partition)) {
                LOGGER.debug("Partition {} already exists", partition.name());
                continue;
            }
            createPartition(conn, partition);
            created++;
        }
        return created;
    }

    boolean partitionExists(Connection conn, MonthlyPartition partition) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(PARTITION_EXISTS_SQL)) {
            stmt.setString(1, partition.name());
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }

    private void createPartition(Connection conn, MonthlyPartition partition) throws SQLException {
        String name = partition.name();
        LOGGER.info("Creating partition {}", partition);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(String.format(CREATE_PARTITION_SQL, name, table, partition.from(), partition.to()));
            for (String column : PARTITION_INDEXED_COLUMNS) {
                stmt.execute(String.format(CREATE_INDEX_SQL, name, column, name, column));
            }
        } catch (SQLException e) {
            LOGGER.error("Error creating partition {}: {}", name, e.getMessage());
            throw e;
        }
    }
}

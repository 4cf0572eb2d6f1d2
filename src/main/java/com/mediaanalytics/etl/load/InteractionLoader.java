package com.mediaanalytics.etl.load;

import com.mediaanalytics.etl.connection.DatabaseConnection;
import com.mediaanalytics.etl.connection.TransactionScope;
import com.mediaanalytics.etl.model.EnrichedInteraction;
import com.mediaanalytics.etl.model.InsertSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Writes enriched interactions into the partitioned interactions table.
 *
 * A load is one transaction: schema and partition setup, then one multi-row insert per batch.
 * Rows whose (interaction_id, event_date) already exist are skipped by the database. Any failure
 * rolls back the whole load, earlier batches included.
 */
public class InteractionLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(InteractionLoader.class);

    // PostgreSQL allows at most 65,535 bind parameters per statement
    private static final int MAX_PARAMETERS = 65535;

    private final DatabaseConnection database;
    private final SchemaManager schemaManager;
    private final int batchSize;

    public InteractionLoader(DatabaseConnection database, SchemaManager schemaManager, int batchSize) {
        int columns = EnrichedInteraction.COLUMNS.size();
        if (batchSize < 1 || batchSize * columns > MAX_PARAMETERS) {
            throw new IllegalArgumentException(String.format(
                "Batch size %d must be between 1 and %d", batchSize, MAX_PARAMETERS / columns));
        }
        this.database = database;
        this.schemaManager = schemaManager;
        this.batchSize = batchSize;
    }

    public String getTable() {
        return schemaManager.getTable();
    }

    public InsertSummary load(List<EnrichedInteraction> interactions) {
        String table = getTable();
        if (interactions.isEmpty()) {
            LOGGER.warn("No data to load");
            return InsertSummary.none();
        }
        LOGGER.info("Starting data load of {} records into {} table", interactions.size(), table);

        Set<MonthlyPartition> partitions = MonthlyPartition.covering(table, eventDates(interactions));

        try (Connection conn = database.getConnection();
             TransactionScope tx = TransactionScope.begin(conn)) {
            schemaManager.ensureSchema(conn);
            int created = schemaManager.ensurePartitions(conn, partitions);
            if (created > 0) {
                LOGGER.info("Created {} of {} partitions covering the data", created, partitions.size());
            }

            int inserted = 0;
            String fullBatchSql = insertSql(table, batchSize);
            for (int start = 0; start < interactions.size(); start += batchSize) {
                List<EnrichedInteraction> batch =
                    interactions.subList(start, Math.min(start + batchSize, interactions.size()));
                String sql = batch.size() == batchSize ? fullBatchSql : insertSql(table, batch.size());
                int batchInserted = insertBatch(conn, sql, batch);
                LOGGER.debug("Batch at offset {}: {} of {} rows inserted", start, batchInserted, batch.size());
                inserted += batchInserted;
            }

            tx.commit();
            InsertSummary summary = new InsertSummary(inserted, interactions.size() - inserted);
            LOGGER.info("Successfully loaded {} new records (skipped {} duplicates)",
                       summary.getInserted(), summary.getSkipped());
            return summary;
        } catch (SQLException e) {
            LOGGER.error("Error loading data into {}: {}", table, e.getMessage());
            throw new LoadException(table, e.getMessage(), e);
        }
    }

    private int insertBatch(Connection conn, String sql, List<EnrichedInteraction> batch) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            int paramIndex = 1;
            for (EnrichedInteraction interaction : batch) {
                for (Object value : interaction.columnValues()) {
                    Object jdbcValue = JdbcValues.toJdbc(value);
                    if (jdbcValue == null) {
                        stmt.setNull(paramIndex++, Types.VARCHAR);
                    } else {
                        stmt.setObject(paramIndex++, jdbcValue);
                    }
                }
            }
            return stmt.executeUpdate();
        }
    }

    /**
     * Multi-row insert for {@code rows} rows that leaves conflicting rows untouched.
     */
    static String insertSql(String table, int rows) {
        List<String> columns = EnrichedInteraction.COLUMNS;
        StringBuilder row = new StringBuilder("(");
        for (int i = 0; i < columns.size(); i++) {
            row.append(i > 0 ? ", ?" : "?");
        }
        row.append(")");

        StringBuilder sql = new StringBuilder(64 + rows * row.length());
        sql.append("INSERT INTO ").append(table)
           .append(" (").append(String.join(", ", columns)).append(") VALUES ");
        for (int i = 0; i < rows; i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(row);
        }
        sql.append(" ON CONFLICT (interaction_id, event_date) DO NOTHING");
        return sql.toString();
    }

    private static List<LocalDate> eventDates(List<EnrichedInteraction> interactions) {
        List<LocalDate> dates = new ArrayList<>(interactions.size());
        for (EnrichedInteraction interaction : interactions) {
            dates.add(interaction.getEventDate());
        }
        return dates;
    }
}

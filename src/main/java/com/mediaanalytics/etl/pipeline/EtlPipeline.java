package com.mediaanalytics.etl.pipeline;

import com.mediaanalytics.etl.config.PipelineConfig;
import com.mediaanalytics.etl.connection.DatabaseConnection;
import com.mediaanalytics.etl.connection.TransactionScope;
import com.mediaanalytics.etl.extract.JsonFileExtractor;
import com.mediaanalytics.etl.load.InteractionLoader;
import com.mediaanalytics.etl.load.LoadException;
import com.mediaanalytics.etl.load.SchemaManager;
import com.mediaanalytics.etl.model.EnrichedInteraction;
import com.mediaanalytics.etl.model.InsertSummary;
import com.mediaanalytics.etl.model.RecordSet;
import com.mediaanalytics.etl.transform.InteractionTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Runs extract, transform and load over one input directory.
 *
 * {@link #run(Path)} never throws: any failure ends the run in {@link PipelineState#FAILED}
 * with the cause on the returned {@link PipelineResult}. There are no retries.
 */
public class EtlPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(EtlPipeline.class);

    private final DatabaseConnection database;
    private final SchemaManager schemaManager;
    private final JsonFileExtractor extractor;
    private final InteractionTransformer transformer;
    private final InteractionLoader loader;

    public EtlPipeline(DatabaseConnection database, PipelineConfig config) {
        this(database, new SchemaManager(config.getTable()), config);
    }

    private EtlPipeline(DatabaseConnection database, SchemaManager schemaManager, PipelineConfig config) {
        this(database, schemaManager,
             new JsonFileExtractor(),
             new InteractionTransformer(config.getInteractionIdPolicy()),
             new InteractionLoader(database, schemaManager, config.getBatchSize()));
    }

    public EtlPipeline(DatabaseConnection database, SchemaManager schemaManager, JsonFileExtractor extractor,
                       InteractionTransformer transformer, InteractionLoader loader) {
        this.database = database;
        this.schemaManager = schemaManager;
        this.extractor = extractor;
        this.transformer = transformer;
        this.loader = loader;
    }

    public PipelineResult run(Path inputDirectory) {
        LOGGER.info("Starting ETL pipeline for input directory {}", inputDirectory);
        PipelineResult.PipelineResultBuilder result = PipelineResult.builder();
        PipelineState state = PipelineState.INIT;

        try {
            prepareSchema();
            state = transition(state, PipelineState.SCHEMA_READY);

            RecordSet records = extractor.extract(inputDirectory);
            result.recordsExtracted(records.size()).warnings(records.getWarnings());
            if (records.isEmpty()) {
                LOGGER.warn("No data extracted from {}, nothing to load", inputDirectory);
                state = transition(state, PipelineState.COMPLETED_EMPTY);
                return result.state(state).build();
            }
            state = transition(state, PipelineState.EXTRACTED);

            List<EnrichedInteraction> enriched = transformer.transform(records);
            state = transition(state, PipelineState.TRANSFORMED);

            InsertSummary summary = loader.load(enriched);
            state = transition(state, PipelineState.LOADED);

            LOGGER.info("ETL pipeline completed successfully: {} extracted, {} inserted, {} skipped, {} files skipped",
                       records.size(), summary.getInserted(), summary.getSkipped(), records.getWarnings().size());
            return result.state(state)
                .inserted(summary.getInserted())
                .skipped(summary.getSkipped())
                .build();
        } catch (Exception e) {
            LOGGER.error("ETL pipeline failed in state {}: {}", state, e.getMessage(), e);
            state = transition(state, PipelineState.FAILED);
            return result.state(state).failure(e).build();
        }
    }

    /**
     * Create the target table and its indexes in a transaction of their own.
     * Partitions depend on the data and are created by the loader.
     */
    void prepareSchema() {
        try (Connection conn = database.getConnection();
             TransactionScope tx = TransactionScope.begin(conn)) {
            schemaManager.ensureSchema(conn);
            tx.commit();
        } catch (SQLException e) {
            throw new LoadException(schemaManager.getTable(), "schema setup failed: " + e.getMessage(), e);
        }
    }

    private static PipelineState transition(PipelineState from, PipelineState to) {
        LOGGER.info("Pipeline state {} -> {}", from, to);
        return to;
    }
}

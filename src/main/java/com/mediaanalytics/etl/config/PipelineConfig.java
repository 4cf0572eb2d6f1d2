package com.mediaanalytics.etl.config;

import com.mediaanalytics.etl.transform.InteractionIdPolicy;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Pipeline settings: target table, insert batch size and interaction id policy.
 */
public class PipelineConfig {
    public static final String ETL_TABLE = "ETL_TABLE";
    public static final String ETL_BATCH_SIZE = "ETL_BATCH_SIZE";
    public static final String ETL_INTERACTION_ID_POLICY = "ETL_INTERACTION_ID_POLICY";

    public static final String DEFAULT_TABLE = "user_interactions";
    public static final int DEFAULT_BATCH_SIZE = 100;
    private static final int MAX_BATCH_SIZE = 1000;

    // Table names end up in DDL, so only plain lower-case identifiers are allowed
    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]{0,47}");

    private final String table;
    private final int batchSize;
    private final InteractionIdPolicy interactionIdPolicy;

    public PipelineConfig(String table, int batchSize, InteractionIdPolicy interactionIdPolicy) {
        if (table == null || !IDENTIFIER.matcher(table).matches()) {
            throw new ConfigurationException(ETL_TABLE, table, "must match " + IDENTIFIER.pattern());
        }
        EnvironmentValues.requireRange(ETL_BATCH_SIZE, batchSize, 1, MAX_BATCH_SIZE);
        if (interactionIdPolicy == null) {
            throw new ConfigurationException(ETL_INTERACTION_ID_POLICY, null, "must be non-null");
        }
        this.table = table;
        this.batchSize = batchSize;
        this.interactionIdPolicy = interactionIdPolicy;
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(DEFAULT_TABLE, DEFAULT_BATCH_SIZE, InteractionIdPolicy.DATASET);
    }

    public static PipelineConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static PipelineConfig fromEnvironment(Map<String, String> env) {
        EnvironmentValues values = new EnvironmentValues(env);
        String policyName = values.getString(ETL_INTERACTION_ID_POLICY, InteractionIdPolicy.DATASET.name());
        InteractionIdPolicy policy;
        try {
            policy = InteractionIdPolicy.valueOf(policyName.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(ETL_INTERACTION_ID_POLICY, policyName, "must be DATASET or PER_RECORD");
        }
        return new PipelineConfig(
            values.getString(ETL_TABLE, DEFAULT_TABLE),
            values.getInt(ETL_BATCH_SIZE, DEFAULT_BATCH_SIZE),
            policy);
    }

    public String getTable() { return table; }
    public int getBatchSize() { return batchSize; }
    public InteractionIdPolicy getInteractionIdPolicy() { return interactionIdPolicy; }

    @Override
    public String toString() {
        return String.format("PipelineConfig[table=%s, batchSize=%d, interactionIdPolicy=%s]",
            table, batchSize, interactionIdPolicy);
    }
}

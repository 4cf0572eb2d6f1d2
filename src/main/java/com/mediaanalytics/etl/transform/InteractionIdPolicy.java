package com.mediaanalytics.etl.transform;

/**
 * When the transformer synthesizes {@code interaction_id} values.
 */
public enum InteractionIdPolicy {
    /**
     * Synthesize only if no record in the batch carries an id. A batch that has the
     * field on some records but not others fails the transform.
     */
    DATASET,

    /**
     * Synthesize for every record that lacks an id, keep the ids that are present.
     */
    PER_RECORD
}

package com.mediaanalytics.etl.model;

/**
 * Outcome of a load call: rows written and rows skipped as duplicates.
 */
public class InsertSummary {
    private static final InsertSummary NONE = new InsertSummary(0, 0);

    private final int inserted;
    private final int skipped;

    public InsertSummary(int inserted, int skipped) {
        this.inserted = inserted;
        this.skipped = skipped;
    }

    public static InsertSummary none() {
        return NONE;
    }

    public int getInserted() {
        return inserted;
    }

    public int getSkipped() {
        return skipped;
    }

    public int getTotal() {
        return inserted + skipped;
    }

    @Override
    public String toString() {
        return String.format("InsertSummary[inserted=%d, skipped=%d]", inserted, skipped);
    }
}

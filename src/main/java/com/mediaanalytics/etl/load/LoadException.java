package com.mediaanalytics.etl.load;

/**
 * Schema setup or insert failed. Whatever the load had written is rolled back before this is raised.
 */
public class LoadException extends RuntimeException {
    private final String table;

    public LoadException(String table, String message, Throwable cause) {
        super(String.format("Load into %s failed: %s", table, message), cause);
        this.table = table;
    }

    public String getTable() {
        return table;
    }
}

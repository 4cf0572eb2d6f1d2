package com.mediaanalytics.etl.transform;

/**
 * A record could not be enriched. Fatal to the whole transform: no partial output is produced.
 */
public class TransformationException extends RuntimeException {
    private final int recordIndex;
    private final String field;

    public TransformationException(int recordIndex, String field, String message) {
        this(recordIndex, field, message, null);
    }

    public TransformationException(int recordIndex, String field, String message, Throwable cause) {
        super(String.format("Record %d, field '%s': %s", recordIndex, field, message), cause);
        this.recordIndex = recordIndex;
        this.field = field;
    }

    /**
     * Zero-based position of the failing record in the input record set.
     */
    public int getRecordIndex() {
        return recordIndex;
    }

    public String getField() {
        return field;
    }
}

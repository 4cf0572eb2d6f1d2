package com.mediaanalytics.etl.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Raw interaction records as read from the input files, in file-then-line order.
 *
 * Records are schema-on-read: each one is an open field name to value map holding
 * whatever the JSON object contained (strings, numbers, booleans, nulls, nested maps/lists).
 */
public class RecordSet {
    private static final RecordSet EMPTY = new RecordSet(Collections.emptyList(), Collections.emptyList());

    private final List<Map<String, Object>> records;
    private final List<ExtractionWarning> warnings;

    public RecordSet(List<Map<String, Object>> records, List<ExtractionWarning> warnings) {
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public static RecordSet empty() {
        return EMPTY;
    }

    public static RecordSet of(List<Map<String, Object>> records) {
        return new RecordSet(records, Collections.emptyList());
    }

    public List<Map<String, Object>> getRecords() {
        return records;
    }

    /**
     * Files skipped because they could not be read or parsed.
     */
    public List<ExtractionWarning> getWarnings() {
        return warnings;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Union of field names across all records, in first-seen order.
     */
    public Set<String> fieldNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Map<String, Object> record : records) {
            names.addAll(record.keySet());
        }
        return names;
    }

    /**
     * True when at least one record has a non-null value for the field.
     */
    public boolean hasAnyValue(String field) {
        for (Map<String, Object> record : records) {
            if (record.get(field) != null) {
                return true;
            }
        }
        return false;
    }

    /**
     * Number of records where the field is absent or null.
     */
    public long missingCount(String field) {
        return records.stream().filter(r -> r.get(field) == null).count();
    }

    @Override
    public String toString() {
        return String.format("RecordSet[records=%d, warnings=%d]", records.size(), warnings.size());
    }
}

package com.mediaanalytics.etl.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordSetTest {

    @Test
    void testFieldNamesInFirstSeenOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("user_id", "u1");
        first.put("timestamp", "2025-03-01");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("referrer", null);
        second.put("user_id", "u2");

        RecordSet records = RecordSet.of(Arrays.asList(first, second));

        assertThat(records.fieldNames()).containsExactly("user_id", "timestamp", "referrer");
        assertThat(records.hasAnyValue("referrer")).isFalse();
        assertThat(records.hasAnyValue("user_id")).isTrue();
        assertThat(records.missingCount("timestamp")).isEqualTo(1);
        assertThat(records.missingCount("referrer")).isEqualTo(2);
    }

    @Test
    void testRecordsAreImmutableCopies() {
        List<Map<String, Object>> source = new ArrayList<>();
        source.add(new HashMap<>(Collections.singletonMap("user_id", "u1")));
        ExtractionWarning warning = new ExtractionWarning(Paths.get("bad.json"), "unexpected end of input");

        RecordSet records = new RecordSet(source, Collections.singletonList(warning));
        source.clear();

        assertThat(records.size()).isEqualTo(1);
        assertThat(records.getWarnings()).containsExactly(new ExtractionWarning(Paths.get("bad.json"), "unexpected end of input"));
        assertThatThrownBy(() -> records.getRecords().add(new HashMap<>()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testEmpty() {
        assertThat(RecordSet.empty().isEmpty()).isTrue();
        assertThat(RecordSet.empty().fieldNames()).isEmpty();
    }
}

package com.mediaanalytics.etl.transform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.mediaanalytics.etl.model.EnrichedInteraction;
import com.mediaanalytics.etl.model.RecordSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw interaction records into {@link EnrichedInteraction}s.
 *
 * Pure: no I/O besides logging. Output has exactly one element per input record, in input order.
 * Any record that cannot be enriched (missing required field, unparseable timestamp) aborts the
 * whole transform with a {@link TransformationException}.
 */
public class InteractionTransformer {
    private static final Logger LOGGER = LoggerFactory.getLogger(InteractionTransformer.class);

    static final String INTERACTION_ID = "interaction_id";
    static final String USER_ID = "user_id";
    static final String SESSION_ID = "session_id";
    static final String TIMESTAMP = "timestamp";
    static final String PAGE_URL = "page_url";
    static final String ACTION = "action";
    static final String DEVICE_TYPE = "device_type";
    static final String REFERRER = "referrer";
    static final String TIME_SPENT_SECONDS = "time_spent_seconds";
    static final String SCROLL_DEPTH = "scroll_depth";

    private static final Set<String> KNOWN_FIELDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
        INTERACTION_ID, USER_ID, SESSION_ID, TIMESTAMP, PAGE_URL, ACTION,
        DEVICE_TYPE, REFERRER, TIME_SPENT_SECONDS, SCROLL_DEPTH)));

    // Nested values are written back the way the extractor read them
    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
        .build();

    private final InteractionIdPolicy idPolicy;

    public InteractionTransformer() {
        this(InteractionIdPolicy.DATASET);
    }

    public InteractionTransformer(InteractionIdPolicy idPolicy) {
        this.idPolicy = idPolicy;
    }

    public List<EnrichedInteraction> transform(RecordSet input) {
        if (input.isEmpty()) {
            LOGGER.warn("No data to transform");
            return Collections.emptyList();
        }
        LOGGER.info("Starting data transformation of {} records (interaction id policy: {})",
                   input.size(), idPolicy);

        Set<String> fieldNames = input.fieldNames();
        logFieldStatistics(input, fieldNames);

        boolean synthesizeAll = !input.hasAnyValue(INTERACTION_ID);
        if (synthesizeAll) {
            LOGGER.info("No record carries {}, synthesizing ids for all records", INTERACTION_ID);
        }

        List<EnrichedInteraction> enriched = new ArrayList<>(input.size());
        List<Map<String, Object>> records = input.getRecords();
        for (int i = 0; i < records.size(); i++) {
            enriched.add(enrich(i, records.get(i), synthesizeAll));
        }

        warnOnDuplicateIds(enriched);
        LOGGER.info("Transformation complete. {} records enriched", enriched.size());
        return enriched;
    }

    EnrichedInteraction enrich(int index, Map<String, Object> record, boolean synthesizeAll) {
        String userId = requiredText(index, record, USER_ID);
        String sessionId = requiredText(index, record, SESSION_ID);
        String pageUrl = requiredText(index, record, PAGE_URL);
        String action = requiredText(index, record, ACTION);
        String deviceType = lowerText(record.get(DEVICE_TYPE));
        String referrer = lowerText(record.get(REFERRER));

        OffsetDateTime parsed;
        try {
            parsed = TimestampParser.parseWithOffset(record.get(TIMESTAMP));
        } catch (IllegalArgumentException e) {
            LOGGER.error("Error during transformation of record {}: {}", index, e.getMessage());
            throw new TransformationException(index, TIMESTAMP, e.getMessage(), e);
        }
        Instant timestamp = parsed.toInstant();
        // Calendar fields follow the wall clock written in the record; TIME columns keep microseconds
        LocalDateTime local = parsed.toLocalDateTime().truncatedTo(ChronoUnit.MICROS);
        int dayOfWeek = local.getDayOfWeek().getValue() - 1;

        String interactionId = resolveInteractionId(index, record, synthesizeAll, userId, sessionId, timestamp);

        return EnrichedInteraction.builder()
            .interactionId(interactionId)
            .userId(userId)
            .sessionId(sessionId)
            .timestamp(timestamp)
            .pageUrl(pageUrl)
            .action(action)
            .deviceType(deviceType)
            .referrer(referrer)
            .eventDate(local.toLocalDate())
            .eventTime(local.toLocalTime())
            .eventHour(local.getHour())
            .eventDay(local.getDayOfMonth())
            .eventMonth(local.getMonthValue())
            .eventYear(local.getYear())
            .eventDayOfWeek(dayOfWeek)
            .weekend(dayOfWeek == 5 || dayOfWeek == 6)
            .contentCategory(UrlFieldExtractor.contentCategory(pageUrl))
            .articleId(UrlFieldExtractor.articleId(pageUrl))
            .referrerCategory(ReferrerClassifier.classify(referrer))
            .timeSpentSeconds(lowerText(record.get(TIME_SPENT_SECONDS)))
            .scrollDepth(lowerText(record.get(SCROLL_DEPTH)))
            .build();
    }

    private String resolveInteractionId(int index, Map<String, Object> record, boolean synthesizeAll,
                                        String userId, String sessionId, Instant timestamp) {
        String existing = lowerText(scalar(index, record, INTERACTION_ID));
        if (existing != null) {
            return existing;
        }
        if (synthesizeAll || idPolicy == InteractionIdPolicy.PER_RECORD) {
            return synthesizeId(userId, sessionId, timestamp);
        }
        throw new TransformationException(index, INTERACTION_ID,
            "missing while other records carry it (set ETL_INTERACTION_ID_POLICY=PER_RECORD to synthesize per record)");
    }

    /**
     * {@code {user_id}_{session_id}_{epochSeconds}}
     */
    static String synthesizeId(String userId, String sessionId, Instant timestamp) {
        return userId + "_" + sessionId + "_" + timestamp.getEpochSecond();
    }

    private String requiredText(int index, Map<String, Object> record, String field) {
        String value = lowerText(scalar(index, record, field));
        if (value == null) {
            LOGGER.error("Error during transformation of record {}: required field {} is missing", index, field);
            throw new TransformationException(index, field, "required field is missing");
        }
        return value;
    }

    /**
     * Raw value of a key field, which must not be a nested object or array.
     */
    private Object scalar(int index, Map<String, Object> record, String field) {
        Object raw = record.get(field);
        if (raw instanceof Map || raw instanceof Collection) {
            LOGGER.error("Error during transformation of record {}: field {} is not a scalar", index, field);
            throw new TransformationException(index, field, "expected a scalar value, got a JSON "
                + (raw instanceof Map ? "object" : "array"));
        }
        return raw;
    }

    /**
     * String form of a raw value, lower-cased. Null, NaN and infinite numbers map to null;
     * nested objects and arrays are written back as JSON.
     */
    static String lowerText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map || value instanceof Collection) {
            try {
                return MAPPER.writeValueAsString(value).toLowerCase(Locale.ROOT);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("cannot serialize nested value: " + e.getOriginalMessage(), e);
            }
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            if (d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return BigDecimal.valueOf(d).toPlainString();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value).toLowerCase(Locale.ROOT);
    }

    private void logFieldStatistics(RecordSet input, Set<String> fieldNames) {
        Set<String> unknown = new LinkedHashSet<>();
        for (String field : fieldNames) {
            long missing = input.missingCount(field);
            if (missing == input.size()) {
                LOGGER.info("Field {} contains all null values, skipping string conversion", field);
            } else if (missing > 0) {
                LOGGER.info("Field {} has {} missing values", field, missing);
            }
            if (!KNOWN_FIELDS.contains(field)) {
                unknown.add(field);
            }
        }
        if (!unknown.isEmpty()) {
            LOGGER.debug("Dropping fields with no target column: {}", unknown);
        }
    }

    private void warnOnDuplicateIds(List<EnrichedInteraction> enriched) {
        Set<String> seen = new HashSet<>();
        int duplicates = 0;
        for (EnrichedInteraction interaction : enriched) {
            if (!seen.add(interaction.getInteractionId() + "|" + interaction.getEventDate())) {
                duplicates++;
            }
        }
        if (duplicates > 0) {
            LOGGER.warn("{} records share an (interaction_id, event_date) key with an earlier record and will be skipped on load",
                       duplicates);
        }
    }
}

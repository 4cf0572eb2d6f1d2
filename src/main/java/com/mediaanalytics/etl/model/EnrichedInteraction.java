package com.mediaanalytics.etl.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One normalized interaction, ready to be written as a row of the interactions table.
 *
 * Property names match the table's column names. Textual values are lower-case.
 * {@link #timestamp} is the UTC instant; calendar components use the wall clock of the raw value,
 * in UTC only when the raw value carried no offset.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichedInteraction {

    /**
     * Column order used for inserts; {@link #columnValues()} returns values in the same order.
     */
    public static final List<String> COLUMNS = Collections.unmodifiableList(Arrays.asList(
        "interaction_id", "user_id", "session_id", "timestamp", "page_url", "action",
        "device_type", "referrer", "event_date", "event_time",
        "event_hour", "event_day", "event_month", "event_year", "event_dayofweek", "is_weekend",
        "content_category", "article_id", "referrer_category",
        "time_spent_seconds", "scroll_depth"));

    @JsonProperty("interaction_id")
    private String interactionId;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("timestamp")
    private Instant timestamp;

    @JsonProperty("page_url")
    private String pageUrl;

    @JsonProperty("action")
    private String action;

    @JsonProperty("device_type")
    private String deviceType;

    @JsonProperty("referrer")
    private String referrer;

    @JsonProperty("event_date")
    private LocalDate eventDate;

    @JsonProperty("event_time")
    private LocalTime eventTime;

    @JsonProperty("event_hour")
    private int eventHour;

    @JsonProperty("event_day")
    private int eventDay;

    @JsonProperty("event_month")
    private int eventMonth;

    @JsonProperty("event_year")
    private int eventYear;

    @JsonProperty("event_dayofweek")
    private int eventDayOfWeek; // Monday=0 .. Sunday=6

    @JsonProperty("is_weekend")
    private boolean weekend;

    @JsonProperty("content_category")
    private String contentCategory;

    @JsonProperty("article_id")
    private String articleId;

    @JsonProperty("referrer_category")
    private String referrerCategory;

    @JsonProperty("time_spent_seconds")
    private String timeSpentSeconds;

    @JsonProperty("scroll_depth")
    private String scrollDepth;

    public List<Object> columnValues() {
        return Arrays.asList(
            interactionId, userId, sessionId, timestamp, pageUrl, action,
            deviceType, referrer, eventDate, eventTime,
            eventHour, eventDay, eventMonth, eventYear, eventDayOfWeek, weekend,
            contentCategory, articleId, referrerCategory,
            timeSpentSeconds, scrollDepth);
    }
}

package com.mediaanalytics.etl.transform;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.regex.Pattern;

/**
 * Parses raw {@code timestamp} values.
 *
 * Accepted forms:
 * <ul>
 *   <li>ISO-8601 date-time with {@code Z} or a numeric offset ({@code +02:00}, {@code +0200})</li>
 *   <li>ISO-8601 local date-time, with {@code T} or a space before the time (read as UTC)</li>
 *   <li>ISO-8601 date, extended ({@code 2025-03-01}) or basic ({@code 20250301}), at midnight UTC</li>
 *   <li>epoch seconds as a JSON number, fractions allowed</li>
 * </ul>
 * Any other string, digits-only ones included, is rejected.
 */
public final class TimestampParser {
    private static final Pattern BASIC_DATE = Pattern.compile("\\d{8}");
    private static final Pattern SPACE_SEPARATED = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) +(\\d)");

    private static final DateTimeFormatter FORMATTER = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
        .optionalEnd()
        .toFormatter();

    private TimestampParser() {
    }

    /**
     * The instant a raw value denotes.
     *
     * @throws IllegalArgumentException if the value is null, of an unsupported type, or unparseable
     */
    public static Instant parse(Object value) {
        return parseWithOffset(value).toInstant();
    }

    /**
     * Like {@link #parse(Object)}, keeping the offset written in the value so the wall clock
     * can be read back. Values without an offset get {@code Z}.
     *
     * @throws IllegalArgumentException if the value is null, of an unsupported type, or unparseable
     */
    public static OffsetDateTime parseWithOffset(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("timestamp is missing");
        }
        if (value instanceof Number) {
            // NaN and Infinity fail here with NumberFormatException
            return fromEpochSeconds(new BigDecimal(value.toString()));
        }
        if (!(value instanceof String)) {
            throw new IllegalArgumentException("unsupported timestamp type " + value.getClass().getSimpleName());
        }

        String text = ((String) value).trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("timestamp is empty");
        }
        if (BASIC_DATE.matcher(text).matches()) {
            try {
                return LocalDate.parse(text, DateTimeFormatter.BASIC_ISO_DATE).atStartOfDay().atOffset(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("unparseable timestamp '" + text + "'", e);
            }
        }

        String normalized = SPACE_SEPARATED.matcher(text).replaceFirst("$1T$2");
        try {
            TemporalAccessor parsed = FORMATTER.parseBest(normalized,
                OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime) {
                return (OffsetDateTime) parsed;
            }
            if (parsed instanceof LocalDateTime) {
                return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
            }
            return ((LocalDate) parsed).atStartOfDay().atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("unparseable timestamp '" + text + "'", e);
        }
    }

    private static OffsetDateTime fromEpochSeconds(BigDecimal seconds) {
        try {
            long whole = seconds.setScale(0, RoundingMode.FLOOR).longValueExact();
            int nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).intValue();
            return Instant.ofEpochSecond(whole, nanos).atOffset(ZoneOffset.UTC);
        } catch (ArithmeticException | DateTimeException e) {
            throw new IllegalArgumentException("epoch seconds out of range: " + seconds.toPlainString(), e);
        }
    }
}

package com.mediaanalytics.etl.load;

import java.math.BigInteger;
import java.sql.Date;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;

/**
 * Conversion of enriched values to the JDBC types bound for the interactions table.
 */
public final class JdbcValues {

    private JdbcValues() {
    }

    /**
     * Map a value to what gets bound on the insert statement:
     * <ul>
     *   <li>{@link LocalDate} to {@link Date}; {@link LocalTime} and {@link LocalDateTime} are bound as is</li>
     *   <li>{@link Instant} to the {@link LocalDateTime} of its UTC wall clock</li>
     *   <li>integral numbers to their decimal text (the calendar component columns are text)</li>
     *   <li>NaN or infinite floating point values to null</li>
     * </ul>
     * Strings, booleans and other numbers pass through unchanged.
     */
    public static Object toJdbc(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate) {
            return Date.valueOf((LocalDate) value);
        }
        if (value instanceof LocalTime) {
            // java.sql.Time drops fractions; the driver binds LocalTime with microseconds
            return value;
        }
        if (value instanceof Instant) {
            // timestamp column has no zone: store the UTC wall clock
            return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isNaN(d) || Double.isInfinite(d) ? null : value;
        }
        return value;
    }
}

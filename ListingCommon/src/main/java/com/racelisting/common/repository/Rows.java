package com.racelisting.common.repository;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Typed reads from the {@code Map<String, Object>} rows returned by {@code Base.findAll}.
 *
 * SQLite hands back integers as Integer or Long depending on magnitude, booleans
 * as 0/1 and DATETIME columns as the text they were stored with.
 */
public final class Rows {

    /** Integers above this magnitude are epoch milliseconds, below it epoch seconds. */
    private static final long EPOCH_MILLIS_THRESHOLD = 1_000_000_000_000L;

    private static final DateTimeFormatter SQL_DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private Rows() {
    }

    public static Long getLong(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) return null;
        if (value instanceof Number number) return number.longValue();
        return Long.parseLong(value.toString().trim());
    }

    public static Integer getInteger(Map<String, Object> row, String column) {
        Long value = getLong(row, column);
        return value != null ? Math.toIntExact(value) : null;
    }

    public static String getString(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value != null ? value.toString() : null;
    }

    public static boolean getBoolean(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) return false;
        if (value instanceof Boolean bool) return bool;
        if (value instanceof Number number) return number.intValue() != 0;
        String text = value.toString().trim();
        return "1".equals(text) || "true".equalsIgnoreCase(text);
    }

    /**
     * Reads a start time stored as a timestamp, epoch seconds or millis, ISO-8601 text
     * (with or without offset) or {@code yyyy-MM-dd HH:mm:ss} text taken as UTC.
     * Null or blank values read as null.
     */
    public static Instant getInstant(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) return null;
        if (value instanceof java.util.Date date) return date.toInstant();
        if (value instanceof Number number) return fromEpoch(number.longValue());

        String text = value.toString().trim();
        if (text.isEmpty()) return null;
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text, SQL_DATETIME).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            }
        }
    }

    private static Instant fromEpoch(long value) {
        return Math.abs(value) > EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochMilli(value) : Instant.ofEpochSecond(value);
    }
}

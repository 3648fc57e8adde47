package io.liveguard.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

public final class Timestamps {
    private static final DateTimeFormatter RFC3339_UTC_SECONDS =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);
    private static final int MIN_YEAR = 0;
    private static final int MAX_YEAR = 9999;

    private Timestamps() {
    }

    /**
     * Parses an agent timestamp. Offsets are honoured, a missing offset means UTC, and
     * a space is accepted in place of {@code T}. Returns null when the value cannot be read
     * or its year falls outside 0000-9999.
     */
    public static Instant parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        if (value.length() > 10 && value.charAt(10) == ' ') {
            value = value.substring(0, 10) + 'T' + value.substring(11);
        }
        try {
            OffsetDateTime parsed = OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
            return inRfc3339Range(parsed.getYear()) ? parsed.toInstant() : null;
        } catch (DateTimeParseException ignored) {
            // fall through to the offset-less form
        }
        try {
            LocalDateTime parsed = LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            return inRfc3339Range(parsed.getYear()) ? parsed.toInstant(ZoneOffset.UTC) : null;
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static boolean inRfc3339Range(int year) {
        return year >= MIN_YEAR && year <= MAX_YEAR;
    }

    public static String formatUtcSeconds(Instant instant) {
        return RFC3339_UTC_SECONDS.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }

    public static Long toMillis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    public static Instant fromMillis(long ms, boolean wasNull) {
        return wasNull ? null : Instant.ofEpochMilli(ms);
    }
}

package com.drautomation.api.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Parsing of the ISO-8601 strings temporal column values are stored as in backup payloads.
 */
public final class TemporalValues {

    private TemporalValues() {
    }

    /**
     * Accepts both instants and zone-less date-times, the latter read as UTC.
     */
    public static Instant parseInstant(String value) {
        if (value.endsWith("Z") || value.matches(".*[+-]\\d{2}:\\d{2}$")) {
            return OffsetDateTime.parse(value).toInstant();
        }
        return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
    }

    /**
     * Like {@link #parseInstant(String)} but also accepts plain dates (start of day, UTC).
     *
     * @return null when {@code value} is not a temporal string
     */
    public static Instant tryParseInstant(Object value) {
        if (!(value instanceof String)) {
            return null;
        }
        String text = (String) value;
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return parseInstant(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}

package com.pocketledger.dto;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Parses the transaction date sent by clients.
 *
 * Accepted: an instant ("2024-03-01T10:15:30Z"), an offset date-time
 * ("2024-03-01T10:15:30-03:00"), a local date-time read as UTC, or a bare
 * date ("2024-03-01") meaning 00:00 UTC.
 */
public final class RequestDates {

    private RequestDates() {
    }

    /**
     * @return null for a null/blank value
     * @throws IllegalArgumentException if the value matches none of the formats
     */
    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.strip();
        try {
            if (text.indexOf('T') < 0) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            return parsed instanceof OffsetDateTime offsetDateTime
                    ? offsetDateTime.toInstant()
                    : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date: " + value, e);
        }
    }
}

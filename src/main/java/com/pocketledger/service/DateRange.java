package com.pocketledger.service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Closed interval [start, end] on transaction dates.
 *
 * Calendar days are interpreted in UTC. A missing bound is widened to
 * {@link #EARLIEST} / {@link #LATEST}, both representable by PostgreSQL
 * timestamps, so queries always receive concrete values.
 */
public record DateRange(Instant start, Instant end) {

    public static final Instant EARLIEST = Instant.parse("0001-01-01T00:00:00Z");
    public static final Instant LATEST = Instant.parse("9999-12-31T23:59:59.999999Z");

    public DateRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Date range bounds cannot be null");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Start date must not be after end date");
        }
    }

    /**
     * Range covering whole calendar days: startDate from 00:00 and endDate up to
     * its last microsecond.
     *
     * @return empty when neither bound is given
     * @throws IllegalArgumentException if startDate is after endDate
     */
    public static Optional<DateRange> ofDays(LocalDate startDate, LocalDate endDate) {
        if (startDate == null && endDate == null) {
            return Optional.empty();
        }
        Instant start = startDate != null ? startOfDay(startDate) : EARLIEST;
        Instant end = endDate != null ? endOfDay(endDate) : LATEST;
        return Optional.of(new DateRange(start, end));
    }

    public static DateRange unbounded() {
        return new DateRange(EARLIEST, LATEST);
    }

    public boolean isStartOpen() {
        return EARLIEST.equals(start);
    }

    public boolean isEndOpen() {
        return LATEST.equals(end);
    }

    static Instant startOfDay(LocalDate day) {
        return day.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    static Instant endOfDay(LocalDate day) {
        return startOfDay(day.plusDays(1)).minus(1, ChronoUnit.MICROS);
    }
}

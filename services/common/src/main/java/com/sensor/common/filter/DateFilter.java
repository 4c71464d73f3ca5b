package com.sensor.common.filter;

import com.sensor.common.exception.InvalidFilterException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parsing and matching of the optional calendar-date filter ({@code YYYY-MM-DD}).
 */
public final class DateFilter {

    private DateFilter() {}

    /**
     * Parses a filter value. Null or blank means "no filter".
     *
     * @throws InvalidFilterException if the value is not a valid ISO calendar date
     */
    public static Optional<LocalDate> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value.trim(), DateTimeFormatter.ISO_LOCAL_DATE));
        } catch (DateTimeParseException e) {
            throw new InvalidFilterException(value,
                    "Invalid date format: " + value + ". Use YYYY-MM-DD format.");
        }
    }

    /**
     * True when no filter is set or the timestamp falls on the filter date.
     */
    public static boolean matches(LocalDate filter, LocalDateTime timestamp) {
        return filter == null || filter.equals(timestamp.toLocalDate());
    }

    /**
     * Inclusive start of the filter day.
     */
    public static LocalDateTime startOf(LocalDate filter) {
        return filter.atStartOfDay();
    }

    /**
     * Exclusive end of the filter day.
     */
    public static LocalDateTime endOf(LocalDate filter) {
        return filter.plusDays(1).atStartOfDay();
    }
}

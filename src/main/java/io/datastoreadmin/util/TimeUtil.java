package io.datastoreadmin.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Utility class for time arithmetic and ISO-8601 timestamp parsing.
 */
public final class TimeUtil {

    private TimeUtil() {
        // Utility class
    }

    /**
     * Advances the given time by one unit. Advancing by a month or year clamps the day to the
     * last valid day of the target month (e.g. Jan 31 -> Feb 28).
     *
     * @param time the time to advance
     * @param unit one of HOURS, DAYS, MONTHS or YEARS
     * @return the advanced time
     */
    public static ZonedDateTime advanceOneUnit(ZonedDateTime time, ChronoUnit unit) {
        switch (unit) {
            case HOURS:
                return time.plusHours(1);
            case DAYS:
                return time.plusDays(1);
            case MONTHS:
                return time.plusMonths(1);
            case YEARS:
                return time.plusYears(1);
            default:
                throw new IllegalArgumentException("Unsupported time unit: " + unit);
        }
    }

    /**
     * Parses an ISO-8601 date-time (with offset) or date. A date parses as midnight UTC.
     *
     * @throws IllegalArgumentException if the value is neither
     */
    public static Instant parseIso8601(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Cannot parse a null timestamp");
        }

        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException e2) {
                throw new IllegalArgumentException("Invalid ISO-8601 timestamp: " + value, e);
            }
        }
    }
}

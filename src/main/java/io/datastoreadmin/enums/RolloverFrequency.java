package io.datastoreadmin.enums;

import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * How often a rollover index template starts a new concrete index.
 *
 * Each frequency has an index name suffix pattern; the number of dash-separated elements in the
 * pattern is used to recognize index names created for that frequency.
 */
public enum RolloverFrequency {
    HOURLY("hourly", "yyyy-MM-dd-HH", ChronoUnit.HOURS),
    DAILY("daily", "yyyy-MM-dd", ChronoUnit.DAYS),
    MONTHLY("monthly", "yyyy-MM", ChronoUnit.MONTHS),
    YEARLY("yearly", "yyyy", ChronoUnit.YEARS);

    private final String value;
    private final String suffixPattern;
    private final ChronoUnit timeUnit;
    private final DateTimeFormatter suffixFormatter;

    RolloverFrequency(String value, String suffixPattern, ChronoUnit timeUnit) {
        this.value = value;
        this.suffixPattern = suffixPattern;
        this.timeUnit = timeUnit;
        this.suffixFormatter = DateTimeFormatter.ofPattern(suffixPattern, Locale.ROOT);
    }

    public String getValue() {
        return value;
    }

    public String getSuffixPattern() {
        return suffixPattern;
    }

    public ChronoUnit getTimeUnit() {
        return timeUnit;
    }

    public DateTimeFormatter getSuffixFormatter() {
        return suffixFormatter;
    }

    /**
     * Number of dash-separated time elements in an index name suffix for this frequency.
     */
    public int getTimeElementCount() {
        return suffixPattern.split("-").length;
    }

    /**
     * Looks up a frequency by its configured name (e.g. "monthly"). Returns null for unknown names.
     */
    public static RolloverFrequency fromString(String value) {
        if (value == null) return null;

        String trimmed = value.trim();
        for (RolloverFrequency frequency : values()) {
            if (frequency.value.equalsIgnoreCase(trimmed)) {
                return frequency;
            }
        }
        return null;
    }
}

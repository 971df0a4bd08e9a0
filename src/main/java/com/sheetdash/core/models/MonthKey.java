package com.sheetdash.core.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.util.Comparator;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A (year, month) pair identifying one revenue column, e.g. {@code Umsatz_2023-06}.
 */
@Value
public class MonthKey implements Comparable<MonthKey> {

    public static final String COLUMN_PREFIX = "Umsatz_";

    private static final Pattern COLUMN_PATTERN =
            Pattern.compile("^Umsatz_(\\d{4})-(0[1-9]|1[0-2])$", Pattern.CASE_INSENSITIVE);
    private static final Pattern KEY_PATTERN = Pattern.compile("^(\\d{4})-(0[1-9]|1[0-2])$");

    private static final Comparator<MonthKey> CHRONOLOGICAL =
            Comparator.comparingInt(MonthKey::getYear).thenComparingInt(MonthKey::getMonth);

    int year;
    int month;

    public MonthKey(int year, int month) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Month must be between 1 and 12: " + month);
        }
        this.year = year;
        this.month = month;
    }

    /**
     * Parses a header like {@code Umsatz_2023-06}. Empty when the header is not a month revenue column.
     */
    public static Optional<MonthKey> fromColumnName(String header) {
        if (header == null) {
            return Optional.empty();
        }
        Matcher matcher = COLUMN_PATTERN.matcher(header.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new MonthKey(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2))));
    }

    @JsonCreator
    public static MonthKey parse(String key) {
        Matcher matcher = KEY_PATTERN.matcher(key == null ? "" : key.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid month key '" + key + "', expected YYYY-MM");
        }
        return new MonthKey(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
    }

    public String columnName() {
        return COLUMN_PREFIX + this;
    }

    public boolean isBetween(MonthKey start, MonthKey end) {
        return (start == null || compareTo(start) >= 0) && (end == null || compareTo(end) <= 0);
    }

    @Override
    public int compareTo(MonthKey other) {
        return CHRONOLOGICAL.compare(this, other);
    }

    @JsonValue
    @Override
    public String toString() {
        return String.format("%04d-%02d", year, month);
    }
}

package com.sheetdash.core.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Identity columns of the people sheet and the header each one is read from and written to.
 */
public enum ColumnRole {
    NAME("Name"),
    FIRST_NAME("Vorname"),
    LAST_NAME("Nachname"),
    CITY("Stadt"),
    DEPARTMENT("Abteilung"),
    PROFESSION("Beruf"),
    PART_TIME("Teilzeit"),
    AGE("Alter");

    private final String header;

    ColumnRole(String header) {
        this.header = header;
    }

    public String getHeader() {
        return header;
    }

    public static Optional<ColumnRole> fromHeader(String header) {
        if (header == null) {
            return Optional.empty();
        }
        String trimmed = header.trim();
        return Arrays.stream(values())
                .filter(role -> role.header.equals(trimmed))
                .findFirst();
    }
}

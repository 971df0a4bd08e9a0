package com.sheetdash.core.enums;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum PartTimeStatus {
    JA("Ja"),
    NEIN("Nein");

    private static final Set<String> AFFIRMATIVE = Set.of("ja", "j", "yes", "y", "true", "1");
    private static final Set<String> NEGATIVE = Set.of("nein", "n", "no", "false", "0");

    private final String label;

    PartTimeStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Matches a raw cell text against the yes/no vocabulary, ignoring case and surrounding blanks.
     */
    public static Optional<PartTimeStatus> fromText(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (AFFIRMATIVE.contains(value)) {
            return Optional.of(JA);
        }
        if (NEGATIVE.contains(value)) {
            return Optional.of(NEIN);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}

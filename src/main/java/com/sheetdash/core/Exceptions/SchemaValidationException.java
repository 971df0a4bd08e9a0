package com.sheetdash.core.Exceptions;

import com.sheetdash.core.DTO.MissingRequirement;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when required columns are absent. Lists every problem found, not only the first.
 */
public class SchemaValidationException extends SheetDashException {

    private final List<MissingRequirement> missing;

    public SchemaValidationException(List<MissingRequirement> missing) {
        super(buildMessage(missing));
        this.missing = List.copyOf(missing);
    }

    public List<MissingRequirement> getMissing() {
        return missing;
    }

    private static String buildMessage(List<MissingRequirement> missing) {
        return missing.size() + " schema problem(s): " + missing.stream()
                .map(m -> m.getRequirement() + " (" + m.getHint() + ")")
                .collect(Collectors.joining("; "));
    }
}

package com.sheetdash.core.models;

import com.sheetdash.core.enums.WarningType;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Value
public class DiagnosticsReport {

    List<DataQualityWarning> warnings;

    public DiagnosticsReport(List<DataQualityWarning> warnings) {
        this.warnings = List.copyOf(warnings);
    }

    public static DiagnosticsReport merge(List<List<DataQualityWarning>> stageWarnings) {
        List<DataQualityWarning> all = new ArrayList<>();
        stageWarnings.forEach(all::addAll);
        return new DiagnosticsReport(all);
    }

    public int getWarningCount() {
        return warnings.size();
    }

    public int count(WarningType type) {
        return (int) warnings.stream().filter(w -> w.getType() == type).count();
    }

    public Map<WarningType, Integer> getCountsByType() {
        Map<WarningType, Integer> counts = new EnumMap<>(WarningType.class);
        for (DataQualityWarning warning : warnings) {
            counts.merge(warning.getType(), 1, Integer::sum);
        }
        return Collections.unmodifiableMap(counts);
    }

    /**
     * Distinct unknown cities in first-seen order, at most {@code limit} of them.
     */
    public List<String> unknownCities(int limit) {
        return warnings.stream()
                .filter(w -> w.getType() == WarningType.UNKNOWN_CITY)
                .map(DataQualityWarning::getValue)
                .distinct()
                .limit(limit)
                .collect(Collectors.toList());
    }
}

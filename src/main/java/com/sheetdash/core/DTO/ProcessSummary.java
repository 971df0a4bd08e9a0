package com.sheetdash.core.DTO;

import com.sheetdash.core.enums.WarningType;
import com.sheetdash.core.models.MonthKey;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Per-run report printed after sanitization.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessSummary {
    private int recordCount;
    private int monthCount;
    private MonthKey firstMonth;
    private MonthKey lastMonth;
    private int warningCount;
    private Map<WarningType, Integer> warningsByType;
    private List<String> unknownCities;
    private FilterSpecification defaultFilter;

    public String toDisplayText() {
        StringBuilder text = new StringBuilder("--- Summary ---\n");
        text.append(String.format("Records:         %d%n", recordCount));
        if (monthCount == 0) {
            text.append(String.format("Revenue months:  0 (none)%n"));
        } else {
            text.append(String.format("Revenue months:  %d (%s to %s)%n", monthCount, firstMonth, lastMonth));
        }
        text.append(String.format("Warnings:        %d%n", warningCount));
        if (warningsByType != null) {
            warningsByType.forEach((type, count) -> text.append(String.format("  %-20s %d%n", type, count)));
        }
        if (unknownCities != null && !unknownCities.isEmpty()) {
            text.append(String.format("Unknown cities:  %s%n", String.join(", ", unknownCities)));
        }
        text.append(String.format("Default filter:  %s", describe(defaultFilter)));
        return text.toString();
    }

    private static String describe(FilterSpecification filter) {
        if (filter == null || filter.getStartMonth() == null) {
            return "all departments, all months";
        }
        String departments = filter.getDepartments() == null || filter.getDepartments().isEmpty()
                ? "all departments"
                : filter.getDepartments().stream().sorted().collect(Collectors.joining(", "));
        return String.format("%s, %s to %s", departments, filter.getStartMonth(), filter.getEndMonth());
    }
}

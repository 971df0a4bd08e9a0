package com.sheetdash.core.batches.processors;

import com.sheetdash.core.DTO.MissingRequirement;
import com.sheetdash.core.Exceptions.SchemaValidationException;
import com.sheetdash.core.enums.ColumnRole;
import com.sheetdash.core.enums.NameMode;
import com.sheetdash.core.models.MonthKey;
import com.sheetdash.core.models.SheetTable;
import com.sheetdash.core.models.TableSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Checks that the input sheet carries every column the pipeline needs before any cell is touched.
 */
@Slf4j
@Component
public class SchemaValidator {

    private static final List<ColumnRole> REQUIRED_ROLES = List.of(
            ColumnRole.CITY, ColumnRole.PROFESSION, ColumnRole.DEPARTMENT, ColumnRole.PART_TIME, ColumnRole.AGE);

    /**
     * @return resolved column positions
     * @throws SchemaValidationException listing every missing requirement
     */
    public TableSchema validate(SheetTable table) {
        Map<ColumnRole, Integer> columns = new EnumMap<>(ColumnRole.class);
        TreeMap<MonthKey, Integer> monthColumns = new TreeMap<>();
        List<MissingRequirement> problems = new ArrayList<>();

        List<String> headers = table.getHeaders();
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            final int index = i;
            ColumnRole.fromHeader(header).ifPresent(role -> columns.putIfAbsent(role, index));

            MonthKey month = MonthKey.fromColumnName(header).orElse(null);
            if (month != null) {
                Integer previous = monthColumns.putIfAbsent(month, index);
                if (previous != null) {
                    problems.add(new MissingRequirement(
                            "Unique column for month " + month,
                            String.format("Columns %d and %d both hold %s; merge or remove one of them",
                                    previous + 1, index + 1, month.columnName())));
                }
            }
        }

        NameMode nameMode = resolveNameMode(columns, problems);

        for (ColumnRole role : REQUIRED_ROLES) {
            if (!columns.containsKey(role)) {
                problems.add(new MissingRequirement(
                        "Column '" + role.getHeader() + "'",
                        "Add a column named '" + role.getHeader() + "' or rename the existing one"));
            }
        }

        if (monthColumns.isEmpty()) {
            problems.add(new MissingRequirement(
                    "At least one monthly revenue column",
                    "Name revenue columns Umsatz_YYYY-MM with a month between 01 and 12, e.g. Umsatz_2024-01"));
        }

        if (!problems.isEmpty()) {
            log.error("❌ Schema check failed with {} problem(s)", problems.size());
            problems.forEach(p -> log.error("   - {}: {}", p.getRequirement(), p.getHint()));
            throw new SchemaValidationException(problems);
        }

        log.info("✅ Schema OK: name mode {}, {} revenue month(s) from {} to {}",
                nameMode, monthColumns.size(),
                monthColumns.firstKey(), monthColumns.lastKey());

        return TableSchema.builder()
                .nameMode(nameMode)
                .columns(columns)
                .monthColumns(monthColumns)
                .build();
    }

    private NameMode resolveNameMode(Map<ColumnRole, Integer> columns, List<MissingRequirement> problems) {
        boolean hasFirst = columns.containsKey(ColumnRole.FIRST_NAME);
        boolean hasLast = columns.containsKey(ColumnRole.LAST_NAME);
        if (hasFirst && hasLast) {
            return NameMode.SEPARATE;
        }
        if (columns.containsKey(ColumnRole.NAME)) {
            return NameMode.COMBINED;
        }

        String hint;
        if (hasFirst) {
            hint = "Found 'Vorname' without 'Nachname'; add 'Nachname' or provide a combined 'Name' column";
        } else if (hasLast) {
            hint = "Found 'Nachname' without 'Vorname'; add 'Vorname' or provide a combined 'Name' column";
        } else {
            hint = "Add a combined 'Name' column or both 'Vorname' and 'Nachname'";
        }
        problems.add(new MissingRequirement("Name column(s)", hint));
        return null;
    }
}

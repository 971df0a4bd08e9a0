package com.sheetdash.core.batches.processors;

import com.sheetdash.core.Exceptions.TypeCoercionException;
import com.sheetdash.core.enums.ColumnRole;
import com.sheetdash.core.enums.NameMode;
import com.sheetdash.core.enums.PartTimeStatus;
import com.sheetdash.core.enums.WarningType;
import com.sheetdash.core.models.DataQualityWarning;
import com.sheetdash.core.models.MonthKey;
import com.sheetdash.core.models.PersonRecord;
import com.sheetdash.core.models.SheetTable;
import com.sheetdash.core.models.StageResult;
import com.sheetdash.core.models.TableSchema;
import com.sheetdash.core.utils.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Coerces raw cells into typed person records.
 * Age and part-time flag are strict and abort the run on bad input; revenue cells are lenient
 * and fall back to zero with a warning.
 */
@Slf4j
@Component
public class TypeNormalizer {

    // grouped amounts need a decimal part or at least two group separators, "1.234" stays a decimal
    private static final Pattern GERMAN_GROUPED =
            Pattern.compile("^[-+]?\\d{1,3}(?:(?:\\.\\d{3})+,\\d+|(?:\\.\\d{3}){2,})$");
    private static final Pattern ENGLISH_GROUPED =
            Pattern.compile("^[-+]?\\d{1,3}(?:(?:,\\d{3})+\\.\\d+|(?:,\\d{3}){2,})$");
    private static final Pattern DECIMAL_COMMA = Pattern.compile("^[-+]?\\d*,\\d+$");

    public StageResult<List<PersonRecord>> normalize(SheetTable table, TableSchema schema) {
        List<PersonRecord> records = new ArrayList<>(table.getRowCount());
        List<DataQualityWarning> warnings = new ArrayList<>();

        for (int i = 0; i < table.getRowCount(); i++) {
            int row = table.rowNumber(i);
            PersonRecord.PersonRecordBuilder builder = PersonRecord.builder()
                    .sourceRow(row)
                    .city(text(table, i, schema, ColumnRole.CITY))
                    .department(text(table, i, schema, ColumnRole.DEPARTMENT))
                    .profession(text(table, i, schema, ColumnRole.PROFESSION))
                    .partTime(parsePartTime(row, table.cell(i, schema.columnOf(ColumnRole.PART_TIME))))
                    .age(parseAge(row, table.cell(i, schema.columnOf(ColumnRole.AGE))));

            if (schema.getNameMode() == NameMode.COMBINED) {
                builder.rawName(TextNormalizer.cellText(table.cell(i, schema.columnOf(ColumnRole.NAME))));
            } else {
                builder.firstName(TextNormalizer.cellText(table.cell(i, schema.columnOf(ColumnRole.FIRST_NAME))))
                        .lastName(TextNormalizer.cellText(table.cell(i, schema.columnOf(ColumnRole.LAST_NAME))));
            }

            Map<MonthKey, Double> revenue = new LinkedHashMap<>();
            for (Map.Entry<MonthKey, Integer> column : schema.getMonthColumns().entrySet()) {
                Object cell = table.cell(i, column.getValue());
                revenue.put(column.getKey(), parseRevenue(row, column.getKey().columnName(), cell, warnings));
            }
            builder.monthlyRevenue(revenue);

            records.add(builder.build());
        }

        log.info("🔢 Normalized {} row(s), {} revenue cell warning(s)", records.size(), warnings.size());
        return new StageResult<>(records, warnings);
    }

    PartTimeStatus parsePartTime(int row, Object cell) {
        String raw = TextNormalizer.cellText(cell);
        return PartTimeStatus.fromText(raw)
                .orElseThrow(() -> new TypeCoercionException(row, ColumnRole.PART_TIME.getHeader(), raw,
                        "expected ja/j/yes/y/true/1 or nein/n/no/false/0"));
    }

    int parseAge(int row, Object cell) {
        String column = ColumnRole.AGE.getHeader();
        if (cell instanceof Number) {
            double value = ((Number) cell).doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value) || value != Math.rint(value)) {
                throw new TypeCoercionException(row, column, String.valueOf(cell), "age must be a whole number");
            }
            return checkAgeRange(row, column, String.valueOf(cell), value);
        }

        String raw = TextNormalizer.cellText(cell).trim();
        if (raw.isEmpty()) {
            throw new TypeCoercionException(row, column, raw, "age is required");
        }
        try {
            BigDecimal value = new BigDecimal(raw.replace(',', '.'));
            if (value.stripTrailingZeros().scale() > 0) {
                throw new TypeCoercionException(row, column, raw, "age must be a whole number");
            }
            return checkAgeRange(row, column, raw, value.doubleValue());
        } catch (NumberFormatException e) {
            throw new TypeCoercionException(row, column, raw, "age must be a whole number");
        }
    }

    private int checkAgeRange(int row, String column, String raw, double value) {
        if (value < 0) {
            throw new TypeCoercionException(row, column, raw, "age cannot be negative");
        }
        if (value > Integer.MAX_VALUE) {
            throw new TypeCoercionException(row, column, raw, "age is out of range");
        }
        return (int) value;
    }

    double parseRevenue(int row, String column, Object cell, List<DataQualityWarning> warnings) {
        if (cell == null || (cell instanceof String && ((String) cell).trim().isEmpty())) {
            warnings.add(warning(WarningType.BLANK_REVENUE, row, column, ""));
            log.debug("Row {} {}: blank revenue -> 0", row, column);
            return 0.0;
        }

        double value;
        if (cell instanceof Number) {
            value = ((Number) cell).doubleValue();
        } else {
            Double parsed = parseAmount(cell.toString());
            if (parsed == null) {
                warnings.add(warning(WarningType.UNPARSEABLE_REVENUE, row, column, cell.toString()));
                log.debug("Row {} {}: unparseable revenue '{}' -> 0", row, column, cell);
                return 0.0;
            }
            value = parsed;
        }

        if (Double.isNaN(value) || Double.isInfinite(value)) {
            warnings.add(warning(WarningType.UNPARSEABLE_REVENUE, row, column, String.valueOf(cell)));
            return 0.0;
        }
        if (value < 0) {
            warnings.add(warning(WarningType.NEGATIVE_REVENUE, row, column, TextNormalizer.cellText(cell)));
            log.debug("Row {} {}: negative revenue {} clamped to 0", row, column, value);
            return 0.0;
        }
        // -0.0 becomes 0.0
        return value + 0.0;
    }

    /**
     * Accepts plain decimals ("1234.5", "1234,5") and grouped amounts in German ("1.234,50", "1.234.567")
     * or English ("1,234.50", "1,234,567") notation. A lone separator is always the decimal separator.
     * Currency signs and blanks are ignored; anything else yields {@code null}.
     */
    private Double parseAmount(String raw) {
        String cleaned = raw.replace("€", "").replaceAll("\\s", "");
        String canonical;
        if (GERMAN_GROUPED.matcher(cleaned).matches()) {
            canonical = cleaned.replace(".", "").replace(',', '.');
        } else if (ENGLISH_GROUPED.matcher(cleaned).matches()) {
            canonical = cleaned.replace(",", "");
        } else if (DECIMAL_COMMA.matcher(cleaned).matches()) {
            canonical = cleaned.replace(',', '.');
        } else if (cleaned.contains(",")) {
            return null;
        } else {
            canonical = cleaned;
        }
        try {
            return Double.parseDouble(canonical);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String text(SheetTable table, int rowIndex, TableSchema schema, ColumnRole role) {
        return TextNormalizer.collapseWhitespace(TextNormalizer.cellText(table.cell(rowIndex, schema.columnOf(role))));
    }

    private static DataQualityWarning warning(WarningType type, int row, String column, String value) {
        return DataQualityWarning.builder().type(type).row(row).column(column).value(value).build();
    }
}

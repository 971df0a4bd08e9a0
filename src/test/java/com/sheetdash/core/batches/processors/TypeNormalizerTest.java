package com.sheetdash.core.batches.processors;

import com.sheetdash.core.Exceptions.TypeCoercionException;
import com.sheetdash.core.TestSheets;
import com.sheetdash.core.enums.PartTimeStatus;
import com.sheetdash.core.enums.WarningType;
import com.sheetdash.core.models.DataQualityWarning;
import com.sheetdash.core.models.MonthKey;
import com.sheetdash.core.models.PersonRecord;
import com.sheetdash.core.models.SheetTable;
import com.sheetdash.core.models.StageResult;
import com.sheetdash.core.models.TableSchema;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class TypeNormalizerTest {

    private final TypeNormalizer normalizer = new TypeNormalizer();
    private final SchemaValidator validator = new SchemaValidator();

    private StageResult<List<PersonRecord>> normalize(SheetTable table) {
        return normalizer.normalize(table, validator.validate(table));
    }

    @Test
    void coercesTypedCells() {
        StageResult<List<PersonRecord>> result = normalize(TestSheets.combined()
                .row("Max Müller", "  Köln ", " IT ", "Entwickler", " YES ", "41", "1234,5", 300.0)
                .build());

        PersonRecord record = result.getValue().get(0);
        assertThat(record.getSourceRow()).isEqualTo(1);
        assertThat(record.getRawName()).isEqualTo("Max Müller");
        assertThat(record.getCity()).isEqualTo("Köln");
        assertThat(record.getDepartment()).isEqualTo("IT");
        assertThat(record.getPartTime()).isEqualTo(PartTimeStatus.JA);
        assertThat(record.getAge()).isEqualTo(41);
        assertThat(record.revenueFor(new MonthKey(2023, 6))).isEqualTo(1234.5);
        assertThat(record.revenueFor(new MonthKey(2022, 1))).isEqualTo(300.0);
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void clampsNegativeRevenueWithOneWarning() {
        List<DataQualityWarning> warnings = new ArrayList<>();

        double value = normalizer.parseRevenue(3, "Umsatz_2023-06", -50.0, warnings);

        assertThat(value).isZero();
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getType()).isEqualTo(WarningType.NEGATIVE_REVENUE);
        assertThat(warnings.get(0).getRow()).isEqualTo(3);
        assertThat(warnings.get(0).getValue()).isEqualTo("-50");
    }

    @Test
    void treatsBlankRevenueAsZeroWithOneWarning() {
        List<DataQualityWarning> warnings = new ArrayList<>();

        assertThat(normalizer.parseRevenue(1, "Umsatz_2023-06", null, warnings)).isZero();
        assertThat(normalizer.parseRevenue(2, "Umsatz_2023-06", "   ", warnings)).isZero();

        assertThat(warnings).extracting(DataQualityWarning::getType)
                .containsExactly(WarningType.BLANK_REVENUE, WarningType.BLANK_REVENUE);
    }

    @Test
    void parsesGermanFormattedAmountsAndFlagsGarbage() {
        List<DataQualityWarning> warnings = new ArrayList<>();

        assertThat(normalizer.parseRevenue(1, "Umsatz_2023-06", "1.234,50 €", warnings)).isEqualTo(1234.5);
        assertThat(normalizer.parseRevenue(1, "Umsatz_2023-06", "1.234.567", warnings)).isEqualTo(1234567.0);
        assertThat(normalizer.parseRevenue(1, "Umsatz_2023-06", "1.234.567,00", warnings)).isEqualTo(1234567.0);
        assertThat(normalizer.parseRevenue(1, "Umsatz_2023-06", "n/a", warnings)).isZero();

        assertThat(warnings).extracting(DataQualityWarning::getType)
                .containsExactly(WarningType.UNPARSEABLE_REVENUE);
    }

    @Test
    void parsesEnglishGroupedAmounts() {
        List<DataQualityWarning> warnings = new ArrayList<>();

        assertThat(normalizer.parseRevenue(1, "Umsatz_2024-01", "1,234.50", warnings)).isEqualTo(1234.5);
        assertThat(normalizer.parseRevenue(1, "Umsatz_2024-01", "1,234,567", warnings)).isEqualTo(1234567.0);
        assertThat(normalizer.parseRevenue(1, "Umsatz_2024-01", "1234,5", warnings)).isEqualTo(1234.5);

        assertThat(warnings).isEmpty();
    }

    @Test
    void flagsAmountsWithMixedOrMisplacedSeparators() {
        List<DataQualityWarning> warnings = new ArrayList<>();

        assertThat(normalizer.parseRevenue(2, "Umsatz_2024-01", "1,2.3", warnings)).isZero();
        assertThat(normalizer.parseRevenue(2, "Umsatz_2024-01", "12.34,5", warnings)).isZero();
        assertThat(normalizer.parseRevenue(2, "Umsatz_2024-01", "1.234.5", warnings)).isZero();

        assertThat(warnings).hasSize(3)
                .allSatisfy(w -> assertThat(w.getType()).isEqualTo(WarningType.UNPARSEABLE_REVENUE));
    }

    @Test
    void acceptsIntegralNumericAges() {
        assertThat(normalizer.parseAge(1, 34.0)).isEqualTo(34);
        assertThat(normalizer.parseAge(1, 0)).isZero();
        assertThat(normalizer.parseAge(1, " 27 ")).isEqualTo(27);
    }

    @Test
    void rejectsInvalidAgeNamingRowAndColumn() {
        TypeCoercionException error = catchThrowableOfType(() -> normalize(TestSheets.combined()
                        .row("Max Müller", "Köln", "IT", "Entwickler", "nein", 41.0, 1.0, 1.0)
                        .row("Eva Braun", "Bonn", "IT", "Entwickler", "nein", "vierzig", 1.0, 1.0)
                        .build()),
                TypeCoercionException.class);

        assertThat(error.getRow()).isEqualTo(2);
        assertThat(error.getColumn()).isEqualTo("Alter");
        assertThat(error.getValue()).isEqualTo("vierzig");
    }

    @Test
    void reportsSourceRowNumbersAcrossSkippedBlankRows() {
        SheetTable sheet = new SheetTable("input", Arrays.asList(TestSheets.COMBINED_HEADERS), List.of(
                Arrays.asList("Max Müller", "Köln", "IT", "Entwickler", "nein", 41.0, null, 1.0),
                Arrays.asList("Eva Braun", "Bonn", "IT", "Entwickler", "nein", "vierzig", 1.0, 1.0)),
                List.of(1, 4));
        TableSchema schema = validator.validate(sheet);

        TypeCoercionException error = catchThrowableOfType(
                () -> normalizer.normalize(sheet, schema), TypeCoercionException.class);
        assertThat(error.getRow()).isEqualTo(4);

        SheetTable valid = new SheetTable("input", sheet.getHeaders(), List.of(sheet.getRows().get(0)), List.of(6));
        StageResult<List<PersonRecord>> result = normalizer.normalize(valid, schema);
        assertThat(result.getValue().get(0).getSourceRow()).isEqualTo(6);
        assertThat(result.getWarnings()).extracting(DataQualityWarning::getRow).containsExactly(6);
    }

    @Test
    void rejectsNegativeFractionalAndBlankAges() {
        assertThat(catchThrowableOfType(() -> normalizer.parseAge(4, -3.0), TypeCoercionException.class)
                .getMessage()).contains("cannot be negative");
        assertThat(catchThrowableOfType(() -> normalizer.parseAge(4, "34.5"), TypeCoercionException.class)
                .getMessage()).contains("whole number");
        assertThat(catchThrowableOfType(() -> normalizer.parseAge(4, null), TypeCoercionException.class)
                .getMessage()).contains("required");
    }

    @Test
    void matchesPartTimeVocabularyCaseInsensitively() {
        assertThat(normalizer.parsePartTime(1, "JA")).isEqualTo(PartTimeStatus.JA);
        assertThat(normalizer.parsePartTime(1, "True")).isEqualTo(PartTimeStatus.JA);
        assertThat(normalizer.parsePartTime(1, 1.0)).isEqualTo(PartTimeStatus.JA);
        assertThat(normalizer.parsePartTime(1, " Nein ")).isEqualTo(PartTimeStatus.NEIN);
        assertThat(normalizer.parsePartTime(1, false)).isEqualTo(PartTimeStatus.NEIN);
    }

    @Test
    void rejectsUnknownPartTimeValue() {
        TypeCoercionException error = catchThrowableOfType(
                () -> normalizer.parsePartTime(7, "vielleicht"), TypeCoercionException.class);

        assertThat(error.getRow()).isEqualTo(7);
        assertThat(error.getColumn()).isEqualTo("Teilzeit");
    }
}

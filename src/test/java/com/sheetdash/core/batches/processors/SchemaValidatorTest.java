package com.sheetdash.core.batches.processors;

import com.sheetdash.core.DTO.MissingRequirement;
import com.sheetdash.core.Exceptions.SchemaValidationException;
import com.sheetdash.core.TestSheets;
import com.sheetdash.core.enums.ColumnRole;
import com.sheetdash.core.enums.NameMode;
import com.sheetdash.core.models.MonthKey;
import com.sheetdash.core.models.TableSchema;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class SchemaValidatorTest {

    private final SchemaValidator validator = new SchemaValidator();

    @Test
    void resolvesCombinedNameSchema() {
        TableSchema schema = validator.validate(TestSheets.sampleSheet());

        assertThat(schema.getNameMode()).isEqualTo(NameMode.COMBINED);
        assertThat(schema.columnOf(ColumnRole.NAME)).isZero();
        assertThat(schema.columnOf(ColumnRole.AGE)).isEqualTo(5);
        assertThat(schema.getMonthKeys()).containsExactly(new MonthKey(2022, 1), new MonthKey(2023, 6));
        assertThat(schema.getMonthColumns().get(new MonthKey(2022, 1))).isEqualTo(7);
    }

    @Test
    void prefersSeparateNameColumnsWhenBothExist() {
        TableSchema schema = validator.validate(TestSheets.withHeaders(
                " Vorname ", "Nachname", "Name", "Stadt", "Abteilung", "Beruf", "Teilzeit", "Alter", "umsatz_2024-01")
                .build());

        assertThat(schema.getNameMode()).isEqualTo(NameMode.SEPARATE);
        assertThat(schema.columnOf(ColumnRole.FIRST_NAME)).isZero();
        assertThat(schema.getMonthKeys()).containsExactly(new MonthKey(2024, 1));
    }

    @Test
    void listsEveryMissingRequirementAtOnce() {
        SchemaValidationException error = catchThrowableOfType(
                () -> validator.validate(TestSheets.withHeaders("Vorname", "Abteilung", "Beruf", "Teilzeit").build()),
                SchemaValidationException.class);

        assertThat(error.getMissing())
                .extracting(MissingRequirement::getRequirement)
                .containsExactlyInAnyOrder(
                        "Name column(s)",
                        "Column 'Stadt'",
                        "Column 'Alter'",
                        "At least one monthly revenue column");
        assertThat(error.getMissing()).allSatisfy(m -> assertThat(m.getHint()).isNotBlank());
        assertThat(error.getMessage()).startsWith("4 schema problem(s)");
    }

    @Test
    void ignoresColumnsWithInvalidMonth() {
        assertThatThrownBy(() -> validator.validate(TestSheets.withHeaders(
                "Name", "Stadt", "Abteilung", "Beruf", "Teilzeit", "Alter", "Umsatz_2023-13", "Umsatz_23-01").build()))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("At least one monthly revenue column");
    }

    @Test
    void rejectsTwoColumnsForTheSameMonth() {
        SchemaValidationException error = catchThrowableOfType(
                () -> validator.validate(TestSheets.withHeaders(
                        "Name", "Stadt", "Abteilung", "Beruf", "Teilzeit", "Alter", "Umsatz_2023-01", "UMSATZ_2023-01")
                        .build()),
                SchemaValidationException.class);

        assertThat(error.getMissing()).hasSize(1);
        assertThat(error.getMissing().get(0).getRequirement()).isEqualTo("Unique column for month 2023-01");
    }
}

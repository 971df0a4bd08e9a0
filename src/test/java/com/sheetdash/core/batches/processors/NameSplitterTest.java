package com.sheetdash.core.batches.processors;

import com.sheetdash.core.Exceptions.TypeCoercionException;
import com.sheetdash.core.enums.NameMode;
import com.sheetdash.core.models.PersonRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class NameSplitterTest {

    private final NameSplitter splitter = new NameSplitter();

    private static PersonRecord combined(int row, String name) {
        return PersonRecord.builder().sourceRow(row).rawName(name).build();
    }

    @Test
    void splitsAtLastBlank() {
        List<PersonRecord> result = splitter.split(List.of(
                combined(1, "Anna Maria Schmidt"),
                combined(2, "  Max   Müller "),
                combined(3, "Cher")), NameMode.COMBINED);

        assertThat(result).extracting(PersonRecord::getFirstName).containsExactly("Anna Maria", "Max", "");
        assertThat(result).extracting(PersonRecord::getLastName).containsExactly("Schmidt", "Müller", "Cher");
        assertThat(result).extracting(PersonRecord::getRawName).containsOnlyNulls();
    }

    @Test
    void splitsParticleSurnamesLikeAnyOtherName() {
        PersonRecord record = splitter.split(List.of(combined(1, "Jan van der Berg")), NameMode.COMBINED).get(0);

        assertThat(record.getFirstName()).isEqualTo("Jan van der");
        assertThat(record.getLastName()).isEqualTo("Berg");
    }

    @Test
    void cleansSeparateColumns() {
        PersonRecord input = PersonRecord.builder().sourceRow(1).firstName(" Lena ").lastName("Weber  ").build();

        PersonRecord record = splitter.split(List.of(input), NameMode.SEPARATE).get(0);

        assertThat(record.getFirstName()).isEqualTo("Lena");
        assertThat(record.getLastName()).isEqualTo("Weber");
    }

    @Test
    void rejectsBlankNames() {
        TypeCoercionException combinedError = catchThrowableOfType(
                () -> splitter.split(List.of(combined(1, "Max Müller"), combined(2, "   ")), NameMode.COMBINED),
                TypeCoercionException.class);
        assertThat(combinedError.getRow()).isEqualTo(2);
        assertThat(combinedError.getColumn()).isEqualTo("Name");

        PersonRecord noLastName = PersonRecord.builder().sourceRow(5).firstName("Lena").lastName("").build();
        TypeCoercionException separateError = catchThrowableOfType(
                () -> splitter.split(List.of(noLastName), NameMode.SEPARATE), TypeCoercionException.class);
        assertThat(separateError.getColumn()).isEqualTo("Nachname");
    }
}

package com.sheetdash.core.batches.processors;

import com.sheetdash.core.enums.PartTimeStatus;
import com.sheetdash.core.models.EnrichedDataset;
import com.sheetdash.core.models.Fact;
import com.sheetdash.core.models.MonthKey;
import com.sheetdash.core.models.PersonRecord;
import com.sheetdash.core.models.SheetTable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DatasetArrangerTest {

    private static final MonthKey JAN = new MonthKey(2024, 1);
    private static final MonthKey FEB = new MonthKey(2024, 2);

    private final DatasetArranger arranger = new DatasetArranger();
    private final RevenueHarmonizer harmonizer = new RevenueHarmonizer();

    private static PersonRecord person(int row, String first, String last, String department, String profession) {
        return PersonRecord.builder()
                .sourceRow(row)
                .firstName(first)
                .lastName(last)
                .city("Berlin")
                .region("Berlin")
                .department(department)
                .profession(profession)
                .partTime(PartTimeStatus.NEIN)
                .age(30)
                .monthlyRevenue(Map.of(JAN, 100.0 * row, FEB, 10.0 * row))
                .build();
    }

    private EnrichedDataset sample() {
        return harmonizer.harmonize(List.of(
                person(1, "Eva", "Zimmer", "Vertrieb", "Berater"),
                person(2, "Ola", "Özdemir", "IT", "Entwickler"),
                person(3, "Tim", "Adler", "IT", "Entwickler"),
                person(4, "Ida", "Adler", "IT", "Entwickler"),
                person(5, "Ben", "Lang", "IT", "Admin")), List.of(JAN, FEB));
    }

    @Test
    void sortsByDepartmentProfessionAndLastNameKeepingTies() {
        EnrichedDataset arranged = arranger.arrange(sample());

        // Özdemir collates next to O, before Z
        assertThat(arranged.getRecords()).extracting(PersonRecord::getSourceRow).containsExactly(5, 3, 4, 2, 1);
    }

    @Test
    void sortsFactsByDepartmentLastNameMonth() {
        EnrichedDataset arranged = arranger.arrange(sample());

        assertThat(arranged.getFacts()).extracting(Fact::getSourceRow)
                .containsExactly(3, 4, 3, 4, 5, 5, 2, 2, 1, 1);
        assertThat(arranged.getFacts().subList(0, 4)).extracting(Fact::getMonth).containsExactly(JAN, JAN, FEB, FEB);
    }

    @Test
    void rendersWideSheet() {
        SheetTable wide = arranger.wideView(arranger.arrange(sample()));

        assertThat(wide.getName()).isEqualTo("data");
        assertThat(wide.getHeaders()).containsExactly(
                "Vorname", "Nachname", "Stadt", "Bundesland", "Abteilung", "Beruf", "Teilzeit", "Alter",
                "Umsatz_2024-01", "Umsatz_2024-02", "Umsatz_Gesamt", "Umsatz_Ø_Monat");
        assertThat(wide.getRows().get(0)).containsExactly(
                "Ben", "Lang", "Berlin", "Berlin", "IT", "Admin", "Nein", 30, 500.0, 50.0, 550.0, 275.0);
    }

    @Test
    void rendersLongSheet() {
        SheetTable facts = arranger.longView(arranger.arrange(sample()));

        assertThat(facts.getName()).isEqualTo("facts_long");
        assertThat(facts.getRowCount()).isEqualTo(10);
        assertThat(facts.getHeaders()).endsWith("Datum", "Umsatz");
        assertThat(facts.getRows().get(0)).endsWith("2024-01", 300.0);
    }
}

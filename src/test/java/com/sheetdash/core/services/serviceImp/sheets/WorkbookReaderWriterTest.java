package com.sheetdash.core.services.serviceImp.sheets;

import com.sheetdash.core.TestSheets;
import com.sheetdash.core.config.PipelineProperties;
import com.sheetdash.core.models.SheetTable;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkbookReaderWriterTest {

    private final WorkbookReader reader = new WorkbookReader(TestSheets.pipelineProperties());
    private final WorkbookWriter writer = new WorkbookWriter();

    @Test
    void readsFirstSheetWithTypedCells() throws IOException {
        byte[] bytes;
        try (XSSFWorkbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet("Mitarbeiter");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue(" Name ");
            header.createCell(1).setCellValue("Alter");
            header.createCell(2).setCellValue("Umsatz_2024-01");
            header.createCell(3).setCellValue("Teilzeit");

            Row first = sheet.createRow(1);
            first.createCell(0).setCellValue("Max Müller");
            first.createCell(1).setCellValue(41);
            first.createCell(2).setCellFormula("1000+234.5");
            first.createCell(3).setCellValue(true);

            // row 2 left empty
            Row third = sheet.createRow(3);
            third.createCell(0).setCellValue("Eva Braun");
            third.createCell(2).setCellValue("  ");

            workbook.createSheet("ignored").createRow(0).createCell(0).setCellValue("x");
            workbook.write(out);
            bytes = out.toByteArray();
        }

        SheetTable table = reader.read(new ByteArrayInputStream(bytes), "test.xlsx");

        assertThat(table.getName()).isEqualTo("Mitarbeiter");
        assertThat(table.getHeaders()).containsExactly("Name", "Alter", "Umsatz_2024-01", "Teilzeit");
        assertThat(table.getRowCount()).isEqualTo(2);
        assertThat(table.getRowNumbers()).containsExactly(1, 3);
        assertThat(table.getRows().get(0)).containsExactly("Max Müller", 41.0, 1234.5, true);
        assertThat(table.getRows().get(1)).containsExactly("Eva Braun", null, null, null);
    }

    @Test
    void writesOneSheetPerTable() throws IOException {
        SheetTable data = TestSheets.withHeaders("Nachname", "Alter").row("Weber", 29).row("Braun", null).build();
        SheetTable facts = new SheetTable("facts_long", List.of("Datum"), List.of(List.of("2024-01")));

        byte[] bytes = writer.write(List.of(data, facts));

        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            assertThat(workbook.getNumberOfSheets()).isEqualTo(2);
            assertThat(workbook.getSheetAt(0).getSheetName()).isEqualTo("input");
            assertThat(workbook.getSheetAt(1).getSheetName()).isEqualTo("facts_long");
            assertThat(workbook.getSheetAt(0).getPaneInformation().isFreezePane()).isTrue();
        }
        SheetTable reread = reader.read(new ByteArrayInputStream(bytes), "out.xlsx");
        assertThat(reread.getHeaders()).containsExactly("Nachname", "Alter");
        assertThat(reread.getRows()).containsExactly(List.of("Weber", 29.0), Arrays.asList("Braun", null));
    }

    @Test
    void rejectsUploadsThatAreNotXlsx() {
        MockMultipartFile empty = new MockMultipartFile("file", "data.xlsx", null, new byte[0]);
        MockMultipartFile csv = new MockMultipartFile("file", "data.csv", "text/csv",
                "Name;Alter".getBytes(StandardCharsets.UTF_8));
        MockMultipartFile garbage = new MockMultipartFile("file", "data.xlsx", null,
                "not a workbook".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> reader.read(empty)).isInstanceOf(IOException.class).hasMessage("No file provided.");
        assertThatThrownBy(() -> reader.read(csv)).isInstanceOf(IOException.class).hasMessageContaining(".xlsx");
        assertThatThrownBy(() -> reader.read(garbage)).isInstanceOf(IOException.class);
    }

    @Test
    void rejectsOversizedUpload() {
        PipelineProperties properties = TestSheets.pipelineProperties();
        properties.setMaxUploadBytes(4);
        WorkbookReader strict = new WorkbookReader(properties);
        MockMultipartFile file = new MockMultipartFile("file", "data.xlsx", null, new byte[16]);

        assertThatThrownBy(() -> strict.read(file)).isInstanceOf(IOException.class).hasMessageContaining("too large");
    }
}

package com.sheetdash.core.services.serviceImp.sheets;

import com.sheetdash.core.models.SheetTable;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Writes sheet tables into a new .xlsx workbook, one sheet per table, header row frozen.
 */
@Slf4j
@Component
public class WorkbookWriter {

    public byte[] write(List<SheetTable> tables) throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {

            CellStyle headerStyle = workbook.createCellStyle();
            Font bold = workbook.createFont();
            bold.setBold(true);
            headerStyle.setFont(bold);

            for (SheetTable table : tables) {
                Sheet sheet = workbook.createSheet(table.getName());
                Row header = sheet.createRow(0);
                for (int c = 0; c < table.getHeaders().size(); c++) {
                    Cell cell = header.createCell(c);
                    cell.setCellValue(table.getHeaders().get(c));
                    cell.setCellStyle(headerStyle);
                }
                for (int r = 0; r < table.getRowCount(); r++) {
                    Row row = sheet.createRow(r + 1);
                    List<Object> values = table.getRows().get(r);
                    for (int c = 0; c < values.size(); c++) {
                        setValue(row.createCell(c), values.get(c));
                    }
                }
                sheet.createFreezePane(0, 1);
                log.info("📝 Wrote sheet '{}' with {} row(s)", table.getName(), table.getRowCount());
            }

            workbook.write(out);
            return out.toByteArray();
        }
    }

    private void setValue(Cell cell, Object value) {
        if (value == null) {
            cell.setBlank();
        } else if (value instanceof Number) {
            cell.setCellValue(((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
            cell.setCellValue((Boolean) value);
        } else {
            cell.setCellValue(value.toString());
        }
    }
}

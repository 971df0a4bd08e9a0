package com.sheetdash.core.services.serviceImp.sheets;

import com.sheetdash.core.config.PipelineProperties;
import com.sheetdash.core.models.SheetTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellValue;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads the first sheet of an .xlsx workbook into a {@link SheetTable}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkbookReader {

    private final PipelineProperties properties;

    public SheetTable read(MultipartFile file) throws IOException {
        validateUpload(file);
        try (InputStream in = file.getInputStream()) {
            return read(in, file.getOriginalFilename());
        }
    }

    public SheetTable read(InputStream in, String sourceName) throws IOException {
        try (Workbook workbook = open(in, sourceName)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new IOException("Workbook " + sourceName + " contains no sheet");
            }
            Sheet sheet = workbook.getSheetAt(0);
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            DataFormatter formatter = new DataFormatter();

            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                throw new IOException("No header row found in sheet '" + sheet.getSheetName() + "'");
            }

            int width = Math.max(headerRow.getLastCellNum(), 0);
            List<String> headers = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                Cell cell = headerRow.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
                headers.add(cell == null ? "" : formatter.formatCellValue(cell, evaluator).trim());
            }

            List<List<Object>> rows = new ArrayList<>();
            List<Integer> rowNumbers = new ArrayList<>();
            for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                List<Object> values = new ArrayList<>(width);
                boolean empty = true;
                for (int c = 0; c < width; c++) {
                    Object value = row == null ? null : cellValue(row.getCell(c), evaluator);
                    empty &= value == null;
                    values.add(value);
                }
                if (!empty) {
                    rows.add(values);
                    rowNumbers.add(r - headerRow.getRowNum());
                }
            }

            log.info("📄 Read {} data row(s) and {} column(s) from '{}' ({})",
                    rows.size(), headers.size(), sheet.getSheetName(), sourceName);
            return new SheetTable(sheet.getSheetName(), headers, rows, rowNumbers);
        }
    }

    private Workbook open(InputStream in, String sourceName) throws IOException {
        try {
            return new XSSFWorkbook(in);
        } catch (POIXMLException | IllegalArgumentException e) {
            // not a zip / OOXML package
            throw new IOException("File " + sourceName + " is not a readable .xlsx workbook", e);
        }
    }

    private Object cellValue(Cell cell, FormulaEvaluator evaluator) {
        if (cell == null) {
            return null;
        }
        CellValue value = evaluator.evaluate(cell);
        if (value == null) {
            return null;
        }
        switch (value.getCellType()) {
            case NUMERIC:
                return value.getNumberValue();
            case STRING:
                String text = value.getStringValue();
                return text == null || text.trim().isEmpty() ? null : text;
            case BOOLEAN:
                return value.getBooleanValue();
            case ERROR:
                log.debug("Formula error in cell {}", cell.getAddress());
                return null;
            default:
                return null;
        }
    }

    private void validateUpload(MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new IOException("No file provided.");
        }
        if (file.getSize() > properties.getMaxUploadBytes()) {
            throw new IOException(String.format("File is too large: %d bytes (limit %d)",
                    file.getSize(), properties.getMaxUploadBytes()));
        }
        String filename = file.getOriginalFilename();
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".xlsx")) {
            throw new IOException("Unsupported file type: " + filename + ". Only .xlsx workbooks are accepted.");
        }
        log.info("✅ Upload OK: {} ({} bytes)", filename, file.getSize());
    }
}

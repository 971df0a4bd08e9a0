package com.sheetdash.core.models;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One sheet of a workbook: a header row and the data rows below it.
 * Cells hold {@code String}, {@code Double}, {@code Integer}, {@code Boolean} or {@code null} for blanks.
 */
@Value
public class SheetTable {

    String name;
    List<String> headers;
    List<List<Object>> rows;
    /** 1-based position of each row below the header in the source sheet; skipped blank rows leave gaps. */
    List<Integer> rowNumbers;

    public SheetTable(String name, List<String> headers, List<List<Object>> rows) {
        this(name, headers, rows, consecutive(rows.size()));
    }

    public SheetTable(String name, List<String> headers, List<List<Object>> rows, List<Integer> rowNumbers) {
        if (rowNumbers.size() != rows.size()) {
            throw new IllegalArgumentException(
                    "Expected one row number per row: " + rowNumbers.size() + " for " + rows.size() + " row(s)");
        }
        this.name = name;
        this.rowNumbers = List.copyOf(rowNumbers);
        this.headers = List.copyOf(headers);
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            // rows may carry nulls, List.copyOf would reject them
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public int getRowCount() {
        return rows.size();
    }

    public int rowNumber(int rowIndex) {
        return rowNumbers.get(rowIndex);
    }

    private static List<Integer> consecutive(int count) {
        List<Integer> numbers = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            numbers.add(i);
        }
        return numbers;
    }

    /**
     * Cell at the given position, {@code null} for short rows.
     */
    public Object cell(int rowIndex, int columnIndex) {
        List<Object> row = rows.get(rowIndex);
        return columnIndex < row.size() ? row.get(columnIndex) : null;
    }
}

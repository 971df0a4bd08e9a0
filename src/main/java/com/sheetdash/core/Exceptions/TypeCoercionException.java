package com.sheetdash.core.Exceptions;

/**
 * Thrown when a strictly typed cell (age, part-time flag, last name) cannot be coerced.
 */
public class TypeCoercionException extends SheetDashException {

    private final int row;
    private final String column;
    private final String value;

    /**
     * @param row    1-based data row, header excluded
     * @param column header of the offending column
     * @param value  raw cell text
     * @param reason what was expected
     */
    public TypeCoercionException(int row, String column, String value, String reason) {
        super(String.format("Row %d, column '%s': invalid value '%s' - %s", row, column, value, reason));
        this.row = row;
        this.column = column;
        this.value = value;
    }

    public int getRow() {
        return row;
    }

    public String getColumn() {
        return column;
    }

    public String getValue() {
        return value;
    }
}

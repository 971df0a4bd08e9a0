package com.sheetdash.core.models;

/**
 * Headers of the derived columns written to the sanitized workbook.
 */
public final class SheetColumns {

    public static final String REGION = "Bundesland";
    public static final String TOTAL_REVENUE = "Umsatz_Gesamt";
    public static final String AVERAGE_MONTHLY_REVENUE = "Umsatz_Ø_Monat";
    public static final String FACT_MONTH = "Datum";
    public static final String FACT_REVENUE = "Umsatz";

    public static final String WIDE_SHEET = "data";
    public static final String LONG_SHEET = "facts_long";

    private SheetColumns() {
    }
}

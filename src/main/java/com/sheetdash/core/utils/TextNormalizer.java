package com.sheetdash.core.utils;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Helpers to clean free-text cells coming out of spreadsheets.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private TextNormalizer() {
    }

    /**
     * Trims and collapses internal whitespace runs (tabs, non-breaking spaces included) to one space.
     */
    public static String collapseWhitespace(String input) {
        if (input == null) {
            return "";
        }
        String spaced = input.replace('\u00A0', ' ');
        return WHITESPACE_RUN.matcher(spaced.trim()).replaceAll(" ");
    }

    /**
     * Lookup key for city names: collapsed, lower-cased, diacritics removed.
     * "  München " and "munchen" share the key "munchen"; "ß" becomes "ss".
     */
    public static String foldKey(String input) {
        String collapsed = collapseWhitespace(input).toLowerCase(Locale.ROOT).replace("ß", "ss");
        String decomposed = Normalizer.normalize(collapsed, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }

    /**
     * Text form of a cell value; integral doubles lose their ".0" so numeric cells read like typed text.
     */
    public static String cellText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double) {
            double d = (Double) value;
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return String.valueOf((long) d);
            }
        }
        return value.toString();
    }
}

package com.sheetdash.core.Exceptions;

/**
 * Base class of the errors raised by sanitization and aggregation. A sanitization run
 * that throws one writes no output.
 */
public class SheetDashException extends RuntimeException {

    public SheetDashException(String message) {
        super(message);
    }
}

package com.sheetdash.core.Exceptions;

/**
 * Rejected filter input, e.g. a month range whose start lies after its end.
 * An empty filtered set is not an error and never raises this.
 */
public class AnalyticsException extends SheetDashException {

    public AnalyticsException(String message) {
        super(message);
    }
}

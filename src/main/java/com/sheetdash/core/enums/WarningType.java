package com.sheetdash.core.enums;

public enum WarningType {
    UNKNOWN_CITY,
    NEGATIVE_REVENUE,
    BLANK_REVENUE,
    UNPARSEABLE_REVENUE
}

package com.sheetdash.core.enums;

public enum PartTimeFilter {
    YES,
    NO,
    BOTH;

    public boolean accepts(PartTimeStatus status) {
        switch (this) {
            case YES:
                return status == PartTimeStatus.JA;
            case NO:
                return status == PartTimeStatus.NEIN;
            default:
                return true;
        }
    }
}

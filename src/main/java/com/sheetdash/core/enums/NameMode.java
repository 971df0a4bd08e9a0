package com.sheetdash.core.enums;

public enum NameMode {
    COMBINED,   // single "Name" column, split into first/last
    SEPARATE    // "Vorname" and "Nachname" already present
}

package com.sheetdash.core.models;

import lombok.Value;

import java.util.List;

/**
 * Person records plus the chronologically sorted month keys found across them.
 */
@Value
public class WideDataset {

    List<PersonRecord> records;
    List<MonthKey> monthKeys;

    public WideDataset(List<PersonRecord> records, List<MonthKey> monthKeys) {
        for (int i = 1; i < monthKeys.size(); i++) {
            if (monthKeys.get(i - 1).compareTo(monthKeys.get(i)) >= 0) {
                throw new IllegalArgumentException("Month keys must be strictly increasing: " + monthKeys);
            }
        }
        this.records = List.copyOf(records);
        this.monthKeys = List.copyOf(monthKeys);
    }
}

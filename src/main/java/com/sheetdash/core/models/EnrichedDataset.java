package com.sheetdash.core.models;

import lombok.Value;

import java.util.List;

@Value
public class EnrichedDataset {

    WideDataset wide;
    List<Fact> facts;

    public EnrichedDataset(WideDataset wide, List<Fact> facts) {
        this.wide = wide;
        this.facts = List.copyOf(facts);
    }

    public List<PersonRecord> getRecords() {
        return wide.getRecords();
    }

    public List<MonthKey> getMonthKeys() {
        return wide.getMonthKeys();
    }
}

package com.sheetdash.core.models;

import com.sheetdash.core.enums.PartTimeStatus;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One person row. Pipeline stages fill it progressively: name fields after splitting,
 * region after resolution, totals after harmonization.
 */
@Value
@Builder(toBuilder = true)
public class PersonRecord {

    /** 1-based position of the row in the input sheet, below the header. */
    int sourceRow;

    String rawName;
    String firstName;
    String lastName;
    String city;
    String region;
    String department;
    String profession;
    PartTimeStatus partTime;
    int age;

    /** Revenue per discovered month in chronological order, missing months as zero. */
    Map<MonthKey, Double> monthlyRevenue;

    double totalRevenue;
    double averageMonthlyRevenue;

    public static class PersonRecordBuilder {
        public PersonRecordBuilder monthlyRevenue(Map<MonthKey, Double> monthlyRevenue) {
            this.monthlyRevenue = monthlyRevenue == null
                    ? Collections.emptyMap()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(monthlyRevenue));
            return this;
        }
    }

    public double revenueFor(MonthKey month) {
        Double value = monthlyRevenue == null ? null : monthlyRevenue.get(month);
        return value == null ? 0.0 : value;
    }

    public boolean isPartTime() {
        return partTime == PartTimeStatus.JA;
    }
}

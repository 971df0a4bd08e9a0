package com.sheetdash.core.models;

import com.sheetdash.core.enums.PartTimeStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Long-format observation: one person's revenue in one month, identity fields copied along
 * so facts can be filtered without going back to the wide dataset.
 */
@Value
@Builder
public class Fact {

    int sourceRow;
    String firstName;
    String lastName;
    String city;
    String region;
    String department;
    String profession;
    PartTimeStatus partTime;
    int age;
    MonthKey month;
    double revenue;

    public static Fact of(PersonRecord record, MonthKey month) {
        return Fact.builder()
                .sourceRow(record.getSourceRow())
                .firstName(record.getFirstName())
                .lastName(record.getLastName())
                .city(record.getCity())
                .region(record.getRegion())
                .department(record.getDepartment())
                .profession(record.getProfession())
                .partTime(record.getPartTime())
                .age(record.getAge())
                .month(month)
                .revenue(record.revenueFor(month))
                .build();
    }
}

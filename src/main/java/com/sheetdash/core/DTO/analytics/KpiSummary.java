package com.sheetdash.core.DTO.analytics;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class KpiSummary {
    int headcount;
    int totalHeadcount;          // unfiltered dataset size
    int activeMonthCount;
    double totalRevenue;         // over the active month range
    double averageRevenuePerPerson;
    double averageMonthlyRevenuePerPerson;
    String topDepartment;        // null when nothing matches
    double topDepartmentRevenue;
    double topDepartmentShare;   // 0..1 of totalRevenue
    double averageAge;
    double medianAge;
}

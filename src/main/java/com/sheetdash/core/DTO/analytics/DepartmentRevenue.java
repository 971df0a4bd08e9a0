package com.sheetdash.core.DTO.analytics;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DepartmentRevenue {
    String department;
    double revenue;
    int headcount;
    double share;
}

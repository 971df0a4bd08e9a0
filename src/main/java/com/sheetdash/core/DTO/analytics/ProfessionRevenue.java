package com.sheetdash.core.DTO.analytics;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProfessionRevenue {
    String profession;
    double revenue;
    int headcount;
    double averageRevenue;
}

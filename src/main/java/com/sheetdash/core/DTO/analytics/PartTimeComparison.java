package com.sheetdash.core.DTO.analytics;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PartTimeComparison {
    int partTimeCount;
    int fullTimeCount;
    double partTimeRatio;
    double averagePartTimeRevenue;
    double averageFullTimeRevenue;
}

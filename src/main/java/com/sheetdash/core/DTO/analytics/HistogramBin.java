package com.sheetdash.core.DTO.analytics;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HistogramBin {
    double lowerBound;
    double upperBound;
    int count;
}

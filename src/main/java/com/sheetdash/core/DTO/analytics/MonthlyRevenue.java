package com.sheetdash.core.DTO.analytics;

import com.sheetdash.core.models.MonthKey;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One point of the stacked revenue time series.
 */
@Value
@Builder
public class MonthlyRevenue {
    MonthKey month;
    double total;
    /** Department to revenue, departments in alphabetical order. */
    Map<String, Double> byDepartment;
}

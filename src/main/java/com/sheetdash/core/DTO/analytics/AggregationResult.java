package com.sheetdash.core.DTO.analytics;

import com.sheetdash.core.DTO.FilterSpecification;
import com.sheetdash.core.models.MonthKey;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything the dashboard renders for one filter application.
 */
@Value
@Builder
public class AggregationResult {
    FilterSpecification appliedFilter;
    List<MonthKey> activeMonths;
    KpiSummary kpis;
    PartTimeComparison partTime;
    List<DepartmentRevenue> revenueByDepartment;
    List<MonthlyRevenue> timeSeries;
    List<ProfessionRevenue> topProfessions;
    List<HistogramBin> revenueDistribution;
    HeatmapMatrix heatmap;
    FilterOptions filterOptions;

    public boolean isEmpty() {
        return kpis == null || kpis.getHeadcount() == 0;
    }
}

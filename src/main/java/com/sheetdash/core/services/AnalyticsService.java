package com.sheetdash.core.services;

import com.sheetdash.core.DTO.FilterSpecification;
import com.sheetdash.core.DTO.analytics.AggregationResult;
import com.sheetdash.core.models.EnrichedDataset;

public interface AnalyticsService {
    AggregationResult aggregate(EnrichedDataset dataset, FilterSpecification filter);
    FilterSpecification defaultFilter(EnrichedDataset dataset);
}

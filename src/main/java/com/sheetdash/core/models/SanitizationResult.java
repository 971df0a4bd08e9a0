package com.sheetdash.core.models;

import com.sheetdash.core.DTO.ProcessSummary;
import lombok.Value;

@Value
public class SanitizationResult {
    EnrichedDataset dataset;
    DiagnosticsReport diagnostics;
    ProcessSummary summary;
}

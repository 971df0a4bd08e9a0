package com.sheetdash.core.models;

import com.sheetdash.core.enums.WarningType;
import lombok.Builder;
import lombok.Value;

/**
 * Non-fatal data issue. Processing continues with the fallback value.
 */
@Value
@Builder
public class DataQualityWarning {
    WarningType type;
    int row;
    String column;
    String value;
}

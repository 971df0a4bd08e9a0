package com.sheetdash.core.models;

import lombok.Value;

import java.util.List;

/**
 * Output of a pipeline stage together with the warnings it raised.
 */
@Value
public class StageResult<T> {

    T value;
    List<DataQualityWarning> warnings;

    public StageResult(T value, List<DataQualityWarning> warnings) {
        this.value = value;
        this.warnings = List.copyOf(warnings);
    }
}

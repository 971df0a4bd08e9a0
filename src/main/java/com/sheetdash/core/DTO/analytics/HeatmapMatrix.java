package com.sheetdash.core.DTO.analytics;

import com.sheetdash.core.models.MonthKey;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Department x month revenue matrix. {@code values.get(d).get(m)} is the revenue of
 * {@code departments.get(d)} in {@code months.get(m)}.
 */
@Value
@Builder
public class HeatmapMatrix {

    public static final HeatmapMatrix EMPTY = HeatmapMatrix.builder()
            .departments(List.of())
            .months(List.of())
            .values(List.of())
            .maxValue(0.0)
            .build();

    List<String> departments;
    List<MonthKey> months;
    List<List<Double>> values;
    double maxValue;
}

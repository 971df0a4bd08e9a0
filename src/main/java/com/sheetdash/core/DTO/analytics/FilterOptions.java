package com.sheetdash.core.DTO.analytics;

import com.sheetdash.core.models.MonthKey;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Selectable values of the whole dataset, for populating filter controls.
 */
@Value
@Builder
public class FilterOptions {
    List<String> departments;
    List<String> regions;
    List<String> cities;
    List<String> professions;
    List<MonthKey> months;
    int minAge;
    int maxAge;
}

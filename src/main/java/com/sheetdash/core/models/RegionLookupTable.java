package com.sheetdash.core.models;

import com.sheetdash.core.utils.TextNormalizer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable city to region (Bundesland / Land / Kanton) table. Keys are folded with
 * {@link TextNormalizer#foldKey(String)}, so spelling variants differing only in case,
 * accents or spacing resolve alike. The first entry wins when two cities fold to the same key.
 */
public final class RegionLookupTable {

    private final Map<String, String> regionsByCity;

    private RegionLookupTable(Map<String, String> regionsByCity) {
        this.regionsByCity = Collections.unmodifiableMap(regionsByCity);
    }

    public static RegionLookupTable of(Map<String, String> cityToRegion) {
        Map<String, String> folded = new LinkedHashMap<>();
        cityToRegion.forEach((city, region) -> folded.putIfAbsent(TextNormalizer.foldKey(city), region));
        return new RegionLookupTable(folded);
    }

    public Optional<String> regionOf(String city) {
        return Optional.ofNullable(regionsByCity.get(TextNormalizer.foldKey(city)));
    }

    public int size() {
        return regionsByCity.size();
    }
}

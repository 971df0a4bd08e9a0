package com.sheetdash.core.batches.processors;

import com.sheetdash.core.config.PipelineProperties;
import com.sheetdash.core.enums.ColumnRole;
import com.sheetdash.core.enums.WarningType;
import com.sheetdash.core.models.DataQualityWarning;
import com.sheetdash.core.models.PersonRecord;
import com.sheetdash.core.models.RegionLookupTable;
import com.sheetdash.core.models.StageResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns each record the region of its city. Unknown cities get the fallback region
 * and one {@link WarningType#UNKNOWN_CITY} warning per record.
 */
@Slf4j
@Component
public class RegionResolver {

    private final RegionLookupTable regionTable;
    private final String unknownRegion;

    @Autowired
    public RegionResolver(RegionLookupTable regionTable, PipelineProperties properties) {
        this(regionTable, properties.getUnknownRegion());
    }

    public RegionResolver(RegionLookupTable regionTable, String unknownRegion) {
        this.regionTable = regionTable;
        this.unknownRegion = unknownRegion;
    }

    public StageResult<List<PersonRecord>> resolve(List<PersonRecord> records) {
        List<PersonRecord> resolved = new ArrayList<>(records.size());
        List<DataQualityWarning> warnings = new ArrayList<>();

        for (PersonRecord record : records) {
            String region = regionTable.regionOf(record.getCity()).orElse(null);
            if (region == null) {
                region = unknownRegion;
                warnings.add(DataQualityWarning.builder()
                        .type(WarningType.UNKNOWN_CITY)
                        .row(record.getSourceRow())
                        .column(ColumnRole.CITY.getHeader())
                        .value(record.getCity())
                        .build());
                log.debug("Row {}: unknown city '{}' -> {}", record.getSourceRow(), record.getCity(), unknownRegion);
            }
            resolved.add(record.toBuilder().region(region).build());
        }

        log.info("🗺️ Regions resolved for {} record(s), {} unknown city value(s)", resolved.size(), warnings.size());
        return new StageResult<>(resolved, warnings);
    }
}

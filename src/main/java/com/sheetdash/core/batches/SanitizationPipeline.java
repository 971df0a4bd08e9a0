package com.sheetdash.core.batches;

import com.sheetdash.core.DTO.FilterSpecification;
import com.sheetdash.core.DTO.ProcessSummary;
import com.sheetdash.core.Exceptions.SheetDashException;
import com.sheetdash.core.batches.processors.DatasetArranger;
import com.sheetdash.core.batches.processors.NameSplitter;
import com.sheetdash.core.batches.processors.RegionResolver;
import com.sheetdash.core.batches.processors.RevenueHarmonizer;
import com.sheetdash.core.batches.processors.SchemaValidator;
import com.sheetdash.core.batches.processors.TypeNormalizer;
import com.sheetdash.core.config.AnalyticsProperties;
import com.sheetdash.core.config.PipelineProperties;
import com.sheetdash.core.models.DiagnosticsReport;
import com.sheetdash.core.models.EnrichedDataset;
import com.sheetdash.core.models.MonthKey;
import com.sheetdash.core.models.PersonRecord;
import com.sheetdash.core.models.SanitizationResult;
import com.sheetdash.core.models.SheetTable;
import com.sheetdash.core.models.StageResult;
import com.sheetdash.core.models.TableSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs validate, normalize, split, resolve, harmonize and arrange over one input sheet.
 * Each stage returns a new value; a fatal error in any stage aborts the whole run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SanitizationPipeline {

    private final SchemaValidator schemaValidator;
    private final TypeNormalizer typeNormalizer;
    private final NameSplitter nameSplitter;
    private final RegionResolver regionResolver;
    private final RevenueHarmonizer revenueHarmonizer;
    private final DatasetArranger datasetArranger;
    private final PipelineProperties pipelineProperties;
    private final AnalyticsProperties analyticsProperties;

    public SanitizationResult run(SheetTable input) {
        log.info("⭐️ Starting sanitization of sheet '{}' with {} row(s)", input.getName(), input.getRowCount());
        try {
            TableSchema schema = schemaValidator.validate(input);

            StageResult<List<PersonRecord>> normalized = typeNormalizer.normalize(input, schema);
            List<PersonRecord> named = nameSplitter.split(normalized.getValue(), schema.getNameMode());
            StageResult<List<PersonRecord>> resolved = regionResolver.resolve(named);
            EnrichedDataset harmonized = revenueHarmonizer.harmonize(resolved.getValue(), schema.getMonthKeys());
            EnrichedDataset arranged = datasetArranger.arrange(harmonized);

            DiagnosticsReport diagnostics = DiagnosticsReport.merge(
                    List.of(normalized.getWarnings(), resolved.getWarnings()));
            ProcessSummary summary = summarize(arranged, diagnostics);

            if (diagnostics.getWarningCount() > 0) {
                log.warn("⚠️ {} data quality warning(s): {}", diagnostics.getWarningCount(), diagnostics.getCountsByType());
            }
            log.info("✅ Sanitization completed\n{}", summary.toDisplayText());
            return new SanitizationResult(arranged, diagnostics, summary);
        } catch (SheetDashException e) {
            log.error("❌ Sanitization aborted, no output written: {}", e.getMessage());
            throw e;
        }
    }

    ProcessSummary summarize(EnrichedDataset dataset, DiagnosticsReport diagnostics) {
        List<MonthKey> months = dataset.getMonthKeys();
        return ProcessSummary.builder()
                .recordCount(dataset.getRecords().size())
                .monthCount(months.size())
                .firstMonth(months.isEmpty() ? null : months.get(0))
                .lastMonth(months.isEmpty() ? null : months.get(months.size() - 1))
                .warningCount(diagnostics.getWarningCount())
                .warningsByType(diagnostics.getCountsByType())
                .unknownCities(diagnostics.unknownCities(pipelineProperties.getUnknownCitySampleSize()))
                .defaultFilter(FilterSpecification.defaultFor(months, analyticsProperties.getDefaultMonthWindow()))
                .build();
    }
}

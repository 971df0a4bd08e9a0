package com.sheetdash.core.services.serviceImp;

import com.sheetdash.core.DTO.FilterSpecification;
import com.sheetdash.core.DTO.ProcessSummary;
import com.sheetdash.core.DTO.analytics.AggregationResult;
import com.sheetdash.core.batches.SanitizationPipeline;
import com.sheetdash.core.batches.processors.DatasetArranger;
import com.sheetdash.core.models.SanitizationResult;
import com.sheetdash.core.models.SheetTable;
import com.sheetdash.core.services.AnalyticsService;
import com.sheetdash.core.services.DashboardService;
import com.sheetdash.core.services.serviceImp.sheets.WorkbookReader;
import com.sheetdash.core.services.serviceImp.sheets.WorkbookWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class DashboardServiceImpl implements DashboardService {

    private final WorkbookReader workbookReader;
    private final WorkbookWriter workbookWriter;
    private final SanitizationPipeline sanitizationPipeline;
    private final DatasetArranger datasetArranger;
    private final AnalyticsService analyticsService;

    @Override
    public SanitizationResult sanitize(MultipartFile file) throws IOException {
        SheetTable input = workbookReader.read(file);
        return sanitizationPipeline.run(input);
    }

    @Override
    public byte[] exportWorkbook(SanitizationResult result) throws IOException {
        SheetTable wide = datasetArranger.wideView(result.getDataset());
        SheetTable facts = datasetArranger.longView(result.getDataset());
        return workbookWriter.write(List.of(wide, facts));
    }

    @Override
    public ProcessSummary summarize(MultipartFile file) throws IOException {
        return sanitize(file).getSummary();
    }

    @Override
    public AggregationResult analyze(MultipartFile file, FilterSpecification filter) throws IOException {
        SanitizationResult result = sanitize(file);
        if (filter == null) {
            log.info("No filter supplied, applying default filter {}", result.getSummary().getDefaultFilter());
        }
        return analyticsService.aggregate(result.getDataset(), filter);
    }
}

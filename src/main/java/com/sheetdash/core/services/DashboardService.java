package com.sheetdash.core.services;

import com.sheetdash.core.DTO.FilterSpecification;
import com.sheetdash.core.DTO.ProcessSummary;
import com.sheetdash.core.DTO.analytics.AggregationResult;
import com.sheetdash.core.models.SanitizationResult;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * One batch run per call: read the uploaded workbook, sanitize it, then export or aggregate.
 */
public interface DashboardService {
    SanitizationResult sanitize(MultipartFile file) throws IOException;
    byte[] exportWorkbook(SanitizationResult result) throws IOException;
    ProcessSummary summarize(MultipartFile file) throws IOException;
    AggregationResult analyze(MultipartFile file, FilterSpecification filter) throws IOException;
}

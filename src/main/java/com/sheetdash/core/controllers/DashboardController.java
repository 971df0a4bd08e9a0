package com.sheetdash.core.controllers;

import com.sheetdash.core.DTO.FilterSpecification;
import com.sheetdash.core.DTO.ProcessSummary;
import com.sheetdash.core.DTO.analytics.AggregationResult;
import com.sheetdash.core.models.SanitizationResult;
import com.sheetdash.core.services.DashboardService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/api/dashboard")
@RequiredArgsConstructor
@Slf4j
public class DashboardController {

    static final String XLSX_MEDIA_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
    static final String WARNING_COUNT_HEADER = "X-Warning-Count";

    private final DashboardService dashboardService;

    @PostMapping(value = "/sanitize", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> sanitize(@RequestPart("file") MultipartFile file) throws IOException {
        log.info("Sanitization requested for {}", file.getOriginalFilename());

        SanitizationResult result = dashboardService.sanitize(file);
        byte[] workbook = dashboardService.exportWorkbook(result);

        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(XLSX_MEDIA_TYPE))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"sanitized-data.xlsx\"")
                .header(WARNING_COUNT_HEADER, String.valueOf(result.getDiagnostics().getWarningCount()))
                .body(workbook);
    }

    @PostMapping(value = "/summary", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ProcessSummary> summary(@RequestPart("file") MultipartFile file) throws IOException {
        log.info("Process summary requested for {}", file.getOriginalFilename());
        return ResponseEntity.ok(dashboardService.summarize(file));
    }

    @PostMapping(value = "/analytics", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<AggregationResult> analytics(
            @RequestPart("file") MultipartFile file,
            @RequestPart(value = "filter", required = false) FilterSpecification filter) throws IOException {

        log.info("Dashboard analytics requested for {} with filter {}", file.getOriginalFilename(), filter);
        return ResponseEntity.ok(dashboardService.analyze(file, filter));
    }
}

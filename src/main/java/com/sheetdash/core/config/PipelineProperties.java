package com.sheetdash.core.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "sheetdash.pipeline")
public class PipelineProperties {
    @NotBlank
    private String unknownRegion = "Unknown";
    @NotBlank
    private String regionTable = "regions/city-regions.json";
    @Positive
    private long maxUploadBytes = 20L * 1024 * 1024;
    @Positive
    private int unknownCitySampleSize = 10;
}

package com.sheetdash.core.config;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "sheetdash.analytics")
public class AnalyticsProperties {
    @Positive
    private int defaultMonthWindow = 12;
    @Positive
    private int topProfessions = 10;
    @Positive
    private int histogramBins = 15;
}

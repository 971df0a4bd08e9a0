package com.sheetdash.core.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@Configuration
@Slf4j
public class LoggingConfiguration {

    @Value("${logs.dir:logs}")
    private String logsDirectory;

    @PostConstruct
    public void initializeLoggingDirectory() {
        Path logsPath = Paths.get(logsDirectory);
        try {
            if (!Files.exists(logsPath)) {
                Files.createDirectories(logsPath);
                log.info("✅ Created run log directory: {}", logsPath.toAbsolutePath());
            }
            log.info("🗂️ Sanitization run logs go to {}/sheetdash-yyyy-MM-dd.log", logsPath.toAbsolutePath());
        } catch (IOException e) {
            log.error("❌ Failed to create log directory: {}", logsDirectory, e);
            throw new IllegalStateException("Cannot initialize log directory: " + logsDirectory, e);
        }
    }
}

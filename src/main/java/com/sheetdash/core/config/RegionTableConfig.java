package com.sheetdash.core.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sheetdash.core.models.RegionLookupTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads the city to region table once at startup. The JSON file groups cities by country:
 * {@code { "DE": { "Berlin": "Berlin", ... }, "AT": { ... }, "CH": { ... } }}.
 */
@Slf4j
@Configuration
public class RegionTableConfig {

    private static final TypeReference<LinkedHashMap<String, LinkedHashMap<String, String>>> TABLE_TYPE =
            new TypeReference<>() {
            };

    @Bean
    public RegionLookupTable regionLookupTable(ObjectMapper objectMapper, PipelineProperties properties) {
        return load(objectMapper, properties.getRegionTable());
    }

    public static RegionLookupTable load(ObjectMapper objectMapper, String classpathLocation) {
        ClassPathResource resource = new ClassPathResource(classpathLocation);
        try (InputStream in = resource.getInputStream()) {
            Map<String, LinkedHashMap<String, String>> byCountry = objectMapper.readValue(in, TABLE_TYPE);
            Map<String, String> cities = new LinkedHashMap<>();
            byCountry.forEach((country, entries) -> {
                log.debug("Region table {}: {} cities", country, entries.size());
                entries.forEach(cities::putIfAbsent);
            });
            RegionLookupTable table = RegionLookupTable.of(cities);
            log.info("🗺️ Loaded region table from {} with {} city keys across {} countries",
                    classpathLocation, table.size(), byCountry.size());
            return table;
        } catch (IOException e) {
            log.error("❌ Failed to load region table: {}", classpathLocation, e);
            throw new UncheckedIOException("Cannot load region table: " + classpathLocation, e);
        }
    }
}

package com.skyfuse.weather.repository;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Open-Meteo WMO weather code to description table, read from a {@code code,description} CSV.
 * A missing or unreadable table leaves the codebook empty instead of failing startup.
 */
@Component
public class WeatherCodebook {

    private static final Logger log = LoggerFactory.getLogger(WeatherCodebook.class);

    private static final String CODE_COLUMN = "code";
    private static final String DESCRIPTION_COLUMN = "description";

    private final ResourceLoader resourceLoader;
    private final String location;
    private volatile Map<Integer, String> descriptions = Map.of();

    public WeatherCodebook(ResourceLoader resourceLoader,
                           @Value("${skyfuse.codebook.location:classpath:open_meteo_weather_codes.csv}") String location) {
        this.resourceLoader = resourceLoader;
        this.location = location;
    }

    @PostConstruct
    public void init() {
        refresh();
    }

    public void refresh() {
        descriptions = Map.copyOf(readTable());
        log.info("Loaded {} weather code descriptions from {}", descriptions.size(), location);
    }

    public Optional<String> describe(int code) {
        return Optional.ofNullable(descriptions.get(code));
    }

    public int size() {
        return descriptions.size();
    }

    private Map<Integer, String> readTable() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Weather code table {} not found, codes will not be resolved", location);
            return Map.of();
        }

        Map<Integer, String> table = new HashMap<>();
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8);
             CSVReader csv = new CSVReader(reader)) {

            String[] header = csv.readNext();
            int codeIndex = indexOf(header, CODE_COLUMN);
            int descriptionIndex = indexOf(header, DESCRIPTION_COLUMN);
            if (codeIndex < 0 || descriptionIndex < 0) {
                log.warn("Weather code table {} lacks '{}' or '{}' column", location, CODE_COLUMN, DESCRIPTION_COLUMN);
                return Map.of();
            }

            String[] row;
            while ((row = csv.readNext()) != null) {
                putRow(table, row, codeIndex, descriptionIndex);
            }
        } catch (IOException | CsvValidationException e) {
            log.warn("Could not read weather code table {}: {}", location, e.getMessage());
            return Map.of();
        }
        return table;
    }

    private void putRow(Map<Integer, String> table, String[] row, int codeIndex, int descriptionIndex) {
        if (row.length <= Math.max(codeIndex, descriptionIndex)) return;
        String description = row[descriptionIndex].trim();
        if (description.isEmpty()) return;
        try {
            table.put(Integer.parseInt(row[codeIndex].trim()), description);
        } catch (NumberFormatException e) {
            log.warn("Skipping weather code row with non-numeric code '{}'", row[codeIndex]);
        }
    }

    private static int indexOf(String[] header, String column) {
        if (header == null) return -1;
        for (int i = 0; i < header.length; i++) {
            if (column.equalsIgnoreCase(header[i].trim())) return i;
        }
        return -1;
    }
}

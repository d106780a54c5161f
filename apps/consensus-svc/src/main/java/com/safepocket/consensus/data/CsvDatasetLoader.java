package com.safepocket.consensus.data;

import com.safepocket.consensus.model.Dataset;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads a headed CSV file into a {@link Dataset}. Blank cells are missing values, integer
 * literals become {@code Long}, decimal literals {@code Double}, everything else stays text.
 */
@Component
public class CsvDatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvDatasetLoader.class);

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setDuplicateHeaderMode(DuplicateHeaderMode.DISALLOW)
            .build();

    public Dataset load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new DataLoadException("CSV file not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, path.toString());
        } catch (IOException | UncheckedIOException ex) {
            throw new DataLoadException("Failed to read CSV file " + path + ": " + ex.getMessage(), ex);
        }
    }

    public Dataset load(Reader reader, String sourceLabel) {
        try (CSVParser parser = CSVParser.parse(reader, FORMAT)) {
            List<String> columns = parser.getHeaderNames();
            if (columns.isEmpty()) {
                throw new DataLoadException("CSV source " + sourceLabel + " has no header row");
            }
            List<Map<String, Object>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (String column : columns) {
                    row.put(column, record.isSet(column) ? typed(record.get(column)) : null);
                }
                rows.add(row);
            }
            Dataset dataset = Dataset.of(sourceLabel, columns, rows);
            log.info("dataset_loaded source={} rows={} columns={} numeric={}",
                    sourceLabel, dataset.rowCount(), dataset.columnCount(), dataset.numericColumns());
            return dataset;
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException ex) {
            throw new DataLoadException("Failed to parse CSV source " + sourceLabel + ": " + ex.getMessage(), ex);
        }
    }

    static Object typed(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        if (INTEGER.matcher(value).matches()) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException ex) {
                return Double.parseDouble(value);
            }
        }
        if (DECIMAL.matcher(value).matches()) {
            return Double.parseDouble(value);
        }
        return value;
    }
}

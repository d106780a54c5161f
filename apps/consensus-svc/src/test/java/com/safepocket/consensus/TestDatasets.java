package com.safepocket.consensus;

import com.safepocket.consensus.model.Dataset;
import com.safepocket.consensus.model.DetectionConfig;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class TestDatasets {

    private TestDatasets() {
    }

    /**
     * Single numeric column named {@code amount}.
     */
    public static Dataset amounts(double... values) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (double value : values) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("amount", value);
            rows.add(row);
        }
        return Dataset.of("test", List.of("amount"), rows);
    }

    /**
     * {@code rows} rows of two well-behaved numeric columns with one extreme row.
     */
    public static Dataset withOutlier(int rows, int outlierRow) {
        List<Map<String, Object>> data = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", (long) i);
            row.put("amount", i == outlierRow ? 5000d : 40d + (i % 7) * 1.5d);
            row.put("balance", i == outlierRow ? 9000d : 1000d + (i % 5) * 20d);
            data.add(row);
        }
        return Dataset.of("fixture", List.of("id", "amount", "balance"), data);
    }

    public static Dataset empty(String... columns) {
        return Dataset.of("empty", List.of(columns), List.of());
    }

    public static DetectionConfig config(List<String> featureColumns) {
        return new DetectionConfig(featureColumns, 1.5d, 2.5d, 0.05d, 42L, DetectionConfig.Rules.none());
    }

    public static DetectionConfig config(String... featureColumns) {
        return config(List.of(featureColumns));
    }
}

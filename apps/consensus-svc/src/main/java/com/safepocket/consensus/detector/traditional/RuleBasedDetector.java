package com.safepocket.consensus.detector.traditional;

import com.safepocket.consensus.detector.Detector;
import com.safepocket.consensus.detector.DetectorExecutionException;
import com.safepocket.consensus.model.Dataset;
import com.safepocket.consensus.model.DetectionConfig;
import com.safepocket.consensus.model.DetectionOutput;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural validation: required values present, numeric values inside their allowed range,
 * categorical values inside their allowed set. Rules for columns the dataset lacks are ignored,
 * except required columns, whose absence fails the detector.
 */
public class RuleBasedDetector implements Detector {

    @Override
    public DetectionOutput detect(Dataset dataset, DetectionConfig config) {
        DetectionConfig.Rules rules = config.rules();
        List<String> required = rules.requiredColumns().isEmpty() && !dataset.columns().isEmpty()
                ? List.of(dataset.columns().get(0))
                : rules.requiredColumns();
        for (String column : required) {
            if (!dataset.columns().contains(column)) {
                throw new DetectorExecutionException("required column '" + column + "' not present");
            }
        }
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < dataset.rowCount(); i++) {
            Map<String, Object> row = dataset.rows().get(i);
            if (violates(row, required, rules)) {
                indices.add(i);
            }
        }
        return DetectionOutput.of(indices);
    }

    private boolean violates(Map<String, Object> row, List<String> required, DetectionConfig.Rules rules) {
        for (String column : required) {
            if (row.get(column) == null) {
                return true;
            }
        }
        for (Map.Entry<String, DetectionConfig.Range> entry : rules.allowedRanges().entrySet()) {
            if (!row.containsKey(entry.getKey())) {
                continue;
            }
            Object value = row.get(entry.getKey());
            if (value == null) {
                continue;
            }
            if (!(value instanceof Number number) || !entry.getValue().contains(number.doubleValue())) {
                return true;
            }
        }
        for (Map.Entry<String, Set<String>> entry : rules.allowedCategories().entrySet()) {
            Object value = row.get(entry.getKey());
            if (value != null && !entry.getValue().contains(value.toString())) {
                return true;
            }
        }
        return false;
    }
}

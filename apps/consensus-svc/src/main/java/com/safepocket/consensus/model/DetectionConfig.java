package com.safepocket.consensus.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only parameters handed to every detector of a run.
 */
public record DetectionConfig(
        List<String> featureColumns,
        double iqrFactor,
        double zScoreThreshold,
        double contamination,
        long randomSeed,
        Rules rules
) {

    public DetectionConfig {
        featureColumns = featureColumns == null ? List.of() : List.copyOf(featureColumns);
        if (iqrFactor <= 0) {
            throw new IllegalArgumentException("iqrFactor must be positive");
        }
        if (zScoreThreshold <= 0) {
            throw new IllegalArgumentException("zScoreThreshold must be positive");
        }
        if (contamination <= 0 || contamination >= 0.5) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5)");
        }
        rules = rules == null ? Rules.none() : rules;
    }

    public DetectionConfig withFeatureColumns(List<String> columns) {
        return new DetectionConfig(columns, iqrFactor, zScoreThreshold, contamination, randomSeed, rules);
    }

    public record Rules(
            List<String> requiredColumns,
            Map<String, Range> allowedRanges,
            Map<String, Set<String>> allowedCategories
    ) {
        public Rules {
            requiredColumns = requiredColumns == null ? List.of() : List.copyOf(requiredColumns);
            allowedRanges = allowedRanges == null ? Map.of() : Map.copyOf(allowedRanges);
            allowedCategories = allowedCategories == null ? Map.of() : Map.copyOf(allowedCategories);
        }

        public static Rules none() {
            return new Rules(List.of(), Map.of(), Map.of());
        }
    }

    public record Range(Double min, Double max) {
        public boolean contains(double value) {
            return (min == null || value >= min) && (max == null || value <= max);
        }
    }
}

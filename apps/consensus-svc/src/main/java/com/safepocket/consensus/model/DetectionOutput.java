package com.safepocket.consensus.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw answer of a detector: claimed anomalous row indices plus optional confidence per row.
 * Nothing here is validated; {@code ResultNormalizer} does that against the dataset.
 */
public record DetectionOutput(List<Integer> anomalyIndices, Map<Integer, Double> confidence) {

    public DetectionOutput {
        anomalyIndices = anomalyIndices == null ? List.of() : new ArrayList<>(anomalyIndices);
        confidence = confidence == null ? Map.of() : new LinkedHashMap<>(confidence);
    }

    public static DetectionOutput of(Collection<Integer> indices) {
        return new DetectionOutput(new ArrayList<>(indices), Map.of());
    }

    public static DetectionOutput fromMask(boolean[] mask) {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                indices.add(i);
            }
        }
        return new DetectionOutput(indices, Map.of());
    }

    /**
     * Rows scoring strictly above {@code threshold}; every row's score is kept as confidence.
     */
    public static DetectionOutput fromScores(double[] scores, double threshold) {
        List<Integer> indices = new ArrayList<>();
        Map<Integer, Double> confidence = new LinkedHashMap<>();
        for (int i = 0; i < scores.length; i++) {
            if (Double.isNaN(scores[i])) {
                continue;
            }
            confidence.put(i, scores[i]);
            if (scores[i] > threshold) {
                indices.add(i);
            }
        }
        return new DetectionOutput(indices, confidence);
    }
}

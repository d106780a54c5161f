package com.safepocket.consensus.detector;

import com.safepocket.consensus.model.Dataset;
import com.safepocket.consensus.model.DetectionConfig;
import com.safepocket.consensus.model.DetectionOutput;

/**
 * Detector that produces a per-row anomaly score and flags rows scoring above a threshold.
 */
public abstract class ScoringDetector implements Detector {

    private final double threshold;

    protected ScoringDetector(double threshold) {
        this.threshold = threshold;
    }

    public abstract double[] score(NumericMatrix matrix, DetectionConfig config);

    protected double threshold(double[] scores) {
        return threshold;
    }

    @Override
    public DetectionOutput detect(Dataset dataset, DetectionConfig config) {
        NumericMatrix matrix = NumericMatrix.of(dataset, config.featureColumns());
        double[] scores = score(matrix, config);
        if (scores.length != matrix.rowCount()) {
            throw new DetectorExecutionException("expected " + matrix.rowCount() + " scores, got " + scores.length);
        }
        return DetectionOutput.fromScores(scores, threshold(scores));
    }
}

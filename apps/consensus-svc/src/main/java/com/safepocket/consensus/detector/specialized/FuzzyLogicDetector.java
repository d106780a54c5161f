package com.safepocket.consensus.detector.specialized;

import com.safepocket.consensus.detector.DetectorSupport;
import com.safepocket.consensus.detector.NumericMatrix;
import com.safepocket.consensus.detector.ScoringDetector;
import com.safepocket.consensus.model.DetectionConfig;

/**
 * Soft boundaries: each value is scaled to {@code 3 * z} and scored by how little it belongs
 * to the triangular "normal" set (-1, 0, 1). Missing values score 0.5.
 */
public class FuzzyLogicDetector extends ScoringDetector {

    public FuzzyLogicDetector() {
        super(0.5d);
    }

    @Override
    public double[] score(NumericMatrix matrix, DetectionConfig config) {
        int rows = matrix.rowCount();
        int width = matrix.width();
        double[] scores = new double[rows];
        for (int j = 0; j < width; j++) {
            double[] column = matrix.column(j);
            double[] finite = DetectorSupport.finite(column);
            double mean = finite.length == 0 ? 0d : DetectorSupport.mean(finite);
            double std = finite.length == 0 ? 0d : DetectorSupport.populationStd(finite);
            for (int i = 0; i < rows; i++) {
                if (Double.isNaN(column[i])) {
                    scores[i] += 0.5d / width;
                    continue;
                }
                double scaled = std == 0 ? 0d : (column[i] - mean) / (std + 1e-8) * 3;
                scores[i] += (1 - triangular(scaled, -1, 0, 1)) / width;
            }
        }
        return scores;
    }

    static double triangular(double x, double a, double b, double c) {
        if (x <= a || x >= c) {
            return 0d;
        }
        if (x <= b) {
            return (x - a) / (b - a + 1e-8);
        }
        return (c - x) / (c - b + 1e-8);
    }
}

package com.safepocket.consensus.detector.traditional;

import com.safepocket.consensus.detector.Detector;
import com.safepocket.consensus.detector.DetectorSupport;
import com.safepocket.consensus.detector.NumericMatrix;
import com.safepocket.consensus.model.Dataset;
import com.safepocket.consensus.model.DetectionConfig;
import com.safepocket.consensus.model.DetectionOutput;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ZScoreDetector implements Detector {

    @Override
    public DetectionOutput detect(Dataset dataset, DetectionConfig config) {
        NumericMatrix matrix = NumericMatrix.of(dataset, config.featureColumns());
        int rows = matrix.rowCount();
        double[] maxAbsZ = new double[rows];
        for (int j = 0; j < matrix.width(); j++) {
            double[] column = matrix.column(j);
            double[] finite = DetectorSupport.finite(column);
            if (finite.length < 3) {
                continue;
            }
            double mean = DetectorSupport.mean(finite);
            double stdDev = DetectorSupport.populationStd(finite);
            for (int i = 0; i < rows; i++) {
                double value = column[i];
                double zScore = stdDev == 0 || Double.isNaN(value) ? 0 : (value - mean) / stdDev;
                maxAbsZ[i] = Math.max(maxAbsZ[i], Math.abs(zScore));
            }
        }
        double threshold = config.zScoreThreshold();
        List<Integer> indices = new ArrayList<>();
        Map<Integer, Double> confidence = new LinkedHashMap<>();
        for (int i = 0; i < rows; i++) {
            confidence.put(i, Math.min(maxAbsZ[i] / (2 * threshold), 1d));
            if (maxAbsZ[i] >= threshold) {
                indices.add(i);
            }
        }
        return new DetectionOutput(indices, confidence);
    }
}

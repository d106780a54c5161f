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

/**
 * Interquartile-range fences per feature column, OR-combined across columns.
 */
public class IqrDetector implements Detector {

    @Override
    public DetectionOutput detect(Dataset dataset, DetectionConfig config) {
        NumericMatrix matrix = NumericMatrix.of(dataset, config.featureColumns());
        int rows = matrix.rowCount();
        boolean[] flagged = new boolean[rows];
        double[] confidence = new double[rows];
        for (int j = 0; j < matrix.width(); j++) {
            double[] column = matrix.column(j);
            double[] finite = DetectorSupport.finite(column);
            if (finite.length == 0) {
                continue;
            }
            double q1 = DetectorSupport.percentile(finite, 25);
            double q3 = DetectorSupport.percentile(finite, 75);
            double iqr = q3 - q1;
            double lower = q1 - iqr * config.iqrFactor();
            double upper = q3 + iqr * config.iqrFactor();
            for (int i = 0; i < rows; i++) {
                double value = column[i];
                if (Double.isNaN(value)) {
                    continue;
                }
                double distance = Math.max(0d, Math.max(lower - value, value - upper));
                if (value < lower || value > upper) {
                    flagged[i] = true;
                }
                confidence[i] = Math.max(confidence[i], Math.min(distance / (iqr + 1e-8), 1d));
            }
        }
        List<Integer> indices = new ArrayList<>();
        Map<Integer, Double> scores = new LinkedHashMap<>();
        for (int i = 0; i < rows; i++) {
            scores.put(i, confidence[i]);
            if (flagged[i]) {
                indices.add(i);
            }
        }
        return new DetectionOutput(indices, scores);
    }
}

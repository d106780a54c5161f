package com.safepocket.consensus.normalize;

import com.safepocket.consensus.detector.DetectorDescriptor;
import com.safepocket.consensus.model.DetectionOutput;
import com.safepocket.consensus.model.DetectionResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a detector's raw output into a validated result. Duplicate indices are collapsed and
 * confidence scores clamped to [0, 1]; any index outside the dataset's row range, or any
 * non-finite score, downgrades the whole result to {@code FAILED}.
 */
@Component
public class ResultNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ResultNormalizer.class);
    private static final int SAMPLE_SIZE = 5;

    public DetectionResult normalize(DetectorDescriptor descriptor, DetectionOutput output, int rowCount, Duration elapsed) {
        try {
            SortedSet<Integer> indices = validatedIndices(output, rowCount);
            Map<Integer, Double> confidence = validatedConfidence(output, rowCount);
            return DetectionResult.success(descriptor.name(), descriptor.category(), indices, confidence, elapsed);
        } catch (IndexValidationException ex) {
            log.warn("index_validation detector={} reason={}", descriptor.name(), ex.getMessage());
            return DetectionResult.failed(descriptor.name(), descriptor.category(), elapsed, ex.getMessage());
        }
    }

    public SortedSet<Integer> validatedIndices(DetectionOutput output, int rowCount) {
        if (output == null) {
            throw new IndexValidationException("detector returned no output");
        }
        SortedSet<Integer> indices = new TreeSet<>();
        List<Integer> invalid = new ArrayList<>();
        int invalidCount = 0;
        for (Integer index : output.anomalyIndices()) {
            if (index == null || index < 0 || index >= rowCount) {
                invalidCount++;
                if (invalid.size() < SAMPLE_SIZE) {
                    invalid.add(index);
                }
                continue;
            }
            indices.add(index);
        }
        if (invalidCount > 0) {
            throw new IndexValidationException(invalidCount + " anomaly indices outside [0, " + rowCount + "), e.g. " + invalid);
        }
        return indices;
    }

    private Map<Integer, Double> validatedConfidence(DetectionOutput output, int rowCount) {
        Map<Integer, Double> confidence = new TreeMap<>();
        for (Map.Entry<Integer, Double> entry : output.confidence().entrySet()) {
            Integer index = entry.getKey();
            Double score = entry.getValue();
            if (index == null || index < 0 || index >= rowCount) {
                throw new IndexValidationException("confidence score for row " + index + " outside [0, " + rowCount + ")");
            }
            if (score == null || score.isNaN() || score.isInfinite()) {
                throw new IndexValidationException("confidence score for row " + index + " is not a finite number");
            }
            confidence.put(index, Math.max(0d, Math.min(1d, score)));
        }
        return confidence;
    }
}

package com.safepocket.consensus.normalize;

import static org.assertj.core.api.Assertions.assertThat;

import com.safepocket.consensus.detector.DetectorDescriptor;
import com.safepocket.consensus.model.DetectionOutput;
import com.safepocket.consensus.model.DetectionResult;
import com.safepocket.consensus.model.DetectionStatus;
import com.safepocket.consensus.model.DetectorCategory;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResultNormalizerTest {

    private final ResultNormalizer normalizer = new ResultNormalizer();
    private final DetectorDescriptor descriptor = DetectorDescriptor.of("iqr", DetectorCategory.TRADITIONAL,
            (dataset, config) -> DetectionOutput.of(List.of()));

    @Test
    void deduplicatesAndSortsIndices() {
        DetectionResult result = normalizer.normalize(descriptor, DetectionOutput.of(List.of(7, 2, 7, 0)), 10, Duration.ofMillis(3));

        assertThat(result.status()).isEqualTo(DetectionStatus.SUCCESS);
        assertThat(result.anomalyIndices()).containsExactly(0, 2, 7);
        assertThat(result.executionTime()).isEqualTo(Duration.ofMillis(3));
    }

    @Test
    void outOfRangeIndexFailsWholeResult() {
        DetectionResult result = normalizer.normalize(descriptor, DetectionOutput.of(List.of(1, 10, -1)), 10, Duration.ZERO);

        assertThat(result.status()).isEqualTo(DetectionStatus.FAILED);
        assertThat(result.anomalyIndices()).isEmpty();
        assertThat(result.errorMessage()).contains("2 anomaly indices outside [0, 10)");
    }

    @Test
    void nullIndexFailsWholeResult() {
        DetectionResult result = normalizer.normalize(descriptor, DetectionOutput.of(Arrays.asList(1, null)), 10, Duration.ZERO);

        assertThat(result.status()).isEqualTo(DetectionStatus.FAILED);
    }

    @Test
    void missingOutputFails() {
        DetectionResult result = normalizer.normalize(descriptor, null, 10, Duration.ZERO);

        assertThat(result.status()).isEqualTo(DetectionStatus.FAILED);
        assertThat(result.errorMessage()).isEqualTo("detector returned no output");
    }

    @Test
    void clampsConfidenceIntoUnitInterval() {
        Map<Integer, Double> confidence = Map.of(0, 1.7d, 1, -0.2d, 2, 0.4d);

        DetectionResult result = normalizer.normalize(descriptor, new DetectionOutput(List.of(0), confidence), 3, Duration.ZERO);

        assertThat(result.confidence()).containsEntry(0, 1d).containsEntry(1, 0d).containsEntry(2, 0.4d);
    }

    @Test
    void nonFiniteConfidenceFails() {
        Map<Integer, Double> confidence = new HashMap<>();
        confidence.put(0, Double.NaN);

        DetectionResult result = normalizer.normalize(descriptor, new DetectionOutput(List.of(0), confidence), 3, Duration.ZERO);

        assertThat(result.status()).isEqualTo(DetectionStatus.FAILED);
        assertThat(result.errorMessage()).contains("not a finite number");
    }

    @Test
    void emptyDatasetAcceptsEmptyOutput() {
        DetectionResult result = normalizer.normalize(descriptor, DetectionOutput.of(List.of()), 0, Duration.ZERO);

        assertThat(result.successful()).isTrue();
        assertThat(result.anomalyIndices()).isEmpty();
    }
}

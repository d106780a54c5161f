package com.safepocket.consensus.detector.traditional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.safepocket.consensus.TestDatasets;
import com.safepocket.consensus.detector.DetectorExecutionException;
import com.safepocket.consensus.model.Dataset;
import com.safepocket.consensus.model.DetectionOutput;
import java.util.List;
import org.junit.jupiter.api.Test;

class IqrDetectorTest {

    private final IqrDetector detector = new IqrDetector();

    @Test
    void flagsValuesOutsideFences() {
        Dataset dataset = TestDatasets.amounts(10, 11, 12, 13, 14, 10, 11, 12, 13, 100);

        DetectionOutput output = detector.detect(dataset, TestDatasets.config("amount"));

        assertThat(output.anomalyIndices()).containsExactly(9);
        assertThat(output.confidence().get(9)).isEqualTo(1d);
        assertThat(output.confidence().get(0)).isZero();
    }

    @Test
    void combinesColumnsWithOr() {
        Dataset dataset = TestDatasets.withOutlier(30, 4);

        DetectionOutput output = detector.detect(dataset, TestDatasets.config("amount", "balance"));

        assertThat(output.anomalyIndices()).containsExactly(4);
    }

    @Test
    void ignoresMissingValues() {
        Dataset dataset = TestDatasets.amounts(10, 11, Double.NaN, 12, 13);

        assertThat(detector.detect(dataset, TestDatasets.config("amount")).anomalyIndices()).isEmpty();
    }

    @Test
    void failsWhenNoNumericFeatures() {
        assertThatThrownBy(() -> detector.detect(TestDatasets.amounts(1, 2, 3), TestDatasets.config(List.of())))
                .isInstanceOf(DetectorExecutionException.class);
    }
}

package com.safepocket.consensus.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.safepocket.consensus.comparison.Agreement;
import com.safepocket.consensus.comparison.ComparisonEngine;
import com.safepocket.consensus.model.ComparisonReport;
import com.safepocket.consensus.model.ComparisonReport.Consensus;
import com.safepocket.consensus.model.DetectionResult;
import com.safepocket.consensus.model.DetectorCategory;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class ReportBuilderTest {

    private final ReportBuilder builder = new ReportBuilder();

    @Test
    void assemblesDatasetSummaryAndKeepsResultOrder() {
        ComparisonReport report = ReportFixtures.scenarioReport();

        assertThat(report.runId()).isEqualTo(ReportFixtures.RUN_ID);
        assertThat(report.timestamp()).isEqualTo(ReportFixtures.TIMESTAMP);
        assertThat(report.dataset().source()).isEqualTo("transactions.csv");
        assertThat(report.dataset().rowCount()).isEqualTo(100);
        assertThat(report.dataset().columnCount()).isEqualTo(2);
        assertThat(report.dataset().numericColumns()).containsExactly("amount");
        assertThat(report.results()).extracting(DetectionResult::detectorName).containsExactly("rule_based", "iqr", "autoencoder");
        assertThat(report.consensus().rows()).containsExactly(10);
    }

    @Test
    void rejectsDuplicateResults() {
        List<DetectionResult> results = List.of(
                DetectionResult.success("iqr", DetectorCategory.TRADITIONAL, Set.of(), Map.of(), Duration.ZERO),
                DetectionResult.failed("iqr", DetectorCategory.TRADITIONAL, Duration.ZERO, "boom")
        );
        Agreement agreement = new ComparisonEngine().compare(results, 0.5d);

        assertThatThrownBy(() -> builder.build(ReportFixtures.RUN_ID, ReportFixtures.TIMESTAMP, ReportFixtures.hundredRows(), results, agreement))
                .isInstanceOf(ReportAssemblyException.class);
    }

    @Test
    void rejectsIndicesBeyondDataset() {
        List<DetectionResult> results = List.of(
                DetectionResult.success("iqr", DetectorCategory.TRADITIONAL, Set.of(100), Map.of(), Duration.ZERO)
        );
        Agreement agreement = new ComparisonEngine().compare(results, 0.5d);

        assertThatThrownBy(() -> builder.build(ReportFixtures.RUN_ID, ReportFixtures.TIMESTAMP, ReportFixtures.hundredRows(), results, agreement))
                .isInstanceOf(ReportAssemblyException.class)
                .hasMessageContaining("outside [0, 100)");
    }

    @Test
    void rejectsConsensusOutsideUnion() {
        List<DetectionResult> results = ReportFixtures.scenarioResults();
        Agreement computed = new ComparisonEngine().compare(results, 0.5d);
        Agreement tampered = new Agreement(
                computed.overlap(),
                new Consensus(true, 0.5d, 2, new TreeSet<>(Set.of(10, 77))),
                computed.statistics(),
                computed.uniqueDetections(),
                computed.categories());

        assertThatThrownBy(() -> builder.build(ReportFixtures.RUN_ID, ReportFixtures.TIMESTAMP, ReportFixtures.hundredRows(), results, tampered))
                .isInstanceOf(ReportAssemblyException.class);
    }

    @Test
    void rejectsMissingInputs() {
        assertThatThrownBy(() -> builder.build(null, ReportFixtures.TIMESTAMP, ReportFixtures.hundredRows(), List.of(), null))
                .isInstanceOf(ReportAssemblyException.class);
    }
}

package com.safepocket.consensus.report;

import com.safepocket.consensus.comparison.Agreement;
import com.safepocket.consensus.model.ComparisonReport;
import com.safepocket.consensus.model.ComparisonReport.DatasetSummary;
import com.safepocket.consensus.model.ComparisonReport.OverlapTable;
import com.safepocket.consensus.model.Dataset;
import com.safepocket.consensus.model.DetectionResult;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Assembles the immutable report value. No I/O; every consistency check that fails here
 * points at a programming error upstream and is raised as {@link ReportAssemblyException}.
 */
@Component
public class ReportBuilder {

    public ComparisonReport build(UUID runId, Instant timestamp, Dataset dataset, List<DetectionResult> results, Agreement agreement) {
        if (runId == null || timestamp == null || dataset == null || results == null || agreement == null) {
            throw new ReportAssemblyException("report inputs must all be present");
        }
        Set<String> successfulNames = checkResults(dataset.rowCount(), results);
        checkOverlap(agreement.overlap(), successfulNames);
        checkConsensus(agreement, results);
        if (!successfulNames.containsAll(agreement.uniqueDetections().keySet())) {
            throw new ReportAssemblyException("unique detections reference a method without a successful result");
        }
        if (agreement.statistics().computable() != !successfulNames.isEmpty()) {
            throw new ReportAssemblyException("statistics computability disagrees with successful result count");
        }

        DatasetSummary summary = new DatasetSummary(
                dataset.source(),
                dataset.rowCount(),
                dataset.columnCount(),
                dataset.columns().stream().filter(dataset.numericColumns()::contains).toList()
        );
        return new ComparisonReport(
                runId,
                timestamp,
                summary,
                List.copyOf(results),
                agreement.overlap(),
                agreement.consensus(),
                agreement.statistics(),
                agreement.uniqueDetections(),
                agreement.categories()
        );
    }

    private Set<String> checkResults(int rowCount, List<DetectionResult> results) {
        Set<String> names = new HashSet<>();
        Set<String> successful = new HashSet<>();
        for (DetectionResult result : results) {
            if (!names.add(result.detectorName())) {
                throw new ReportAssemblyException("duplicate result for detector '" + result.detectorName() + "'");
            }
            if (!result.successful()) {
                continue;
            }
            successful.add(result.detectorName());
            if (!result.anomalyIndices().isEmpty()
                    && (result.anomalyIndices().first() < 0 || result.anomalyIndices().last() >= rowCount)) {
                throw new ReportAssemblyException("detector '" + result.detectorName() + "' has indices outside [0, " + rowCount + ")");
            }
        }
        return successful;
    }

    private void checkOverlap(OverlapTable overlap, Set<String> successfulNames) {
        int expectedPairs = successfulNames.size() * (successfulNames.size() - 1) / 2;
        if (overlap.entries().size() != expectedPairs) {
            throw new ReportAssemblyException("overlap table has " + overlap.entries().size() + " pairs, expected " + expectedPairs);
        }
        for (OverlapTable.Entry entry : overlap.entries()) {
            if (!successfulNames.contains(entry.first()) || !successfulNames.contains(entry.second())) {
                throw new ReportAssemblyException("overlap pair " + entry.first() + "/" + entry.second() + " includes a non-successful method");
            }
        }
    }

    private void checkConsensus(Agreement agreement, List<DetectionResult> results) {
        var consensus = agreement.consensus();
        if (!consensus.computable()) {
            if (!consensus.rows().isEmpty()) {
                throw new ReportAssemblyException("non-computable consensus must be empty");
            }
            return;
        }
        Set<Integer> union = new HashSet<>();
        results.stream().filter(DetectionResult::successful).forEach(result -> union.addAll(result.anomalyIndices()));
        if (!union.containsAll(consensus.rows())) {
            throw new ReportAssemblyException("consensus rows are not flagged by any successful method");
        }
    }
}

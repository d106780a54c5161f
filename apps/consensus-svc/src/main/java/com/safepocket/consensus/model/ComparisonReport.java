package com.safepocket.consensus.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.SortedSet;
import java.util.UUID;

public record ComparisonReport(
        UUID runId,
        Instant timestamp,
        DatasetSummary dataset,
        List<DetectionResult> results,
        OverlapTable overlap,
        Consensus consensus,
        Statistics statistics,
        Map<String, Integer> uniqueDetections,
        List<CategorySummary> categories
) {

    public record DatasetSummary(String source, int rowCount, int columnCount, List<String> numericColumns) {
    }

    public record OverlapTable(List<Entry> entries) {

        public record Entry(String first, String second, int sharedCount) {
        }

        public OptionalInt shared(String a, String b) {
            return entries.stream()
                    .filter(entry -> (entry.first().equals(a) && entry.second().equals(b))
                            || (entry.first().equals(b) && entry.second().equals(a)))
                    .mapToInt(Entry::sharedCount)
                    .findFirst();
        }
    }

    /**
     * Rows flagged by strictly more than {@code threshold * participatingMethods} successful methods.
     * Not computable (and empty) when fewer than two methods succeeded.
     */
    public record Consensus(boolean computable, double threshold, int participatingMethods, SortedSet<Integer> rows) {
    }

    public record Statistics(Optional<AnomalyCounts> anomalyCounts, Timing timing) {

        public boolean computable() {
            return anomalyCounts.isPresent();
        }
    }

    public record AnomalyCounts(int methods, double mean, int min, int max, double standardDeviation) {
    }

    public record Timing(Duration total, Duration average, Duration fastest, Duration slowest) {
    }

    public record CategorySummary(DetectorCategory category, int successfulMethods, int totalAnomalies) {
    }
}

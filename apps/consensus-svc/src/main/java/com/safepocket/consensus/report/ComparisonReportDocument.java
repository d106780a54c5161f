package com.safepocket.consensus.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.safepocket.consensus.model.ComparisonReport;
import com.safepocket.consensus.model.ComparisonReport.AnomalyCounts;
import com.safepocket.consensus.model.ComparisonReport.Timing;
import com.safepocket.consensus.model.DetectionResult;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of a comparison report. Times are seconds; rows are zero-based dataset indices.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComparisonReportDocument(
        @JsonProperty("run_id") String runId,
        String timestamp,
        @JsonProperty("data_source") String dataSource,
        int records,
        int columns,
        @JsonProperty("numeric_columns") List<String> numericColumns,
        Map<String, MethodResult> results,
        Map<String, Map<String, Integer>> overlap,
        ConsensusSection consensus,
        StatisticsSection statistics,
        @JsonProperty("unique_detections") Map<String, Integer> uniqueDetections,
        List<CategorySection> categories
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record MethodResult(
            String category,
            String status,
            int anomalies,
            double time,
            @JsonProperty("anomaly_rate") double anomalyRate,
            String error
    ) {
    }

    public record ConsensusSection(boolean computable, double threshold, int methods, int count, List<Integer> rows) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record StatisticsSection(
            boolean computable,
            Double mean,
            Integer min,
            Integer max,
            @JsonProperty("std_dev") Double stdDev,
            @JsonProperty("total_time") double totalTime,
            @JsonProperty("average_time") double averageTime,
            double fastest,
            double slowest
    ) {
    }

    public record CategorySection(
            String category,
            @JsonProperty("successful_methods") int successfulMethods,
            @JsonProperty("total_anomalies") int totalAnomalies
    ) {
    }

    public static ComparisonReportDocument from(ComparisonReport report) {
        int records = report.dataset().rowCount();

        Map<String, MethodResult> results = new LinkedHashMap<>();
        for (DetectionResult result : report.results()) {
            results.put(result.detectorName(), new MethodResult(
                    result.category().name(),
                    result.status().name(),
                    result.anomalyCount(),
                    seconds(result.executionTime()),
                    records == 0 ? 0d : (double) result.anomalyCount() / records,
                    result.errorMessage()
            ));
        }

        Map<String, Map<String, Integer>> overlap = new LinkedHashMap<>();
        report.overlap().entries().forEach(entry ->
                overlap.computeIfAbsent(entry.first(), key -> new LinkedHashMap<>()).put(entry.second(), entry.sharedCount()));

        var consensus = report.consensus();
        ConsensusSection consensusSection = new ConsensusSection(
                consensus.computable(),
                consensus.threshold(),
                consensus.participatingMethods(),
                consensus.rows().size(),
                List.copyOf(consensus.rows())
        );

        Timing timing = report.statistics().timing();
        AnomalyCounts counts = report.statistics().anomalyCounts().orElse(null);
        StatisticsSection statistics = new StatisticsSection(
                counts != null,
                counts == null ? null : counts.mean(),
                counts == null ? null : counts.min(),
                counts == null ? null : counts.max(),
                counts == null ? null : counts.standardDeviation(),
                seconds(timing.total()),
                seconds(timing.average()),
                seconds(timing.fastest()),
                seconds(timing.slowest())
        );

        List<CategorySection> categories = report.categories().stream()
                .map(summary -> new CategorySection(summary.category().name(), summary.successfulMethods(), summary.totalAnomalies()))
                .toList();

        return new ComparisonReportDocument(
                report.runId().toString(),
                report.timestamp().toString(),
                report.dataset().source(),
                records,
                report.dataset().columnCount(),
                report.dataset().numericColumns(),
                results,
                overlap,
                consensusSection,
                statistics,
                report.uniqueDetections(),
                categories
        );
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000d;
    }
}

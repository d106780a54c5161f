package com.safepocket.consensus.report;

import com.safepocket.consensus.model.ComparisonReport;
import com.safepocket.consensus.model.ComparisonReport.AnomalyCounts;
import com.safepocket.consensus.model.ComparisonReport.Timing;
import com.safepocket.consensus.model.DetectionResult;
import com.safepocket.consensus.model.DetectorCategory;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Plain-text rendering of a report for the command line.
 */
@Component
public class ReportTextFormatter {

    private static final String RULE = "-".repeat(88);

    public String summary(ComparisonReport report) {
        StringBuilder out = new StringBuilder();
        var dataset = report.dataset();
        line(out, "Run %s  source=%s  records=%d  columns=%d  numeric=%s",
                report.runId(), dataset.source(), dataset.rowCount(), dataset.columnCount(), dataset.numericColumns());
        out.append(RULE).append('\n');
        for (DetectionResult result : report.results()) {
            String detail = result.successful() ? result.anomalyCount() + " anomalies" : result.errorMessage();
            line(out, "  %-20s %-10s %8.4fs  %s", result.detectorName(), result.status(), seconds(result.executionTime()), detail);
        }
        out.append(RULE).append('\n');
        var consensus = report.consensus();
        if (consensus.computable()) {
            line(out, "Consensus (> %.0f%% of %d methods): %d rows", consensus.threshold() * 100, consensus.participatingMethods(), consensus.rows().size());
        } else {
            line(out, "Consensus: not computable (%d successful methods)", consensus.participatingMethods());
        }
        AnomalyCounts counts = report.statistics().anomalyCounts().orElse(null);
        if (counts == null) {
            line(out, "Anomaly statistics: not computable");
        } else {
            line(out, "Anomalies: mean=%.1f min=%d max=%d std=%.2f", counts.mean(), counts.min(), counts.max(), counts.standardDeviation());
        }
        Timing timing = report.statistics().timing();
        line(out, "Time: total=%.2fs average=%.4fs fastest=%.4fs slowest=%.4fs",
                seconds(timing.total()), seconds(timing.average()), seconds(timing.fastest()), seconds(timing.slowest()));
        return out.toString();
    }

    /**
     * Per-category comparison followed by the pairwise overlap matrix of successful methods.
     */
    public String comparison(ComparisonReport report) {
        StringBuilder out = new StringBuilder();
        int records = report.dataset().rowCount();
        for (DetectorCategory category : DetectorCategory.values()) {
            List<DetectionResult> members = report.results().stream().filter(result -> result.category() == category).toList();
            if (members.isEmpty()) {
                continue;
            }
            line(out, "%s", category);
            out.append(RULE).append('\n');
            for (DetectionResult result : members) {
                String rate = records == 0 ? "N/A" : String.format(Locale.ROOT, "%.2f%%", 100d * result.anomalyCount() / records);
                Integer unique = report.uniqueDetections().get(result.detectorName());
                line(out, "  %-20s %6d anomalies (%7s) unique=%-6s %8.4fs",
                        result.detectorName(), result.anomalyCount(), rate, unique == null ? "-" : unique, seconds(result.executionTime()));
            }
        }

        List<String> methods = report.results().stream()
                .filter(DetectionResult::successful)
                .map(DetectionResult::detectorName)
                .toList();
        if (methods.size() < 2) {
            return out.toString();
        }
        out.append('\n');
        line(out, "Overlap");
        out.append(RULE).append('\n');
        StringBuilder header = new StringBuilder(String.format(Locale.ROOT, "%-20s", ""));
        methods.forEach(method -> header.append(String.format(Locale.ROOT, " %8s", abbreviate(method))));
        out.append(header).append('\n');
        for (String row : methods) {
            StringBuilder cells = new StringBuilder(String.format(Locale.ROOT, "%-20s", row));
            for (String column : methods) {
                String cell = row.equals(column)
                        ? "-"
                        : String.valueOf(report.overlap().shared(row, column).orElse(0));
                cells.append(String.format(Locale.ROOT, " %8s", cell));
            }
            out.append(cells).append('\n');
        }
        return out.toString();
    }

    private static String abbreviate(String name) {
        return name.length() <= 8 ? name : name.substring(0, 8);
    }

    private static void line(StringBuilder out, String format, Object... args) {
        out.append(String.format(Locale.ROOT, format, args)).append('\n');
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000d;
    }
}

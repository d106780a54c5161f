package com.safepocket.consensus.comparison;

import com.safepocket.consensus.model.ComparisonReport.AnomalyCounts;
import com.safepocket.consensus.model.ComparisonReport.CategorySummary;
import com.safepocket.consensus.model.ComparisonReport.Consensus;
import com.safepocket.consensus.model.ComparisonReport.OverlapTable;
import com.safepocket.consensus.model.ComparisonReport.Statistics;
import com.safepocket.consensus.model.ComparisonReport.Timing;
import com.safepocket.consensus.model.DetectionResult;
import com.safepocket.consensus.model.DetectorCategory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Component;

/**
 * Computes overlap, consensus and summary statistics over the successful results of a run.
 * Failed, timed-out and skipped methods are left out of everything except timing.
 */
@Component
public class ComparisonEngine {

    public Agreement compare(List<DetectionResult> results, double threshold) {
        if (threshold < 0 || threshold >= 1) {
            throw new IllegalArgumentException("threshold must be in [0, 1)");
        }
        List<DetectionResult> successful = results.stream().filter(DetectionResult::successful).toList();
        return new Agreement(
                overlap(successful),
                consensus(successful, threshold),
                new Statistics(anomalyCounts(successful), timing(results)),
                uniqueDetections(successful),
                categories(successful)
        );
    }

    OverlapTable overlap(List<DetectionResult> successful) {
        List<OverlapTable.Entry> entries = new ArrayList<>();
        for (int i = 0; i < successful.size(); i++) {
            for (int j = i + 1; j < successful.size(); j++) {
                DetectionResult first = successful.get(i);
                DetectionResult second = successful.get(j);
                int shared = (int) first.anomalyIndices().stream()
                        .filter(second.anomalyIndices()::contains)
                        .count();
                entries.add(new OverlapTable.Entry(first.detectorName(), second.detectorName(), shared));
            }
        }
        return new OverlapTable(List.copyOf(entries));
    }

    Consensus consensus(List<DetectionResult> successful, double threshold) {
        int methods = successful.size();
        if (methods < 2) {
            return new Consensus(false, threshold, methods, Collections.emptySortedSet());
        }
        Map<Integer, Integer> votes = votes(successful);
        double required = threshold * methods;
        SortedSet<Integer> rows = new TreeSet<>();
        votes.forEach((row, count) -> {
            if (count > required) {
                rows.add(row);
            }
        });
        return new Consensus(true, threshold, methods, Collections.unmodifiableSortedSet(rows));
    }

    Optional<AnomalyCounts> anomalyCounts(List<DetectionResult> successful) {
        if (successful.isEmpty()) {
            return Optional.empty();
        }
        double[] counts = successful.stream().mapToDouble(DetectionResult::anomalyCount).toArray();
        int min = successful.stream().mapToInt(DetectionResult::anomalyCount).min().orElse(0);
        int max = successful.stream().mapToInt(DetectionResult::anomalyCount).max().orElse(0);
        double mean = new Mean().evaluate(counts);
        double std = new StandardDeviation(false).evaluate(counts);
        return Optional.of(new AnomalyCounts(successful.size(), mean, min, max, std));
    }

    Timing timing(List<DetectionResult> results) {
        if (results.isEmpty()) {
            return new Timing(Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO);
        }
        Duration total = Duration.ZERO;
        Duration fastest = null;
        Duration slowest = null;
        for (DetectionResult result : results) {
            Duration time = result.executionTime();
            total = total.plus(time);
            fastest = fastest == null || time.compareTo(fastest) < 0 ? time : fastest;
            slowest = slowest == null || time.compareTo(slowest) > 0 ? time : slowest;
        }
        return new Timing(total, total.dividedBy(results.size()), fastest, slowest);
    }

    Map<String, Integer> uniqueDetections(List<DetectionResult> successful) {
        Map<Integer, Integer> votes = votes(successful);
        Map<String, Integer> unique = new LinkedHashMap<>();
        for (DetectionResult result : successful) {
            int count = (int) result.anomalyIndices().stream().filter(row -> votes.get(row) == 1).count();
            unique.put(result.detectorName(), count);
        }
        return Collections.unmodifiableMap(unique);
    }

    List<CategorySummary> categories(List<DetectionResult> successful) {
        List<CategorySummary> summaries = new ArrayList<>();
        for (DetectorCategory category : DetectorCategory.values()) {
            List<DetectionResult> inCategory = successful.stream().filter(result -> result.category() == category).toList();
            int anomalies = inCategory.stream().mapToInt(DetectionResult::anomalyCount).sum();
            summaries.add(new CategorySummary(category, inCategory.size(), anomalies));
        }
        return List.copyOf(summaries);
    }

    private static Map<Integer, Integer> votes(List<DetectionResult> successful) {
        Map<Integer, Integer> votes = new HashMap<>();
        for (DetectionResult result : successful) {
            Set<Integer> rows = result.anomalyIndices();
            rows.forEach(row -> votes.merge(row, 1, Integer::sum));
        }
        return votes;
    }
}

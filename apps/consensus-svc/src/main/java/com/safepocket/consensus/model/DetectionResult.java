package com.safepocket.consensus.model;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

public record DetectionResult(
        String detectorName,
        DetectorCategory category,
        DetectionStatus status,
        SortedSet<Integer> anomalyIndices,
        Map<Integer, Double> confidence,
        Duration executionTime,
        String errorMessage
) {

    public DetectionResult {
        if (detectorName == null || detectorName.isBlank()) {
            throw new IllegalArgumentException("detectorName must be provided");
        }
        if (category == null || status == null) {
            throw new IllegalArgumentException("category and status must be provided");
        }
        executionTime = executionTime == null ? Duration.ZERO : executionTime;
        if (status == DetectionStatus.SUCCESS) {
            if (errorMessage != null) {
                throw new IllegalArgumentException("successful result cannot carry an error message");
            }
            anomalyIndices = Collections.unmodifiableSortedSet(new TreeSet<>(anomalyIndices == null ? Set.of() : anomalyIndices));
            confidence = Collections.unmodifiableMap(new TreeMap<>(confidence == null ? Map.of() : confidence));
        } else {
            if (anomalyIndices != null && !anomalyIndices.isEmpty()) {
                throw new IllegalArgumentException("non-successful result cannot carry anomalies");
            }
            if (errorMessage == null || errorMessage.isBlank()) {
                throw new IllegalArgumentException("non-successful result must carry an error message");
            }
            anomalyIndices = Collections.emptySortedSet();
            confidence = Map.of();
        }
    }

    public static DetectionResult success(String name, DetectorCategory category, Set<Integer> indices,
                                          Map<Integer, Double> confidence, Duration elapsed) {
        return new DetectionResult(name, category, DetectionStatus.SUCCESS, new TreeSet<>(indices), confidence, elapsed, null);
    }

    public static DetectionResult failed(String name, DetectorCategory category, Duration elapsed, String message) {
        return new DetectionResult(name, category, DetectionStatus.FAILED, null, null, elapsed, message);
    }

    public static DetectionResult timedOut(String name, DetectorCategory category, Duration elapsed, String message) {
        return new DetectionResult(name, category, DetectionStatus.TIMED_OUT, null, null, elapsed, message);
    }

    public static DetectionResult skipped(String name, DetectorCategory category, String message) {
        return skipped(name, category, Duration.ZERO, message);
    }

    public static DetectionResult skipped(String name, DetectorCategory category, Duration elapsed, String message) {
        return new DetectionResult(name, category, DetectionStatus.SKIPPED, null, null, elapsed, message);
    }

    public boolean successful() {
        return status == DetectionStatus.SUCCESS;
    }

    public int anomalyCount() {
        return anomalyIndices.size();
    }
}

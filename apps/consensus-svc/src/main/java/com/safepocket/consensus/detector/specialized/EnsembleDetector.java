package com.safepocket.consensus.detector.specialized;

import com.safepocket.consensus.detector.NumericMatrix;
import com.safepocket.consensus.detector.ScoringDetector;
import com.safepocket.consensus.model.DetectionConfig;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weighted average of the fuzzy, expert-system, time-series and genetic scores.
 */
public class EnsembleDetector extends ScoringDetector {

    private final Map<ScoringDetector, Double> members;

    public EnsembleDetector() {
        this(defaultMembers());
    }

    public EnsembleDetector(Map<ScoringDetector, Double> members) {
        super(0.5d);
        if (members.isEmpty()) {
            throw new IllegalArgumentException("ensemble needs at least one member");
        }
        this.members = new LinkedHashMap<>(members);
    }

    private static Map<ScoringDetector, Double> defaultMembers() {
        Map<ScoringDetector, Double> members = new LinkedHashMap<>();
        members.put(new FuzzyLogicDetector(), 0.25d);
        members.put(new ExpertSystemDetector(), 0.25d);
        members.put(new TimeSeriesDetector(), 0.25d);
        members.put(new GeneticAlgorithmDetector(15, 8), 0.25d);
        return members;
    }

    @Override
    public double[] score(NumericMatrix matrix, DetectionConfig config) {
        double[] combined = new double[matrix.rowCount()];
        for (Map.Entry<ScoringDetector, Double> member : members.entrySet()) {
            double[] scores = member.getKey().score(matrix, config);
            for (int i = 0; i < combined.length; i++) {
                combined[i] += member.getValue() * scores[i];
            }
        }
        return combined;
    }
}

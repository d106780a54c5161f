package com.safepocket.consensus.detector.specialized;

import com.safepocket.consensus.detector.DependencyProbe;
import com.safepocket.consensus.detector.DependencyUnavailableException;
import com.safepocket.consensus.detector.NeuralBackend;
import com.safepocket.consensus.detector.NumericMatrix;
import com.safepocket.consensus.detector.ScoringDetector;
import com.safepocket.consensus.model.DetectionConfig;
import java.util.function.Supplier;

public class NeuralSymbolicDetector extends ScoringDetector {

    private final Supplier<NeuralBackend> backend;

    public NeuralSymbolicDetector(Supplier<NeuralBackend> backend) {
        super(0.5d);
        this.backend = backend;
    }

    @Override
    public double[] score(NumericMatrix matrix, DetectionConfig config) {
        NeuralBackend neural = backend.get();
        if (neural == null) {
            throw new DependencyUnavailableException(DependencyProbe.DEEP_LEARNING, "deep-learning backend not available");
        }
        return neural.neuralScores(matrix.standardized(), config.randomSeed());
    }
}

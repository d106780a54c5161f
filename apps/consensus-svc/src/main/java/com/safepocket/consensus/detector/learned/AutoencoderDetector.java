package com.safepocket.consensus.detector.learned;

import com.safepocket.consensus.detector.DependencyProbe;
import com.safepocket.consensus.detector.DependencyUnavailableException;
import com.safepocket.consensus.detector.DetectorSupport;
import com.safepocket.consensus.detector.NeuralBackend;
import com.safepocket.consensus.detector.NumericMatrix;
import com.safepocket.consensus.detector.ScoringDetector;
import com.safepocket.consensus.model.DetectionConfig;
import java.util.function.Supplier;

/**
 * Reconstruction error from the deep-learning backend, flagged above its 95th percentile.
 * Scores are errors scaled by the largest error.
 */
public class AutoencoderDetector extends ScoringDetector {

    private final Supplier<NeuralBackend> backend;

    public AutoencoderDetector(Supplier<NeuralBackend> backend) {
        super(0d);
        this.backend = backend;
    }

    @Override
    public double[] score(NumericMatrix matrix, DetectionConfig config) {
        NeuralBackend neural = backend.get();
        if (neural == null) {
            throw new DependencyUnavailableException(DependencyProbe.DEEP_LEARNING, "deep-learning backend not available");
        }
        double[] errors = neural.reconstructionErrors(matrix.standardized(), config.randomSeed());
        double max = 0d;
        for (double error : errors) {
            max = Math.max(max, error);
        }
        double[] scaled = new double[errors.length];
        for (int i = 0; i < errors.length; i++) {
            scaled[i] = max == 0 ? 0d : errors[i] / max;
        }
        return scaled;
    }

    @Override
    protected double threshold(double[] scores) {
        double[] finite = DetectorSupport.finite(scores);
        return finite.length == 0 ? 1d : DetectorSupport.percentile(finite, 95);
    }
}

package com.safepocket.consensus.detector;

/**
 * Deep-learning runtime behind the {@value DependencyProbe#DEEP_LEARNING} capability.
 * No implementation ships with the service; registering one as a bean enables the
 * autoencoder and neural-symbolic detectors.
 */
public interface NeuralBackend {

    /**
     * Per-row reconstruction error of an autoencoder trained on {@code features}.
     */
    double[] reconstructionErrors(double[][] features, long seed);

    /**
     * Per-row scores in [0, 1] from a shallow network trained on {@code features}.
     */
    double[] neuralScores(double[][] features, long seed);
}

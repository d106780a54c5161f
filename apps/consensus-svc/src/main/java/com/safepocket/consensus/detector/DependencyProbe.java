package com.safepocket.consensus.detector;

@FunctionalInterface
public interface DependencyProbe {

    String DEEP_LEARNING = "deep-learning";

    boolean isAvailable(String dependency);
}

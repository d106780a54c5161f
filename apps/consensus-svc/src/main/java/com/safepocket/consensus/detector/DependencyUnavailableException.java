package com.safepocket.consensus.detector;

/**
 * A detector's external capability is missing in this environment. Recorded as {@code SKIPPED}.
 */
public class DependencyUnavailableException extends RuntimeException {

    private final String dependency;

    public DependencyUnavailableException(String dependency, String message) {
        super(message);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}

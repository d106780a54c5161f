package com.safepocket.consensus.detector;

import com.safepocket.consensus.model.DetectorCategory;
import java.time.Duration;
import java.util.Optional;

public record DetectorDescriptor(
        String name,
        DetectorCategory category,
        Detector detector,
        Optional<Duration> timeout,
        Optional<String> requiredDependency
) {

    public DetectorDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must be provided");
        }
        if (category == null) {
            throw new IllegalArgumentException("category must be provided");
        }
        if (detector == null) {
            throw new IllegalArgumentException("detector must be provided");
        }
        timeout = timeout == null ? Optional.empty() : timeout;
        requiredDependency = requiredDependency == null ? Optional.empty() : requiredDependency;
        if (timeout.filter(limit -> limit.isNegative() || limit.isZero()).isPresent()) {
            throw new IllegalArgumentException("timeout must be positive for " + name);
        }
    }

    public static DetectorDescriptor of(String name, DetectorCategory category, Detector detector) {
        return new DetectorDescriptor(name, category, detector, Optional.empty(), Optional.empty());
    }

    public DetectorDescriptor withTimeout(Duration limit) {
        return new DetectorDescriptor(name, category, detector, Optional.ofNullable(limit), requiredDependency);
    }

    public DetectorDescriptor requiring(String dependency) {
        return new DetectorDescriptor(name, category, detector, timeout, Optional.ofNullable(dependency));
    }
}

package com.safepocket.consensus.detector;

import com.safepocket.consensus.model.DetectorCategory;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, name-unique set of detectors to execute. Read-only after construction.
 */
public final class DetectorRegistry {

    private final List<DetectorDescriptor> descriptors;

    public DetectorRegistry(List<DetectorDescriptor> descriptors) {
        Set<String> names = new HashSet<>();
        for (DetectorDescriptor descriptor : descriptors) {
            if (!names.add(descriptor.name())) {
                throw new ConfigurationException("duplicate detector name '" + descriptor.name() + "'");
            }
        }
        this.descriptors = List.copyOf(descriptors);
    }

    public List<DetectorDescriptor> list() {
        return descriptors;
    }

    public List<DetectorDescriptor> byCategory(DetectorCategory category) {
        return descriptors.stream()
                .filter(descriptor -> descriptor.category() == category)
                .toList();
    }

    public int size() {
        return descriptors.size();
    }
}

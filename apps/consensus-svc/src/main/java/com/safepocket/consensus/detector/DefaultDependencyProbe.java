package com.safepocket.consensus.detector;

import com.safepocket.consensus.config.ConsensusProperties;
import java.util.Set;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

@Component
public class DefaultDependencyProbe implements DependencyProbe {

    private final ObjectProvider<NeuralBackend> neuralBackend;
    private final Set<String> disabled;

    public DefaultDependencyProbe(ObjectProvider<NeuralBackend> neuralBackend, ConsensusProperties properties) {
        this.neuralBackend = neuralBackend;
        this.disabled = properties.dependencies().disabled();
    }

    @Override
    public boolean isAvailable(String dependency) {
        if (dependency == null) {
            return true;
        }
        if (disabled.contains(dependency)) {
            return false;
        }
        if (DEEP_LEARNING.equals(dependency)) {
            return neuralBackend.getIfAvailable() != null;
        }
        return false;
    }
}

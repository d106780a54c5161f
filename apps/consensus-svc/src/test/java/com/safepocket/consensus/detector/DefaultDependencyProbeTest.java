package com.safepocket.consensus.detector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.safepocket.consensus.config.ConsensusProperties;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

class DefaultDependencyProbeTest {

    @SuppressWarnings("unchecked")
    private final ObjectProvider<NeuralBackend> provider = mock(ObjectProvider.class);

    @Test
    void deepLearningRequiresABackendBean() {
        when(provider.getIfAvailable()).thenReturn(null);
        DefaultDependencyProbe probe = new DefaultDependencyProbe(provider, new ConsensusProperties());

        assertThat(probe.isAvailable(DependencyProbe.DEEP_LEARNING)).isFalse();
        assertThat(probe.isAvailable(null)).isTrue();
        assertThat(probe.isAvailable("gpu")).isFalse();
    }

    @Test
    void disabledCapabilityWinsOverBackend() {
        when(provider.getIfAvailable()).thenReturn(mock(NeuralBackend.class));
        ConsensusProperties properties = new ConsensusProperties(null, null, null, null, null, null, null, null, null, null, null,
                new ConsensusProperties.Dependencies(Set.of(DependencyProbe.DEEP_LEARNING)));

        assertThat(new DefaultDependencyProbe(provider, new ConsensusProperties()).isAvailable(DependencyProbe.DEEP_LEARNING)).isTrue();
        assertThat(new DefaultDependencyProbe(provider, properties).isAvailable(DependencyProbe.DEEP_LEARNING)).isFalse();
    }
}

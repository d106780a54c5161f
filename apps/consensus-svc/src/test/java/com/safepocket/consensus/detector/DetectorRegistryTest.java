package com.safepocket.consensus.detector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.safepocket.consensus.model.DetectionOutput;
import com.safepocket.consensus.model.DetectorCategory;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class DetectorRegistryTest {

    private static final Detector NOTHING = (dataset, config) -> DetectionOutput.of(List.of());

    @Test
    void keepsRegistrationOrder() {
        DetectorRegistry registry = new DetectorRegistry(List.of(
                DetectorDescriptor.of("b", DetectorCategory.LEARNED, NOTHING),
                DetectorDescriptor.of("a", DetectorCategory.TRADITIONAL, NOTHING),
                DetectorDescriptor.of("c", DetectorCategory.LEARNED, NOTHING)
        ));

        assertThat(registry.list()).extracting(DetectorDescriptor::name).containsExactly("b", "a", "c");
        assertThat(registry.byCategory(DetectorCategory.LEARNED)).extracting(DetectorDescriptor::name).containsExactly("b", "c");
        assertThat(registry.size()).isEqualTo(3);
    }

    @Test
    void rejectsDuplicateNames() {
        assertThatThrownBy(() -> new DetectorRegistry(List.of(
                DetectorDescriptor.of("iqr", DetectorCategory.TRADITIONAL, NOTHING),
                DetectorDescriptor.of("iqr", DetectorCategory.LEARNED, NOTHING)
        )))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("iqr");
    }

    @Test
    void descriptorRejectsNonPositiveTimeout() {
        DetectorDescriptor descriptor = DetectorDescriptor.of("iqr", DetectorCategory.TRADITIONAL, NOTHING);

        assertThatThrownBy(() -> descriptor.withTimeout(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThat(descriptor.withTimeout(Duration.ofSeconds(1)).timeout()).contains(Duration.ofSeconds(1));
    }
}

package com.safepocket.consensus.detector;

import static org.assertj.core.api.Assertions.assertThat;

import com.safepocket.consensus.config.ConsensusProperties;
import com.safepocket.consensus.model.DetectorCategory;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DetectorCatalogTest {

    @Test
    void registersBuiltInDetectorsInExecutionOrder() {
        DetectorRegistry registry = DetectorCatalog.registry(new ConsensusProperties(), () -> null);

        assertThat(registry.list()).extracting(DetectorDescriptor::name).containsExactly(
                "rule_based", "iqr", "z_score",
                "isolation_forest", "kmeans", "autoencoder",
                "fuzzy_logic", "expert_system", "time_series", "genetic_algorithm", "ensemble_ai", "neural_symbolic");
        assertThat(registry.byCategory(DetectorCategory.TRADITIONAL)).hasSize(3);
        assertThat(registry.byCategory(DetectorCategory.LEARNED)).hasSize(3);
        assertThat(registry.byCategory(DetectorCategory.SPECIALIZED)).hasSize(6);
    }

    @Test
    void deepLearningDetectorsDeclareTheirDependency() {
        DetectorRegistry registry = DetectorCatalog.registry(new ConsensusProperties(), () -> null);

        assertThat(registry.list())
                .filteredOn(descriptor -> descriptor.requiredDependency().isPresent())
                .extracting(DetectorDescriptor::name)
                .containsExactly("autoencoder", "neural_symbolic");
    }

    @Test
    void appliesEnabledFlagsAndTimeouts() {
        ConsensusProperties properties = new ConsensusProperties(null, null, null, Duration.ofSeconds(30), null,
                null, null, null, null,
                Map.of(
                        "geneticalgorithm", new ConsensusProperties.DetectorSettings(null, Duration.ofSeconds(2)),
                        "kmeans", new ConsensusProperties.DetectorSettings(false, null)
                ),
                null, null);

        DetectorRegistry registry = DetectorCatalog.registry(properties, () -> null);

        assertThat(registry.list()).extracting(DetectorDescriptor::name).doesNotContain("kmeans");
        DetectorDescriptor genetic = registry.list().stream().filter(d -> d.name().equals("genetic_algorithm")).findFirst().orElseThrow();
        DetectorDescriptor iqr = registry.list().stream().filter(d -> d.name().equals("iqr")).findFirst().orElseThrow();
        assertThat(genetic.timeout()).contains(Duration.ofSeconds(2));
        assertThat(iqr.timeout()).contains(Duration.ofSeconds(30));
    }
}

package com.safepocket.consensus.detector;

import com.safepocket.consensus.config.ConsensusProperties;
import com.safepocket.consensus.detector.learned.AutoencoderDetector;
import com.safepocket.consensus.detector.learned.IsolationForestDetector;
import com.safepocket.consensus.detector.learned.KMeansDetector;
import com.safepocket.consensus.detector.specialized.EnsembleDetector;
import com.safepocket.consensus.detector.specialized.ExpertSystemDetector;
import com.safepocket.consensus.detector.specialized.FuzzyLogicDetector;
import com.safepocket.consensus.detector.specialized.GeneticAlgorithmDetector;
import com.safepocket.consensus.detector.specialized.NeuralSymbolicDetector;
import com.safepocket.consensus.detector.specialized.TimeSeriesDetector;
import com.safepocket.consensus.detector.traditional.IqrDetector;
import com.safepocket.consensus.detector.traditional.RuleBasedDetector;
import com.safepocket.consensus.detector.traditional.ZScoreDetector;
import com.safepocket.consensus.model.DetectorCategory;
import java.util.List;
import java.util.function.Supplier;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DetectorCatalog {

    @Bean
    public DetectorRegistry detectorRegistry(ConsensusProperties properties, ObjectProvider<NeuralBackend> neuralBackend) {
        return registry(properties, neuralBackend::getIfAvailable);
    }

    /**
     * Built-in detectors in execution order, minus the disabled ones, with configured timeouts applied.
     */
    public static DetectorRegistry registry(ConsensusProperties properties, Supplier<NeuralBackend> neuralBackend) {
        return new DetectorRegistry(builtIn(neuralBackend).stream()
                .filter(descriptor -> properties.isEnabled(descriptor.name()))
                .map(descriptor -> properties.timeoutFor(descriptor.name())
                        .map(descriptor::withTimeout)
                        .orElse(descriptor))
                .toList());
    }

    public static List<DetectorDescriptor> builtIn(Supplier<NeuralBackend> neuralBackend) {
        return List.of(
                DetectorDescriptor.of("rule_based", DetectorCategory.TRADITIONAL, new RuleBasedDetector()),
                DetectorDescriptor.of("iqr", DetectorCategory.TRADITIONAL, new IqrDetector()),
                DetectorDescriptor.of("z_score", DetectorCategory.TRADITIONAL, new ZScoreDetector()),
                DetectorDescriptor.of("isolation_forest", DetectorCategory.LEARNED, new IsolationForestDetector()),
                DetectorDescriptor.of("kmeans", DetectorCategory.LEARNED, new KMeansDetector()),
                DetectorDescriptor.of("autoencoder", DetectorCategory.LEARNED, new AutoencoderDetector(neuralBackend))
                        .requiring(DependencyProbe.DEEP_LEARNING),
                DetectorDescriptor.of("fuzzy_logic", DetectorCategory.SPECIALIZED, new FuzzyLogicDetector()),
                DetectorDescriptor.of("expert_system", DetectorCategory.SPECIALIZED, new ExpertSystemDetector()),
                DetectorDescriptor.of("time_series", DetectorCategory.SPECIALIZED, new TimeSeriesDetector()),
                DetectorDescriptor.of("genetic_algorithm", DetectorCategory.SPECIALIZED, new GeneticAlgorithmDetector()),
                DetectorDescriptor.of("ensemble_ai", DetectorCategory.SPECIALIZED, new EnsembleDetector()),
                DetectorDescriptor.of("neural_symbolic", DetectorCategory.SPECIALIZED, new NeuralSymbolicDetector(neuralBackend))
                        .requiring(DependencyProbe.DEEP_LEARNING)
        );
    }
}

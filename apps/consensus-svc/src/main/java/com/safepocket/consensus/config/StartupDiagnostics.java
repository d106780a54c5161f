package com.safepocket.consensus.config;

import com.safepocket.consensus.detector.DependencyProbe;
import com.safepocket.consensus.detector.DetectorDescriptor;
import com.safepocket.consensus.detector.DetectorRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final ConsensusProperties props;
    private final DetectorRegistry registry;
    private final DependencyProbe dependencyProbe;

    public StartupDiagnostics(ConsensusProperties props, DetectorRegistry registry, DependencyProbe dependencyProbe) {
        this.props = props;
        this.registry = registry;
        this.dependencyProbe = dependencyProbe;
    }

    @PostConstruct
    void logConfig() {
        log.info("Startup diagnostics: detectors={}, parallelism={}, consensusThreshold={}, maxFeatureColumns={}, runTimeout={}, defaultDetectorTimeout={}",
                registry.size(), props.parallelism(), props.consensusThreshold(), props.maxFeatureColumns(),
                props.runTimeout(), props.defaultDetectorTimeout());
        log.info("Dependency availability: {}={}", DependencyProbe.DEEP_LEARNING, dependencyProbe.isAvailable(DependencyProbe.DEEP_LEARNING));
        for (DetectorDescriptor descriptor : registry.list()) {
            log.debug("Detector registered: name='{}', category={}, timeout={}, requires={}",
                    descriptor.name(), descriptor.category(), descriptor.timeout().orElse(null),
                    descriptor.requiredDependency().orElse("-"));
        }
    }
}

package com.safepocket.consensus.controller;

import com.safepocket.consensus.controller.dto.DetectorResponseDto;
import com.safepocket.consensus.detector.DependencyProbe;
import com.safepocket.consensus.detector.DetectorDescriptor;
import com.safepocket.consensus.detector.DetectorRegistry;
import java.time.Duration;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/detectors")
public class DetectorController {

    private final DetectorRegistry registry;
    private final DependencyProbe dependencyProbe;

    public DetectorController(DetectorRegistry registry, DependencyProbe dependencyProbe) {
        this.registry = registry;
        this.dependencyProbe = dependencyProbe;
    }

    @GetMapping
    public List<DetectorResponseDto> list() {
        return registry.list().stream().map(this::map).toList();
    }

    private DetectorResponseDto map(DetectorDescriptor descriptor) {
        String dependency = descriptor.requiredDependency().orElse(null);
        return new DetectorResponseDto(
                descriptor.name(),
                descriptor.category().name(),
                dependency,
                dependencyProbe.isAvailable(dependency),
                descriptor.timeout().map(Duration::toMillis).orElse(null)
        );
    }
}

package com.safepocket.consensus.health;

import com.safepocket.consensus.detector.DependencyProbe;
import com.safepocket.consensus.detector.DetectorRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness probe for the HTTP mode. Also reports how many detectors are registered and whether
 * the deep-learning capability is available, since both decide what a run can produce.
 */
@RestController
public class HealthzController {

    private final DetectorRegistry registry;
    private final DependencyProbe dependencyProbe;

    public HealthzController(DetectorRegistry registry, DependencyProbe dependencyProbe) {
        this.registry = registry;
        this.dependencyProbe = dependencyProbe;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> healthz() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("detectors", registry.size());
        body.put("deep_learning", dependencyProbe.isAvailable(DependencyProbe.DEEP_LEARNING));
        return body;
    }
}

package com.safepocket.consensus.service;

import com.safepocket.consensus.comparison.Agreement;
import com.safepocket.consensus.comparison.ComparisonEngine;
import com.safepocket.consensus.config.ConsensusProperties;
import com.safepocket.consensus.detector.DetectorRegistry;
import com.safepocket.consensus.execution.ExecutionHarness;
import com.safepocket.consensus.model.ComparisonReport;
import com.safepocket.consensus.model.Dataset;
import com.safepocket.consensus.model.DetectionConfig;
import com.safepocket.consensus.model.DetectionResult;
import com.safepocket.consensus.report.ReportBuilder;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * One comparison run: execute every registered detector, compute agreement, assemble the report.
 * Each run is independent; nothing is cached between runs.
 */
@Service
public class ConsensusRunService {

    static final String RUN_ID_KEY = "run_id";

    private static final Logger log = LoggerFactory.getLogger(ConsensusRunService.class);

    private final DetectorRegistry registry;
    private final ExecutionHarness harness;
    private final ComparisonEngine comparisonEngine;
    private final ReportBuilder reportBuilder;
    private final ConsensusProperties properties;
    private final Clock clock;

    @Autowired
    public ConsensusRunService(
            DetectorRegistry registry,
            ExecutionHarness harness,
            ComparisonEngine comparisonEngine,
            ReportBuilder reportBuilder,
            ConsensusProperties properties
    ) {
        this(registry, harness, comparisonEngine, reportBuilder, properties, Clock.systemUTC());
    }

    ConsensusRunService(
            DetectorRegistry registry,
            ExecutionHarness harness,
            ComparisonEngine comparisonEngine,
            ReportBuilder reportBuilder,
            ConsensusProperties properties,
            Clock clock
    ) {
        this.registry = registry;
        this.harness = harness;
        this.comparisonEngine = comparisonEngine;
        this.reportBuilder = reportBuilder;
        this.properties = properties;
        this.clock = clock;
    }

    public ComparisonReport run(Dataset dataset) {
        UUID runId = UUID.randomUUID();
        MDC.put(RUN_ID_KEY, runId.toString());
        try {
            List<String> features = dataset.featureColumns(properties.maxFeatureColumns());
            DetectionConfig config = properties.detectionConfig(features);
            log.info("consensus_run_started runId={} source={} rows={} features={} detectors={}",
                    runId, dataset.source(), dataset.rowCount(), features, registry.size());

            List<DetectionResult> results = harness.run(dataset, registry, config);
            Agreement agreement = comparisonEngine.compare(results, properties.consensusThreshold());
            ComparisonReport report = reportBuilder.build(runId, Instant.now(clock), dataset, results, agreement);

            long successful = results.stream().filter(DetectionResult::successful).count();
            log.info("consensus_run runId={} detectors={} successful={} consensusComputable={} consensusRows={}",
                    runId, results.size(), successful, report.consensus().computable(), report.consensus().rows().size());
            return report;
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }

    public DetectorRegistry registry() {
        return registry;
    }
}

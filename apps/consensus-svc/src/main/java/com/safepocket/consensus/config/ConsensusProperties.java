package com.safepocket.consensus.config;

import com.safepocket.consensus.model.DetectionConfig;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "consensus")
public record ConsensusProperties(
        Integer maxFeatureColumns,
        Double consensusThreshold,
        Integer parallelism,
        Duration defaultDetectorTimeout,
        Duration runTimeout,
        Double iqrFactor,
        Double zScoreThreshold,
        Double contamination,
        Long randomSeed,
        Map<String, DetectorSettings> detectors,
        Rules rules,
        Dependencies dependencies
) {

    @ConstructorBinding
    public ConsensusProperties {
        if (maxFeatureColumns == null) {
            maxFeatureColumns = 4;
        }
        if (maxFeatureColumns <= 0) {
            throw new IllegalArgumentException("maxFeatureColumns must be positive");
        }
        if (consensusThreshold == null) {
            consensusThreshold = 0.5d;
        }
        if (consensusThreshold < 0 || consensusThreshold >= 1) {
            throw new IllegalArgumentException("consensusThreshold must be in [0, 1)");
        }
        if (parallelism == null) {
            parallelism = 4;
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
        requirePositive(defaultDetectorTimeout, "defaultDetectorTimeout");
        requirePositive(runTimeout, "runTimeout");
        iqrFactor = iqrFactor == null ? 1.5d : iqrFactor;
        zScoreThreshold = zScoreThreshold == null ? 2.5d : zScoreThreshold;
        contamination = contamination == null ? 0.05d : contamination;
        randomSeed = randomSeed == null ? 42L : randomSeed;
        detectors = detectors == null ? Map.of() : Map.copyOf(detectors);
        rules = rules == null ? new Rules(null, null, null) : rules;
        dependencies = dependencies == null ? new Dependencies(null) : dependencies;
    }

    public ConsensusProperties() {
        this(null, null, null, null, null, null, null, null, null, null, null, null);
    }

    private static void requirePositive(Duration duration, String field) {
        if (duration != null && (duration.isNegative() || duration.isZero())) {
            throw new IllegalArgumentException(field + " must be positive");
        }
    }

    public record DetectorSettings(Boolean enabled, Duration timeout) {
        public DetectorSettings {
            requirePositive(timeout, "timeout");
        }

        public boolean enabledFlag() {
            return enabled == null || enabled;
        }
    }

    public record Rules(
            List<String> requiredColumns,
            Map<String, RangeSetting> allowedRanges,
            Map<String, List<String>> allowedCategories
    ) {
        public Rules {
            requiredColumns = requiredColumns == null ? List.of() : List.copyOf(requiredColumns);
            allowedRanges = allowedRanges == null ? Map.of() : Map.copyOf(allowedRanges);
            allowedCategories = allowedCategories == null ? Map.of() : Map.copyOf(allowedCategories);
        }
    }

    public record RangeSetting(Double min, Double max) {
        public RangeSetting {
            if (min != null && max != null && min > max) {
                throw new IllegalArgumentException("range min must not exceed max");
            }
        }
    }

    public record Dependencies(Set<String> disabled) {
        public Dependencies {
            disabled = disabled == null ? Set.of() : Set.copyOf(disabled);
        }
    }

    /**
     * Settings for a detector name. Map keys lose their underscores during relaxed binding,
     * so lookups compare names with separators stripped.
     */
    public Optional<DetectorSettings> settingsFor(String detectorName) {
        String wanted = canonical(detectorName);
        return detectors.entrySet().stream()
                .filter(entry -> canonical(entry.getKey()).equals(wanted))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    public boolean isEnabled(String detectorName) {
        return settingsFor(detectorName).map(DetectorSettings::enabledFlag).orElse(true);
    }

    public Optional<Duration> timeoutFor(String detectorName) {
        return settingsFor(detectorName)
                .map(DetectorSettings::timeout)
                .or(() -> Optional.ofNullable(defaultDetectorTimeout));
    }

    public Optional<Duration> runTimeoutOption() {
        return Optional.ofNullable(runTimeout);
    }

    public DetectionConfig detectionConfig(List<String> featureColumns) {
        Map<String, DetectionConfig.Range> ranges = new LinkedHashMap<>();
        rules.allowedRanges().forEach((column, range) -> ranges.put(column, new DetectionConfig.Range(range.min(), range.max())));
        Map<String, Set<String>> categories = new LinkedHashMap<>();
        rules.allowedCategories().forEach((column, values) -> categories.put(column, new LinkedHashSet<>(values)));
        return new DetectionConfig(
                featureColumns,
                iqrFactor,
                zScoreThreshold,
                contamination,
                randomSeed,
                new DetectionConfig.Rules(rules.requiredColumns(), ranges, categories)
        );
    }

    private static String canonical(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}

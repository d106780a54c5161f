package com.safepocket.consensus.detector;

import com.safepocket.consensus.model.Dataset;
import com.safepocket.consensus.model.DetectionConfig;
import com.safepocket.consensus.model.DetectionOutput;

/**
 * One anomaly detection technique. Implementations must not mutate the dataset and must
 * respond to thread interruption where they loop for long.
 */
@FunctionalInterface
public interface Detector {

    DetectionOutput detect(Dataset dataset, DetectionConfig config);
}

package com.safepocket.consensus.execution;

import java.time.Duration;

public class DetectorTimeoutException extends RuntimeException {

    public DetectorTimeoutException(String detectorName, Duration limit) {
        super("detector '" + detectorName + "' exceeded timeout of " + limit.toMillis() + "ms");
    }

    public DetectorTimeoutException(String message) {
        super(message);
    }
}

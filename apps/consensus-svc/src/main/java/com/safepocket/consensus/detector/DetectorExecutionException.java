package com.safepocket.consensus.detector;

public class DetectorExecutionException extends RuntimeException {

    public DetectorExecutionException(String message) {
        super(message);
    }

    public DetectorExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}

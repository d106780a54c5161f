package com.safepocket.consensus.model;

public enum DetectionStatus {
    SUCCESS,
    FAILED,
    TIMED_OUT,
    SKIPPED
}

package com.safepocket.consensus.model;

public enum DetectorCategory {
    TRADITIONAL,
    LEARNED,
    SPECIALIZED
}

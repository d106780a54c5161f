package com.safepocket.consensus.controller.dto;

public record DetectorResponseDto(
        String name,
        String category,
        String requiredDependency,
        boolean dependencyAvailable,
        Long timeoutMs
) {
}

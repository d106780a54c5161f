package com.safepocket.consensus.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.safepocket.consensus.controller.TraceIdFilter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.MDC;

/**
 * Error body for every non-2xx response. Empty details are left out of the JSON.
 */
public record ErrorResponseDto(
        String code,
        String message,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> details,
        String traceId
) {

    public ErrorResponseDto {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * Builds the body for the current request, tagged with its trace id.
     */
    public static ErrorResponseDto forCurrentRequest(String code, String message, Map<String, Object> details) {
        return new ErrorResponseDto(code, message, details, MDC.get(TraceIdFilter.TRACE_KEY));
    }
}

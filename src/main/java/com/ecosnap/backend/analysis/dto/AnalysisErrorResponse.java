package com.ecosnap.backend.analysis.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisErrorResponse(
        String errorCode,
        String message,
        String requestId
) {
}

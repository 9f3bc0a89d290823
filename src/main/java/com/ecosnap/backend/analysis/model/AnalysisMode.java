package com.ecosnap.backend.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AnalysisMode {
    ENVIRONMENTAL_ONLY,
    FOOD_ONLY,
    COMBINED;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}

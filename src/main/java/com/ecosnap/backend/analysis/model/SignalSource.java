package com.ecosnap.backend.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SignalSource {
    AI,
    HEURISTIC;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}

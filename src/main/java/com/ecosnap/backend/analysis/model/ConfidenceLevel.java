package com.ecosnap.backend.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConfidenceLevel {
    LOW,
    MEDIUM,
    HIGH;

    public ConfidenceLevel downgrade() {
        return this == HIGH ? MEDIUM : LOW;
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}

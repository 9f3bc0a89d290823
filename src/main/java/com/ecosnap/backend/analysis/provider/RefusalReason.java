package com.ecosnap.backend.analysis.provider;

public enum RefusalReason {
    SAFETY,
    RECITATION,
    HARM_CATEGORY;

    public String errorCode() {
        return "PROVIDER_REFUSED_" + name();
    }
}

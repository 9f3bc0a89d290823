package com.ecosnap.backend.analysis.enrichment;

import java.time.Duration;

public class EnrichmentTimeoutException extends EnrichmentException {

    public static final String CODE = "PROVIDER_TIMEOUT";

    public EnrichmentTimeoutException(Duration deadline) {
        super(CODE, "enrichment exceeded deadline " + deadline.toMillis() + "ms", null);
    }

    public EnrichmentTimeoutException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}

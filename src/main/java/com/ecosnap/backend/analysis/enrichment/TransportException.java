package com.ecosnap.backend.analysis.enrichment;

/**
 * 網路/HTTP/供應商拒答。code 沿用 PROVIDER_* 命名（見 {@link EnrichmentErrorMapper}）。
 */
public class TransportException extends EnrichmentException {

    private final Integer retryAfterSec;

    public TransportException(String code, String message, Integer retryAfterSec, Throwable cause) {
        super(code, message, cause);
        this.retryAfterSec = retryAfterSec;
    }

    public TransportException(String code, String message) {
        this(code, message, null, null);
    }

    public Integer retryAfterSec() {
        return retryAfterSec;
    }
}

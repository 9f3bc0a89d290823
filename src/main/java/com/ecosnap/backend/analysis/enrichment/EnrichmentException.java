package com.ecosnap.backend.analysis.enrichment;

import lombok.Getter;

/**
 * Gateway 的失敗。一律在引擎內被攔下改走 fallback，不會傳到呼叫端。
 */
@Getter
public abstract class EnrichmentException extends RuntimeException {

    private final String code;

    protected EnrichmentException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}

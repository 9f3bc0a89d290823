package com.ecosnap.backend.analysis.enrichment;

/** 模型輸出不是 JSON，或沒有任何一個欄位通過驗證 */
public class SchemaValidationException extends EnrichmentException {

    public static final String CODE = "AI_SCHEMA_INVALID";

    public SchemaValidationException(String message) {
        super(CODE, message, null);
    }

    public SchemaValidationException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}

package com.ecosnap.backend.analysis.enrichment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class EnrichmentTelemetry {

    public void ok(String provider, String modelId, String fingerprint, long latencyMs, int fieldsAccepted) {
        log.info("enrichment_call status=OK provider={} modelId={} fp={} latencyMs={} fieldsAccepted={}",
                safe(provider), safe(modelId), shortFp(fingerprint), latencyMs, fieldsAccepted);
    }

    public void fail(String provider, String modelId, String fingerprint, long latencyMs,
                     String errorCode, Integer retryAfterSec) {
        log.warn("enrichment_call status=FAIL provider={} modelId={} fp={} latencyMs={} errorCode={} retryAfterSec={}",
                safe(provider), safe(modelId), shortFp(fingerprint), latencyMs,
                safe(errorCode), n(retryAfterSec));
    }

    public void fallback(String fingerprint, String reason) {
        log.info("enrichment_fallback fp={} reason={}", shortFp(fingerprint), safe(reason));
    }

    private static String safe(String s) { return (s == null || s.isBlank()) ? "UNKNOWN" : s; }
    private static Object n(Integer v) { return v == null ? "NA" : v; }

    // 指紋只印前 12 碼，夠對 log
    private static String shortFp(String fp) {
        if (fp == null || fp.isBlank()) return "NA";
        return fp.length() > 12 ? fp.substring(0, 12) : fp;
    }
}

package com.ecosnap.backend.analysis.enrichment;

import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * 任意 Throwable → 統一錯誤碼，並轉成對應的 {@link EnrichmentException}。
 */
public final class EnrichmentErrorMapper {

    private EnrichmentErrorMapper() {}

    public record Mapped(String code, String message, Integer retryAfterSec) {}

    public static EnrichmentException toException(Throwable e) {
        if (e instanceof EnrichmentException ee) return ee;

        Mapped m = map(e);
        if (EnrichmentTimeoutException.CODE.equals(m.code())) {
            return new EnrichmentTimeoutException(m.message(), e);
        }
        return new TransportException(m.code(), m.message(), m.retryAfterSec(), e);
    }

    public static Mapped map(Throwable e) {
        if (e == null) return new Mapped("PROVIDER_FAILED", null, null);

        if (e instanceof EnrichmentException ee) {
            Integer ra = (ee instanceof TransportException te) ? te.retryAfterSec() : null;
            return new Mapped(ee.getCode(), safeMsg(ee), ra);
        }

        // ✅ 先攔 timeout（含 cause chain）
        if (isTimeoutThrowable(e)) {
            return new Mapped("PROVIDER_TIMEOUT", safeMsg(e), null);
        }

        // ✅ 自己 throw 的明確 code
        if (e instanceof IllegalStateException ise) {
            String m = ise.getMessage();
            if (m != null && (m.startsWith("PROVIDER_") || m.startsWith("GEMINI_"))) {
                return new Mapped(m, safeMsg(ise), null);
            }
        }

        // ✅ RestClient 4xx/5xx
        if (e instanceof RestClientResponseException re) {
            var sc = re.getStatusCode();
            int status = sc.value();

            Integer retryAfter = null;
            HttpHeaders headers = re.getResponseHeaders();
            if (headers != null) {
                retryAfter = parseRetryAfterSecondsOrNull(headers.getFirst("Retry-After"));
            }

            String body = nullSafe(re.getResponseBodyAsString());
            String lower = body.toLowerCase(Locale.ROOT);
            if (lower.contains("safety") || lower.contains("blocked") || lower.contains("recitation")) {
                return new Mapped("PROVIDER_BLOCKED", "blocked by provider policy", null);
            }

            if (status == 401 || status == 403) return new Mapped("PROVIDER_AUTH_FAILED", "auth failed", null);
            if (status == 429) return new Mapped("PROVIDER_RATE_LIMITED", "rate limited", retryAfter);
            if (status == 408) return new Mapped("PROVIDER_TIMEOUT", "timeout", retryAfter);

            if (sc.is5xxServerError()) return new Mapped("PROVIDER_UPSTREAM_5XX", "upstream 5xx", retryAfter);
            if (sc.is4xxClientError()) return new Mapped("PROVIDER_BAD_REQUEST", "bad request", null);

            return new Mapped("PROVIDER_FAILED", "http error", retryAfter);
        }

        // timeout 已在上面擋掉，這裡是純 network error
        if (e instanceof ResourceAccessException rae) {
            return new Mapped("PROVIDER_NETWORK_ERROR", safeMsg(rae), null);
        }

        if (e instanceof RestClientException rce) {
            // 沒有 status code（反序列化失敗、連線中斷）
            return new Mapped("PROVIDER_CLIENT_ERROR", safeMsg(rce), null);
        }

        return new Mapped("PROVIDER_FAILED", safeMsg(e), null);
    }

    private static Integer parseRetryAfterSecondsOrNull(String ra) {
        if (ra == null || ra.isBlank()) return null;
        try {
            int v = Integer.parseInt(ra.trim());
            return Math.max(0, Math.min(v, 3600)); // 上限 1 小時
        } catch (NumberFormatException ignored) {
            return null; // HTTP-date 格式不處理
        }
    }

    /**
     * timeout 判斷（含 cause chain）。RestClient 常把 SocketTimeoutException 包在 ResourceAccessException 裡。
     */
    private static boolean isTimeoutThrowable(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof SocketTimeoutException) return true;
            if (c instanceof TimeoutException) return true;
            if ("java.net.http.HttpTimeoutException".equals(c.getClass().getName())) return true;

            String m = c.getMessage();
            if (m != null) {
                String s = m.toLowerCase(Locale.ROOT);
                if (s.contains("timeout") || s.contains("timed out")) return true;
            }
        }
        return false;
    }

    private static String safeMsg(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }

    private static String nullSafe(String s) {
        return s == null ? "" : s;
    }
}

package com.ecosnap.backend.analysis.provider;

import com.ecosnap.backend.analysis.provider.config.GeminiProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 設定自檢（不打外網）：
 * - enabled=false → UP（刻意關閉，分析走 heuristic）
 * - enabled=true 但缺 key / baseUrl 不是 https / 沒有 model → DOWN
 */
@Component("gemini")
public class GeminiConfigHealthIndicator implements HealthIndicator {

    private final GeminiProperties props;

    public GeminiConfigHealthIndicator(GeminiProperties props) {
        this.props = props;
    }

    @Override
    public Health health() {
        if (!props.isEnabled()) {
            return Health.up()
                    .withDetail("provider", GeminiEnrichmentProvider.PROVIDER)
                    .withDetail("enabled", false)
                    .withDetail("mode", "HEURISTIC_ONLY")
                    .build();
        }

        String apiKey = props.getApiKey();
        String baseUrl = props.getBaseUrl();
        String model = props.getModel();

        boolean hasKey = apiKey != null && !apiKey.isBlank();
        boolean baseOk = baseUrl != null && !baseUrl.isBlank() && baseUrl.toLowerCase(Locale.ROOT).startsWith("https://");
        boolean modelOk = model != null && !model.isBlank();

        Health.Builder b;
        if (!hasKey) {
            b = Health.down().withDetail("reason", "GEMINI_API_KEY_MISSING");
        } else if (!baseOk) {
            b = Health.down().withDetail("reason", "GEMINI_BASE_URL_INVALID");
        } else if (!modelOk) {
            b = Health.down().withDetail("reason", "GEMINI_MODEL_MISSING");
        } else {
            b = Health.up();
        }

        // ✅ 不要輸出 apiKey
        return b.withDetail("provider", GeminiEnrichmentProvider.PROVIDER)
                .withDetail("enabled", true)
                .withDetail("baseUrl", safe(baseUrl))
                .withDetail("model", safe(model))
                .build();
    }

    private static String safe(String s) {
        return (s == null || s.isBlank()) ? "NA" : s;
    }
}

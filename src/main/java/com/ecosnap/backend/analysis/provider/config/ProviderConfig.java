package com.ecosnap.backend.analysis.provider.config;

import com.ecosnap.backend.analysis.enrichment.EnrichmentProvider;
import com.ecosnap.backend.analysis.provider.GeminiEnrichmentProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * enabled=false 時不建立任何 provider；gateway 會回報 AI_DISABLED，引擎直接走 fallback。
 */
@Configuration
@EnableConfigurationProperties(GeminiProperties.class)
public class ProviderConfig {

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.gemini", name = "enabled", havingValue = "true")
    public RestClient geminiRestClient(GeminiProperties props) {
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout((int) props.getConnectTimeout().toMillis());
        f.setReadTimeout((int) props.getReadTimeout().toMillis());

        return RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(f)
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.gemini", name = "enabled", havingValue = "true")
    public EnrichmentProvider geminiEnrichmentProvider(RestClient geminiRestClient, GeminiProperties props, ObjectMapper om) {
        // ✅ Fail-fast：啟動就抓到設定缺失
        String k = props.getApiKey();
        if (k == null || k.isBlank()) throw new IllegalStateException("GEMINI_API_KEY_MISSING");
        if (props.getBaseUrl() == null || props.getBaseUrl().isBlank()) throw new IllegalStateException("GEMINI_BASE_URL_MISSING");
        if (props.getModel() == null || props.getModel().isBlank()) throw new IllegalStateException("GEMINI_MODEL_MISSING");

        return new GeminiEnrichmentProvider(geminiRestClient, props, om);
    }
}

package com.ecosnap.backend.analysis.service;

import com.ecosnap.backend.analysis.ProductFixtures;
import com.ecosnap.backend.analysis.enrichment.EnrichmentProvider;
import com.ecosnap.backend.analysis.model.AnalysisMode;
import com.ecosnap.backend.analysis.model.AnalysisOptions;
import com.ecosnap.backend.analysis.model.UnifiedAnalysisResult;
import com.ecosnap.backend.analysis.normalize.NormalizationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.web.client.ResourceAccessException;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 整條 Spring wiring（cache 開啟），AI provider 用 mock 取代。
 * 每個 test 用不同商品名稱，避免共用 context 的 cache 互相影響。
 */
@ActiveProfiles("test")
@SpringBootTest(properties = "app.analysis.cache.enabled=true")
class SustainabilityAnalysisServiceTest {

    @Autowired SustainabilityAnalysisService service;

    @MockitoBean EnrichmentProvider provider;

    @BeforeEach
    void identity() {
        when(provider.providerCode()).thenReturn("GEMINI");
        when(provider.modelId()).thenReturn("gemini-test");
    }

    private static Map<String, Object> salad(String name) {
        Map<String, Object> raw = ProductFixtures.quinoaSaladRaw();
        raw.put("product_name", name);
        return raw;
    }

    @Test
    void ai_enriched_result_should_be_served_from_cache() throws Exception {
        when(provider.generate(any(), any())).thenReturn("{\"insights\":[\"Cached insight\"]}");
        Map<String, Object> raw = salad("Cache Hit Salad");

        UnifiedAnalysisResult first = service.analyze(raw);
        // key 寫法不同，但正規化後是同一個商品
        Map<String, Object> renamed = new LinkedHashMap<>(raw);
        renamed.remove("product_name");
        renamed.put("Product-Name", "Cache Hit Salad");
        UnifiedAnalysisResult second = service.analyze(renamed);

        assertThat(first.aiEnriched()).isTrue();
        assertThat(second).isSameAs(first);
        verify(provider, times(1)).generate(any(), any());
    }

    @Test
    void fallback_result_should_not_be_cached() throws Exception {
        when(provider.generate(any(), any())).thenThrow(new ResourceAccessException("Connection refused"));
        Map<String, Object> raw = salad("No Cache Salad");

        UnifiedAnalysisResult first = service.analyze(raw);
        UnifiedAnalysisResult second = service.analyze(raw);

        assertThat(first.aiEnriched()).isFalse();
        assertThat(first.enrichment().fallbackReason()).isEqualTo("PROVIDER_NETWORK_ERROR");
        assertThat(second).isEqualTo(first);
        verify(provider, times(2)).generate(any(), any());
    }

    @Test
    void environmental_option_should_be_part_of_cache_key() throws Exception {
        when(provider.generate(any(), any())).thenReturn("{\"impact_summary\":\"Low impact\"}");
        Map<String, Object> raw = salad("Option Key Salad");

        UnifiedAnalysisResult combined = service.analyze(raw, AnalysisOptions.DEFAULT);
        UnifiedAnalysisResult foodOnly = service.analyze(raw, new AnalysisOptions(false));

        assertThat(combined.analysisType()).isEqualTo(AnalysisMode.COMBINED);
        assertThat(foodOnly.analysisType()).isEqualTo(AnalysisMode.FOOD_ONLY);
        verify(provider, times(2)).generate(any(), any());
    }

    @Test
    void missing_name_should_throw_before_any_provider_call() throws Exception {
        assertThatThrownBy(() -> service.analyze(Map.of("brand", "Acme")))
                .isInstanceOf(NormalizationException.class);
        verify(provider, never()).generate(any(), any());
    }
}

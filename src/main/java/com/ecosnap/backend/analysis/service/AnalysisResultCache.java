package com.ecosnap.backend.analysis.service;

import com.ecosnap.backend.analysis.config.AnalysisCacheConfig;
import com.ecosnap.backend.analysis.model.AnalysisOptions;
import com.ecosnap.backend.analysis.model.ProductFacts;
import com.ecosnap.backend.analysis.model.UnifiedAnalysisResult;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

/**
 * 以 ProductFacts 指紋快取結果。只快取 AI 成功的結果；fallback 結果便宜，下次應該再試 AI。
 */
@Service
@RequiredArgsConstructor
public class AnalysisResultCache {

    private final SustainabilityEngine engine;

    @Cacheable(
            cacheNames = AnalysisCacheConfig.CACHE_NAME,
            cacheManager = "analysisCacheManager",
            key = "#facts.fingerprint() + '|' + #options.includeEnvironmental()",
            unless = "#result == null || !#result.aiEnriched()"
    )
    public UnifiedAnalysisResult analyze(ProductFacts facts, AnalysisOptions options) {
        return engine.analyze(facts, options);
    }
}

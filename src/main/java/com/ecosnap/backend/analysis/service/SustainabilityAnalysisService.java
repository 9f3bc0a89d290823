package com.ecosnap.backend.analysis.service;

import com.ecosnap.backend.analysis.model.AnalysisOptions;
import com.ecosnap.backend.analysis.model.ProductFacts;
import com.ecosnap.backend.analysis.model.UnifiedAnalysisResult;
import com.ecosnap.backend.analysis.normalize.NormalizationException;
import com.ecosnap.backend.analysis.normalize.ProductFactsNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * 對外入口：原始 payload → 結果。唯一會丟出去的是 {@link NormalizationException}。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SustainabilityAnalysisService {

    private final ProductFactsNormalizer normalizer;
    private final AnalysisResultCache resultCache;

    public UnifiedAnalysisResult analyze(Map<String, ?> raw) {
        return analyze(raw, AnalysisOptions.DEFAULT);
    }

    public UnifiedAnalysisResult analyze(Map<String, ?> raw, AnalysisOptions options) {
        ProductFacts facts = normalizer.normalize(raw);
        AnalysisOptions opts = (options == null) ? AnalysisOptions.DEFAULT : options;

        long t0 = System.nanoTime();
        UnifiedAnalysisResult r = resultCache.analyze(facts, opts);

        log.info("analysis_done type={} score={} grade={} confidence={} ai={} latencyMs={}",
                r.analysisType().wire(), r.unifiedScore(), r.sustainabilityGrade(),
                r.confidenceLevel().wire(), r.aiEnriched(), (System.nanoTime() - t0) / 1_000_000);
        return r;
    }
}

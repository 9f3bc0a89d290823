package com.ecosnap.backend.analysis.service;

import com.ecosnap.backend.analysis.aggregate.UnifiedAggregator;
import com.ecosnap.backend.analysis.enrichment.EnrichmentException;
import com.ecosnap.backend.analysis.enrichment.EnrichmentGateway;
import com.ecosnap.backend.analysis.enrichment.EnrichmentTelemetry;
import com.ecosnap.backend.analysis.enrichment.FallbackHeuristicProvider;
import com.ecosnap.backend.analysis.model.AnalysisOptions;
import com.ecosnap.backend.analysis.model.EnrichedSignals;
import com.ecosnap.backend.analysis.model.FoodAssessment;
import com.ecosnap.backend.analysis.model.HeuristicBaseline;
import com.ecosnap.backend.analysis.model.ProductFacts;
import com.ecosnap.backend.analysis.model.SubScoreSet;
import com.ecosnap.backend.analysis.model.UnifiedAnalysisResult;
import com.ecosnap.backend.analysis.scoring.EnvironmentalScorer;
import com.ecosnap.backend.analysis.scoring.HealthScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * scorers → enrichment（失敗就 fallback）→ aggregator。
 * 這一層以下的任何 enrichment 失敗都在這裡吃掉，呼叫端一定拿到結果。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SustainabilityEngine {

    public static final String ENRICHMENT_FAILED = "ENRICHMENT_FAILED";

    private final EnvironmentalScorer environmentalScorer;
    private final HealthScorer healthScorer;
    private final EnrichmentGateway gateway;
    private final FallbackHeuristicProvider fallback;
    private final UnifiedAggregator aggregator;
    private final EnrichmentTelemetry telemetry;

    public UnifiedAnalysisResult analyze(ProductFacts facts, AnalysisOptions options) {
        AnalysisOptions opts = (options == null) ? AnalysisOptions.DEFAULT : options;

        FoodAssessment food = healthScorer.scoreHealth(facts).orElse(null);

        // 沒營養資料時一定要跑環境評分，否則沒有任何分數可以合併
        boolean runEnv = opts.includeEnvironmental() || food == null;
        SubScoreSet env = runEnv ? environmentalScorer.scoreEnvironment(facts) : null;
        int envOverall = (env == null) ? 0 : environmentalScorer.overall(env);

        HeuristicBaseline baseline = new HeuristicBaseline(env, envOverall, food);
        EnrichedSignals signals = enrichOrFallback(facts, baseline);

        return aggregator.aggregate(facts, env, food, signals);
    }

    EnrichedSignals enrichOrFallback(ProductFacts facts, HeuristicBaseline baseline) {
        if (!gateway.isEnabled()) {
            return fallback.fallbackEnrich(facts, baseline, EnrichmentGateway.AI_DISABLED);
        }

        try {
            return gateway.enrich(facts, baseline);
        } catch (EnrichmentException e) {
            telemetry.fallback(facts.fingerprint(), e.getCode());
            return fallback.fallbackEnrich(facts, baseline, e.getCode());
        } catch (RuntimeException e) {
            // 非預期錯誤也不能讓請求失敗；留完整 stack 方便追
            log.error("enrichment_unexpected_error product={} err={}", facts.productName(), e.toString(), e);
            telemetry.fallback(facts.fingerprint(), ENRICHMENT_FAILED);
            return fallback.fallbackEnrich(facts, baseline, ENRICHMENT_FAILED);
        }
    }
}

package com.ecosnap.backend.analysis.aggregate;

import com.ecosnap.backend.analysis.model.AnalysisMode;
import com.ecosnap.backend.analysis.model.ConfidenceLevel;
import com.ecosnap.backend.analysis.model.EnrichedSignals;
import com.ecosnap.backend.analysis.model.FoodAssessment;
import com.ecosnap.backend.analysis.model.ProductFacts;
import com.ecosnap.backend.analysis.model.SignalSource;
import com.ecosnap.backend.analysis.model.Sourced;
import com.ecosnap.backend.analysis.model.SubScoreSet;
import com.ecosnap.backend.analysis.model.SustainabilityGrade;
import com.ecosnap.backend.analysis.model.UnifiedAnalysisResult;
import com.ecosnap.backend.analysis.model.UnifiedAnalysisResult.EcoScore;
import com.ecosnap.backend.analysis.model.UnifiedAnalysisResult.EnrichmentInfo;
import com.ecosnap.backend.analysis.model.UnifiedAnalysisResult.FoodAnalysis;
import com.ecosnap.backend.analysis.scoring.EnvironmentalScorer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * 把環境 / 營養 / enrichment 合成一個結果。純函式：不呼叫外部、不改輸入。
 */
@Component
@RequiredArgsConstructor
public class UnifiedAggregator {

    static final double UNIFIED_ENV_WEIGHT = 0.5;
    static final double UNIFIED_HEALTH_WEIGHT = 0.5;

    static final double RICH_INPUT_THRESHOLD = 0.7;
    static final double DISAGREEMENT_LIMIT = 25.0;

    static final int MAX_INSIGHTS = 5;
    static final int MAX_RECOMMENDATIONS = 4;

    private final EnvironmentalScorer environmentalScorer;

    /**
     * @param env  環境子分數；呼叫端關掉環境評分時為 null
     * @param food 營養評估；沒有營養資料時為 null
     */
    public UnifiedAnalysisResult aggregate(ProductFacts facts, SubScoreSet env, FoodAssessment food,
                                           EnrichedSignals enriched) {
        if (env == null && food == null) {
            throw new IllegalArgumentException("NO_SCORES_TO_AGGREGATE");
        }

        AnalysisMode mode = mode(env, food);

        SubScoreSet envFinal = enriched.applyTo(env);
        FoodAssessment foodFinal = (food == null) ? null : food.withScores(enriched.applyTo(food.scores()));
        int envOverall = (envFinal == null) ? 0 : environmentalScorer.overall(envFinal);

        int unified = unifiedScore(mode, envOverall, foodFinal);
        SustainabilityGrade grade = SustainabilityGrade.fromScore(unified);

        EcoScore eco = (envFinal == null) ? null : new EcoScore(
                envOverall,
                envFinal.asMap(),
                enriched.certifications().value(),
                enriched.impactSummary().value()
        );

        FoodAnalysis foodAnalysis = (foodFinal == null) ? null : new FoodAnalysis(
                foodFinal.healthScore(),
                foodFinal.sustainabilityScore(),
                SustainabilityGrade.fromScore(foodMean(foodFinal)),
                foodFinal.buckets(),
                foodFinal.healthBenefits(),
                foodFinal.healthConcerns()
        );

        return new UnifiedAnalysisResult(
                facts.productName(),
                unified,
                grade,
                confidence(facts.completeness(), enriched),
                mode,
                eco,
                foodAnalysis,
                insights(mode, unified, foodFinal, enriched),
                capDistinct(enriched.recommendations().value(), MAX_RECOMMENDATIONS),
                enrichmentInfo(enriched),
                facts.fingerprint()
        );
    }

    static AnalysisMode mode(SubScoreSet env, FoodAssessment food) {
        if (food == null) return AnalysisMode.ENVIRONMENTAL_ONLY;
        if (env == null) return AnalysisMode.FOOD_ONLY;
        return AnalysisMode.COMBINED;
    }

    static int unifiedScore(AnalysisMode mode, int envOverall, FoodAssessment food) {
        double v = switch (mode) {
            case ENVIRONMENTAL_ONLY -> envOverall;
            case COMBINED -> UNIFIED_ENV_WEIGHT * envOverall + UNIFIED_HEALTH_WEIGHT * food.healthScore();
            case FOOD_ONLY -> foodMean(food);
        };
        return SubScoreSet.clamp(v);
    }

    /**
     * AI 成功且輸入完整 → high；其中一個成立 → medium；都不成立 → low。
     * AI 分數跟 heuristic 平均差超過 25 → 再降一級。
     */
    static ConfidenceLevel confidence(double completeness, EnrichedSignals enriched) {
        boolean rich = completeness >= RICH_INPUT_THRESHOLD;
        boolean ai = enriched.aiSucceeded();

        ConfidenceLevel level;
        if (ai && rich) level = ConfidenceLevel.HIGH;
        else if (ai || rich) level = ConfidenceLevel.MEDIUM;
        else level = ConfidenceLevel.LOW;

        Double d = enriched.disagreement();
        if (ai && d != null && d > DISAGREEMENT_LIMIT) level = level.downgrade();
        return level;
    }

    private static int foodMean(FoodAssessment food) {
        return (int) Math.round((food.healthScore() + food.sustainabilityScore()) / 2.0);
    }

    private static List<String> insights(AnalysisMode mode, int unified, FoodAssessment food, EnrichedSignals enriched) {
        List<String> out = new ArrayList<>();

        if (mode == AnalysisMode.COMBINED) {
            if (unified >= 75) out.add("Excellent choice for both health and environment");
            else if (unified <= 45) out.add("Consider alternatives for better health and environmental impact");
        }

        List<String> base = enriched.insights().value();
        if (base != null) out.addAll(base);

        if (food != null) {
            out.addAll(food.healthBenefits().subList(0, Math.min(2, food.healthBenefits().size())));
            if (!food.healthConcerns().isEmpty()) out.add(food.healthConcerns().get(0));
        }
        return capDistinct(out, MAX_INSIGHTS);
    }

    /** 去重（保留第一次出現的順序）後截斷 */
    static List<String> capDistinct(List<String> items, int max) {
        if (items == null) return List.of();
        LinkedHashSet<String> set = new LinkedHashSet<>();
        for (String s : items) {
            if (s == null || s.isBlank()) continue;
            set.add(s.trim());
            if (set.size() >= max) break;
        }
        return List.copyOf(set);
    }

    private static EnrichmentInfo enrichmentInfo(EnrichedSignals e) {
        Map<String, SignalSource> sources = new LinkedHashMap<>();
        for (Map.Entry<String, Sourced<Integer>> s : e.subScores().entrySet()) {
            sources.put(s.getKey(), s.getValue().source());
        }
        sources.put("certifications", e.certifications().source());
        sources.put("insights", e.insights().source());
        sources.put("recommendations", e.recommendations().source());
        sources.put("impact_summary", e.impactSummary().source());

        return new EnrichmentInfo(e.provider(), e.aiSucceeded(), e.fallbackReason(), sources);
    }
}

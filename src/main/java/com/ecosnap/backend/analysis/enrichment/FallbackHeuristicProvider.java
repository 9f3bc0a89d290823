package com.ecosnap.backend.analysis.enrichment;

import com.ecosnap.backend.analysis.model.EnrichedSignals;
import com.ecosnap.backend.analysis.model.FoodAssessment;
import com.ecosnap.backend.analysis.model.HeuristicBaseline;
import com.ecosnap.backend.analysis.model.NutrientLevel;
import com.ecosnap.backend.analysis.model.ProductFacts;
import com.ecosnap.backend.analysis.model.Sourced;
import com.ecosnap.backend.analysis.model.SubScoreSet;
import com.ecosnap.backend.analysis.scoring.CertificationRegistry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 不連網、固定模板的 enrichment。輸出只跟輸入有關，同樣的輸入一定得到同樣的結果。
 */
@Component
public class FallbackHeuristicProvider {

    public static final String PROVIDER = "HEURISTIC";

    static final int WEAK_SCORE = 50;
    static final int SPREAD_FOR_WEAKEST = 20;

    private static final List<String> ENV_DIMENSIONS = List.of(
            SubScoreSet.PACKAGING, SubScoreSet.CARBON, SubScoreSet.MATERIALS
    );

    private static final Map<String, String> LABELS = Map.of(
            SubScoreSet.PACKAGING, "packaging",
            SubScoreSet.CARBON, "carbon footprint",
            SubScoreSet.MATERIALS, "materials",
            SubScoreSet.HEALTH, "health impact",
            SubScoreSet.HEALTH_SCORE, "nutrition",
            SubScoreSet.SUSTAINABILITY_SCORE, "sourcing"
    );

    public EnrichedSignals fallbackEnrich(ProductFacts facts, HeuristicBaseline baseline, String reason) {
        Map<String, Sourced<Integer>> scores = new LinkedHashMap<>();
        baseline.allScores().asMap().forEach((k, v) -> scores.put(k, Sourced.heuristic(v)));

        return new EnrichedSignals(
                scores,
                Sourced.heuristic(certifications(facts)),
                Sourced.heuristic(insights(facts, baseline)),
                Sourced.heuristic(recommendations(facts, baseline)),
                Sourced.heuristic(impactSummary(baseline)),
                false,
                PROVIDER,
                reason,
                null
        );
    }

    /** 登錄表認得的認證，再補上旗標推得出來的 */
    public List<String> certifications(ProductFacts facts) {
        List<String> out = CertificationRegistry.recognized(facts.certifications());
        if (facts.organic() && !out.contains("organic")) out.add("organic");
        if (facts.fairTrade() && !out.contains("fair-trade")) out.add("fair-trade");
        if (facts.carbonNeutral() && !out.contains("carbon-neutral")) out.add("carbon-neutral");
        return out;
    }

    public List<String> insights(ProductFacts facts, HeuristicBaseline baseline) {
        List<String> out = new ArrayList<>();

        SubScoreSet env = baseline.environmental();
        if (env != null) {
            String strongest = null;
            String weakest = null;
            for (String d : ENV_DIMENSIONS) {
                if (!env.has(d)) continue;
                if (strongest == null || env.get(d) > env.get(strongest)) strongest = d;
                if (weakest == null || env.get(d) < env.get(weakest)) weakest = d;
            }
            if (strongest != null) {
                out.add("Strongest performance in " + LABELS.get(strongest));
                if (env.get(strongest) - env.get(weakest) > SPREAD_FOR_WEAKEST) {
                    out.add("Improvement needed in " + LABELS.get(weakest));
                }
            }
        }

        FoodAssessment food = baseline.food();
        if (food != null) {
            if (food.healthScore() >= 80) out.add("Excellent nutritional profile with high health benefits");
            else if (food.healthScore() <= 40) out.add("Consider healthier alternatives for better nutrition");

            if (food.sustainabilityScore() >= 75) out.add("Environmentally friendly food choice");
            else if (food.sustainabilityScore() <= 45) out.add("Sourcing has a high environmental impact");
        }

        List<String> certs = certifications(facts);
        if (!certs.isEmpty()) out.add("Certified: " + String.join(", ", certs));

        return out;
    }

    public List<String> recommendations(ProductFacts facts, HeuristicBaseline baseline) {
        List<String> out = new ArrayList<>();

        SubScoreSet all = baseline.allScores();
        for (Map.Entry<String, Integer> e : all.asMap().entrySet()) {
            // env health 權重 0，只當參考，不產生建議
            if (SubScoreSet.HEALTH.equals(e.getKey())) continue;
            if (e.getValue() < WEAK_SCORE) {
                out.add("Consider alternatives with better " + LABELS.get(e.getKey()));
            }
        }

        FoodAssessment food = baseline.food();
        if (food != null) {
            if (food.buckets().sodium() == NutrientLevel.HIGH) {
                out.add("Choose lower-sodium options to support healthy blood pressure");
            }
            if (food.buckets().sugar() == NutrientLevel.HIGH) {
                out.add("Look for options with less added sugar");
            }
            if (food.flaggedAdditives() > 0) {
                out.add("Prefer products without artificial additives or preservatives");
            }
        }

        SubScoreSet env = baseline.environmental();
        if (env != null) {
            if (env.getOrDefault(SubScoreSet.PACKAGING, 100) < 60) {
                out.add("Choose products with recyclable or minimal packaging");
            }
            if (env.getOrDefault(SubScoreSet.CARBON, 100) < 60 && !facts.carbonNeutral()) {
                out.add("Look for locally sourced or carbon-neutral options");
            }
        }

        out.add(categoryTip(facts));
        return out;
    }

    /**
     * 依分數區間（80/60/40）給一句話。沒有環境分數時改看 food 的 sourcing 分數。
     */
    public String impactSummary(HeuristicBaseline baseline) {
        int score;
        if (baseline.hasEnvironmental()) score = baseline.environmentalOverall();
        else if (baseline.hasFood()) score = baseline.food().sustainabilityScore();
        else return "Environmental impact could not be assessed";

        if (score >= 80) return "Excellent environmental choice with minimal impact across most categories";
        if (score >= 60) return "Good environmental choice with some areas for improvement";
        if (score >= 40) return "Moderate environmental impact; consider alternatives when possible";
        return "High environmental impact; significant improvements needed";
    }

    private static String categoryTip(ProductFacts facts) {
        return switch (facts.category()) {
            case FOOD -> "Buy local and seasonal when possible to reduce transportation impact";
            case ELECTRONICS -> "Look for energy-efficient models with longer warranties";
            case PERSONAL_CARE -> "Choose refillable containers or solid bars to reduce packaging";
            case GENERAL -> "Use products longer and recycle them at end of life";
        };
    }
}

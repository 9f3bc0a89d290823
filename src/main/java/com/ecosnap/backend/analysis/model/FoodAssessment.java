package com.ecosnap.backend.analysis.model;

import java.util.List;

/**
 * Health Scorer 的輸出：food 分數 + 營養分級 + 文字說明。
 */
public record FoodAssessment(
        SubScoreSet scores,
        NutritionBuckets buckets,
        List<String> healthBenefits,
        List<String> healthConcerns,
        int flaggedAdditives
) {
    public FoodAssessment {
        healthBenefits = healthBenefits == null ? List.of() : List.copyOf(healthBenefits);
        healthConcerns = healthConcerns == null ? List.of() : List.copyOf(healthConcerns);
    }

    public int healthScore() {
        return scores.getOrDefault(SubScoreSet.HEALTH_SCORE, 0);
    }

    public int sustainabilityScore() {
        return scores.getOrDefault(SubScoreSet.SUSTAINABILITY_SCORE, 0);
    }

    public FoodAssessment withScores(SubScoreSet newScores) {
        return new FoodAssessment(newScores, buckets, healthBenefits, healthConcerns, flaggedAdditives);
    }
}

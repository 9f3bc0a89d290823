package com.ecosnap.backend.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 引擎唯一的對外輸出。每次分析建一次，之後不再修改。
 * food_analysis 只有在有營養資料時才會出現。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
        "product_name", "unified_score", "sustainability_grade", "confidence_level", "analysis_type",
        "eco_score", "food_analysis", "key_insights", "action_recommendations", "enrichment", "fingerprint"
})
public record UnifiedAnalysisResult(
        @JsonProperty("product_name") String productName,
        @JsonProperty("unified_score") int unifiedScore,
        @JsonProperty("sustainability_grade") SustainabilityGrade sustainabilityGrade,
        @JsonProperty("confidence_level") ConfidenceLevel confidenceLevel,
        @JsonProperty("analysis_type") AnalysisMode analysisType,
        @JsonProperty("eco_score") EcoScore ecoScore,
        @JsonProperty("food_analysis") FoodAnalysis foodAnalysis,
        @JsonProperty("key_insights") List<String> keyInsights,
        @JsonProperty("action_recommendations") List<String> actionRecommendations,
        @JsonProperty("enrichment") EnrichmentInfo enrichment,
        @JsonProperty("fingerprint") String fingerprint
) {

    public UnifiedAnalysisResult {
        keyInsights = keyInsights == null ? List.of() : List.copyOf(keyInsights);
        actionRecommendations = actionRecommendations == null ? List.of() : List.copyOf(actionRecommendations);
    }

    @JsonIgnore
    public boolean aiEnriched() {
        return enrichment != null && enrichment.aiSucceeded();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record EcoScore(
            @JsonProperty("overall_score") int overallScore,
            @JsonProperty("breakdown") Map<String, Integer> breakdown,
            @JsonProperty("certifications") List<String> certifications,
            @JsonProperty("impact_summary") String impactSummary
    ) {
        public EcoScore {
            breakdown = breakdown == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
            certifications = certifications == null ? List.of() : List.copyOf(certifications);
        }
    }

    public record FoodAnalysis(
            @JsonProperty("health_score") int healthScore,
            @JsonProperty("sustainability_score") int sustainabilityScore,
            @JsonProperty("overall_rating") SustainabilityGrade overallRating,
            @JsonProperty("nutritional_analysis") NutritionBuckets nutritionalAnalysis,
            @JsonProperty("health_benefits") List<String> healthBenefits,
            @JsonProperty("health_concerns") List<String> healthConcerns
    ) {
        public FoodAnalysis {
            healthBenefits = healthBenefits == null ? List.of() : List.copyOf(healthBenefits);
            healthConcerns = healthConcerns == null ? List.of() : List.copyOf(healthConcerns);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record EnrichmentInfo(
            @JsonProperty("provider") String provider,
            @JsonProperty("ai_succeeded") boolean aiSucceeded,
            @JsonProperty("fallback_reason") String fallbackReason,
            @JsonProperty("sources") Map<String, SignalSource> sources
    ) {
        public EnrichmentInfo {
            sources = sources == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sources));
        }
    }
}

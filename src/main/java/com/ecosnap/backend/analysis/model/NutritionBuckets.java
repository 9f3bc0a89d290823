package com.ecosnap.backend.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NutritionBuckets(
        @JsonProperty("calorie_density") NutrientLevel calorieDensity,
        @JsonProperty("sugar_content") NutrientLevel sugar,
        @JsonProperty("sodium_level") NutrientLevel sodium,
        @JsonProperty("fiber_content") NutrientLevel fiber,
        @JsonProperty("protein_content") NutrientLevel protein,
        @JsonProperty("additives_concern") NutrientLevel additives
) {
}

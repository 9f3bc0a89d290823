package com.ecosnap.backend.analysis.model;

/**
 * 每份（per serving）的營養數值；欄位可為 null（未提供）。
 * sodium 一律是 mg，其餘巨量營養素是 g。
 */
public record NutritionFacts(
        Double calories,
        Double proteinG,
        Double carbsG,
        Double fatG,
        Double fiberG,
        Double sugarG,
        Double sodiumMg,
        String servingSize,
        Double servingGrams
) {

    public boolean hasAnyValue() {
        return calories != null || proteinG != null || carbsG != null || fatG != null
               || fiberG != null || sugarG != null || sodiumMg != null;
    }
}

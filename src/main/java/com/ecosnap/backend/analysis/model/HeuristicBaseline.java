package com.ecosnap.backend.analysis.model;

/**
 * 本地 scorer 算出來的分數，送去 enrichment 當參考，也是 fallback 的內容。
 *
 * @param environmental 環境子分數；呼叫端關掉環境評分時為 null
 * @param environmentalOverall 環境加權總分；environmental 為 null 時無意義
 * @param food 營養評估；沒有營養資料時為 null
 */
public record HeuristicBaseline(
        SubScoreSet environmental,
        int environmentalOverall,
        FoodAssessment food
) {

    public boolean hasEnvironmental() {
        return environmental != null;
    }

    public boolean hasFood() {
        return food != null;
    }

    /** 依固定順序列出所有子分數（環境在前、food 在後） */
    public SubScoreSet allScores() {
        SubScoreSet.Builder b = SubScoreSet.builder();
        if (environmental != null) environmental.asMap().forEach(b::put);
        if (food != null) food.scores().asMap().forEach(b::put);
        return b.build();
    }
}

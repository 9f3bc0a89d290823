package com.ecosnap.backend.analysis.model;

/**
 * includeEnvironmental=false 時跳過環境評分（food_only 擴充點；預設呼叫端不會用到）。
 */
public record AnalysisOptions(boolean includeEnvironmental) {

    public static final AnalysisOptions DEFAULT = new AnalysisOptions(true);
}

package com.ecosnap.backend.analysis.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway 或 fallback 的輸出。每個欄位各自標記來源，允許 AI 部分覆蓋。
 *
 * @param aiSucceeded    AI 至少提供了一個有效欄位
 * @param provider       "GEMINI" / "HEURISTIC" ...
 * @param fallbackReason 走 fallback 時的錯誤碼（例如 PROVIDER_TIMEOUT）；AI 成功為 null
 * @param disagreement   AI 與 heuristic 子分數的平均絕對差；沒有 AI 子分數時為 null
 */
public record EnrichedSignals(
        Map<String, Sourced<Integer>> subScores,
        Sourced<List<String>> certifications,
        Sourced<List<String>> insights,
        Sourced<List<String>> recommendations,
        Sourced<String> impactSummary,
        boolean aiSucceeded,
        String provider,
        String fallbackReason,
        Double disagreement
) {

    public EnrichedSignals {
        subScores = Collections.unmodifiableMap(new LinkedHashMap<>(subScores == null ? Map.of() : subScores));
    }

    public Sourced<Integer> subScore(String name) {
        return subScores.get(name);
    }

    /**
     * 用 enrichment 後的值覆蓋 set 內已有的同名分數；set 沒有的名字不會被加進去。
     */
    public SubScoreSet applyTo(SubScoreSet base) {
        if (base == null) return null;
        SubScoreSet out = base;
        for (String name : base.names()) {
            Sourced<Integer> v = subScores.get(name);
            if (v != null && v.value() != null) out = out.with(name, v.value());
        }
        return out;
    }

    public boolean anyFromAi() {
        if (certifications.fromAi() || insights.fromAi() || recommendations.fromAi() || impactSummary.fromAi()) {
            return true;
        }
        for (Sourced<Integer> s : subScores.values()) {
            if (s.fromAi()) return true;
        }
        return false;
    }
}

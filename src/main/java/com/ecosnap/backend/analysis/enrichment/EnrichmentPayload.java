package com.ecosnap.backend.analysis.enrichment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 通過驗證的 AI 欄位。null = 模型沒給或格式不對（該欄位走 heuristic）。
 */
public record EnrichmentPayload(
        Map<String, Integer> subScores,
        List<String> certifications,
        List<String> insights,
        List<String> recommendations,
        String impactSummary
) {

    public EnrichmentPayload {
        subScores = Collections.unmodifiableMap(new LinkedHashMap<>(subScores == null ? Map.of() : subScores));
        certifications = certifications == null ? null : List.copyOf(certifications);
        insights = insights == null ? null : List.copyOf(insights);
        recommendations = recommendations == null ? null : List.copyOf(recommendations);
    }

    public int acceptedFields() {
        int n = subScores.size();
        if (certifications != null) n++;
        if (insights != null) n++;
        if (recommendations != null) n++;
        if (impactSummary != null) n++;
        return n;
    }
}

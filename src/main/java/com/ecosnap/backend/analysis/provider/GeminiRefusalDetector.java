package com.ecosnap.backend.analysis.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 命中 SAFETY/RECITATION/blocked rating 就視為拒答（當成 transport 失敗，不 retry）。
 */
public final class GeminiRefusalDetector {

    private GeminiRefusalDetector() {}

    public static RefusalReason detectOrNull(JsonNode resp) {
        if (resp == null || resp.isNull()) return null;

        // 1) promptFeedback.blockReason（這時 candidates 常常是空的）
        String blockReason = text(resp, "promptFeedback", "blockReason");
        if ("SAFETY".equalsIgnoreCase(blockReason)) return RefusalReason.SAFETY;
        if ("RECITATION".equalsIgnoreCase(blockReason)) return RefusalReason.RECITATION;
        if (blockReason != null) return RefusalReason.HARM_CATEGORY;

        // 2) candidates[0].finishReason
        JsonNode cand0 = resp.path("candidates").path(0);
        String finishReason = cand0.path("finishReason").asText(null);
        if ("SAFETY".equalsIgnoreCase(finishReason)) return RefusalReason.SAFETY;
        if ("RECITATION".equalsIgnoreCase(finishReason)) return RefusalReason.RECITATION;

        // 3) safetyRatings 有 blocked
        if (hasBlockedRating(cand0.path("safetyRatings"))) return RefusalReason.HARM_CATEGORY;
        if (hasBlockedRating(resp.path("promptFeedback").path("safetyRatings"))) return RefusalReason.HARM_CATEGORY;

        return null;
    }

    private static boolean hasBlockedRating(JsonNode arr) {
        if (arr == null || !arr.isArray()) return false;
        for (JsonNode it : arr) {
            if (it != null && it.path("blocked").asBoolean(false)) return true;
        }
        return false;
    }

    private static String text(JsonNode root, String... path) {
        JsonNode cur = root;
        for (String p : path) cur = cur.path(p);
        if (cur == null || cur.isMissingNode() || cur.isNull()) return null;
        String s = cur.asText(null);
        return (s == null || s.isBlank()) ? null : s;
    }
}

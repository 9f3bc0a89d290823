package com.ecosnap.backend.analysis.enrichment;

import com.ecosnap.backend.analysis.model.SubScoreSet;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 模型文字 → {@link EnrichmentPayload}。
 * 先修（去 code fence、抓第一段 JSON、去尾逗號），再逐欄驗證；壞掉的欄位只丟掉那一欄。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnrichmentResponseParser {

    static final List<String> SCORE_NAMES = List.of(
            SubScoreSet.PACKAGING,
            SubScoreSet.CARBON,
            SubScoreSet.MATERIALS,
            SubScoreSet.HEALTH,
            SubScoreSet.HEALTH_SCORE,
            SubScoreSet.SUSTAINABILITY_SCORE
    );

    static final int MAX_TEXT_ITEMS = 8;
    static final int MAX_TEXT_LEN = 240;

    private final ObjectMapper om;

    public EnrichmentPayload parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new SchemaValidationException("EMPTY_MODEL_OUTPUT");
        }

        String cleaned = stripFence(stripBomAndNulls(rawText));
        String json = extractFirstJsonPayload(cleaned);
        if (json == null) throw new SchemaValidationException("NO_JSON_IN_MODEL_OUTPUT");
        json = removeTrailingCommas(json);

        JsonNode root;
        try {
            root = om.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SchemaValidationException("MODEL_OUTPUT_NOT_JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new SchemaValidationException("MODEL_OUTPUT_NOT_OBJECT");
        }

        EnrichmentPayload p = new EnrichmentPayload(
                subScores(firstPresent(root, "sub_scores", "subScores")),
                certifications(root.get("certifications")),
                textList(firstPresent(root, "insights", "key_insights")),
                textList(firstPresent(root, "recommendations", "action_recommendations")),
                text(firstPresent(root, "impact_summary", "impactSummary"))
        );

        if (p.acceptedFields() == 0) {
            throw new SchemaValidationException("NO_VALID_SCHEMA_FIELD");
        }
        return p;
    }

    // ===== per-field validation =====

    /** 只收 JSON number 且在 0..100；其他一律丟掉那個分數 */
    static Map<String, Integer> subScores(JsonNode node) {
        Map<String, Integer> out = new LinkedHashMap<>();
        if (node == null || !node.isObject()) return out;

        for (String name : SCORE_NAMES) {
            JsonNode v = node.get(name);
            if (v == null || !v.isNumber()) {
                if (v != null && !v.isNull()) log.debug("enrichment_field_dropped field=sub_scores.{} reason=NOT_NUMBER", name);
                continue;
            }
            double d = v.asDouble();
            if (!Double.isFinite(d) || d < 0.0 || d > 100.0) {
                log.debug("enrichment_field_dropped field=sub_scores.{} reason=OUT_OF_RANGE value={}", name, d);
                continue;
            }
            out.put(name, (int) Math.round(d));
        }
        return out;
    }

    /** 必須是字串陣列；空陣列代表「沒有認證」也算有效 */
    static List<String> certifications(JsonNode node) {
        if (node == null || !node.isArray()) return null;
        List<String> out = new ArrayList<>();
        for (JsonNode it : node) {
            if (it == null || !it.isTextual()) return null;
            String c = it.asText().trim().toLowerCase(Locale.ROOT)
                    .replaceAll("[\\s_]+", "-")
                    .replaceAll("-{2,}", "-");
            if (!c.isEmpty() && !out.contains(c)) out.add(c);
        }
        return out;
    }

    /** 字串陣列；空陣列視為沒給（改用 heuristic 文字） */
    static List<String> textList(JsonNode node) {
        if (node == null || !node.isArray()) return null;
        List<String> out = new ArrayList<>();
        for (JsonNode it : node) {
            if (it == null || !it.isTextual()) return null;
            String s = oneLine(it.asText());
            if (!s.isEmpty()) out.add(s);
            if (out.size() >= MAX_TEXT_ITEMS) break;
        }
        return out.isEmpty() ? null : out;
    }

    static String text(JsonNode node) {
        if (node == null || !node.isTextual()) return null;
        String s = oneLine(node.asText());
        return s.isEmpty() ? null : s;
    }

    private static JsonNode firstPresent(JsonNode root, String... keys) {
        for (String k : keys) {
            JsonNode v = root.get(k);
            if (v != null && !v.isNull()) return v;
        }
        return null;
    }

    private static String oneLine(String s) {
        if (s == null) return "";
        String t = s.replace("\r", " ").replace("\n", " ").replaceAll("\\s+", " ").trim();
        return (t.length() > MAX_TEXT_LEN) ? t.substring(0, MAX_TEXT_LEN).trim() : t;
    }

    // ===== JSON repair =====

    static String stripBomAndNulls(String s) {
        if (s == null) return "";
        if (!s.isEmpty() && s.charAt(0) == '\uFEFF') s = s.substring(1);
        return s.replace("\u0000", "");
    }

    static String stripFence(String s) {
        if (s == null) return "";
        if (!s.contains("```")) return s.trim();

        int first = s.indexOf("```");
        int firstNl = s.indexOf('\n', first);
        if (firstNl > 0) s = s.substring(firstNl + 1);
        int lastFence = s.lastIndexOf("```");
        if (lastFence >= 0) s = s.substring(0, lastFence);
        return s.trim();
    }

    /**
     * 找第一個平衡的 {...}（略過字串內的括號）；沒收尾就回傳剩下全部，交給 parser 判斷。
     */
    static String extractFirstJsonPayload(String s) {
        if (s == null) return null;

        int start = s.indexOf('{');
        if (start < 0) return null;

        boolean inString = false;
        boolean escaped = false;
        int depth = 0;

        for (int i = start; i < s.length(); i++) {
            char ch = s.charAt(i);

            if (escaped) { escaped = false; continue; }

            if (inString) {
                if (ch == '\\') { escaped = true; continue; }
                if (ch == '"') inString = false;
                continue;
            }

            if (ch == '"') { inString = true; continue; }
            if (ch == '{' || ch == '[') depth++;
            else if (ch == '}' || ch == ']') depth--;

            if (depth == 0) return s.substring(start, i + 1).trim();
        }
        return s.substring(start).trim();
    }

    static String removeTrailingCommas(String s) {
        if (s == null || s.isEmpty()) return s;
        StringBuilder out = new StringBuilder(s.length());
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (escaped) {
                out.append(ch);
                escaped = false;
                continue;
            }
            if (inString) {
                out.append(ch);
                if (ch == '\\') escaped = true;
                else if (ch == '"') inString = false;
                continue;
            }
            if (ch == '"') {
                inString = true;
                out.append(ch);
                continue;
            }
            if (ch == ',') {
                int j = i + 1;
                while (j < s.length() && Character.isWhitespace(s.charAt(j))) j++;
                if (j < s.length()) {
                    char nx = s.charAt(j);
                    if (nx == '}' || nx == ']') continue;
                }
            }
            out.append(ch);
        }
        return out.toString();
    }
}

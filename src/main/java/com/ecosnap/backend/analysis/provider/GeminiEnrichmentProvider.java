package com.ecosnap.backend.analysis.provider;

import com.ecosnap.backend.analysis.enrichment.EnrichmentProvider;
import com.ecosnap.backend.analysis.enrichment.SchemaValidationException;
import com.ecosnap.backend.analysis.enrichment.TransportException;
import com.ecosnap.backend.analysis.model.FoodAssessment;
import com.ecosnap.backend.analysis.model.HeuristicBaseline;
import com.ecosnap.backend.analysis.model.NutritionFacts;
import com.ecosnap.backend.analysis.model.ProductFacts;
import com.ecosnap.backend.analysis.provider.config.GeminiProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.Map;

/**
 * Gemini generateContent（純文字 in / JSON out）。
 * 只做傳輸：拒答丟 {@link TransportException}，空輸出丟 {@link SchemaValidationException}。
 */
@Slf4j
public class GeminiEnrichmentProvider implements EnrichmentProvider {

    public static final String PROVIDER = "GEMINI";

    private static final int PREVIEW_LEN = 200;

    private static final String SYSTEM_PROMPT =
            "You are a product sustainability analyst. Return ONLY one minified JSON object. No markdown. No extra text.";

    private static final String USER_PROMPT_HEAD =
            "Assess the environmental and health impact of the product below. "
            + "Scores are integers 0-100 where higher is better. "
            + "Use the heuristic scores as a starting point and adjust only with a clear reason. "
            + "Omit a score you cannot judge. Insights and recommendations are short sentences (max 5 and 4). "
            + "Certifications are lowercase hyphenated tokens (e.g. fair-trade).\n\n";

    private final RestClient http;
    private final GeminiProperties props;
    private final ObjectMapper om;

    public GeminiEnrichmentProvider(RestClient http, GeminiProperties props, ObjectMapper om) {
        this.http = http;
        this.props = props;
        this.om = om;
    }

    @Override
    public String providerCode() { return PROVIDER; }

    @Override
    public String modelId() { return props.getModel(); }

    @Override
    public String generate(ProductFacts facts, HeuristicBaseline baseline) {
        ObjectNode req = buildRequest(buildUserPrompt(facts, baseline));

        JsonNode resp = http.post()
                .uri("/v1beta/models/{model}:generateContent", props.getModel())
                .header("x-goog-api-key", requireApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(req)
                .retrieve()
                .body(JsonNode.class);

        RefusalReason reason = GeminiRefusalDetector.detectOrNull(resp);
        if (reason != null) {
            log.warn("gemini_refused modelId={} reason={}", props.getModel(), reason);
            throw new TransportException(reason.errorCode(), "refused by provider: " + reason);
        }

        String text = extractJoinedTextOrNull(resp);
        if (text == null) throw new SchemaValidationException("EMPTY_MODEL_OUTPUT");

        log.debug("geminiEnrichmentPreview modelId={} preview={}", props.getModel(), safeOneLine200(text));
        return text;
    }

    String buildUserPrompt(ProductFacts facts, HeuristicBaseline baseline) {
        StringBuilder sb = new StringBuilder(USER_PROMPT_HEAD);
        sb.append("Product: ").append(facts.productName()).append('\n');
        sb.append("Brand: ").append(facts.brand()).append('\n');
        sb.append("Category: ").append(facts.category().wire()).append('\n');
        sb.append("Ingredients: ").append(facts.ingredients().isEmpty() ? "none listed" : String.join(", ", facts.ingredients())).append('\n');
        sb.append("Certifications: ").append(facts.certifications().isEmpty() ? "none" : String.join(", ", facts.certifications())).append('\n');
        sb.append("Packaging: ").append(facts.packaging()).append('\n');
        sb.append("Origin: ").append(facts.originCountry()).append('\n');
        sb.append("Materials: ").append(facts.materials()).append('\n');
        sb.append("Flags: organic=").append(facts.organic())
          .append(" fairTrade=").append(facts.fairTrade())
          .append(" locallySourced=").append(facts.locallySourced())
          .append(" carbonNeutral=").append(facts.carbonNeutral()).append('\n');

        NutritionFacts n = facts.nutrition();
        if (n != null) {
            sb.append("Nutrition per serving: kcal=").append(n.calories())
              .append(" protein_g=").append(n.proteinG())
              .append(" carbs_g=").append(n.carbsG())
              .append(" fat_g=").append(n.fatG())
              .append(" fiber_g=").append(n.fiberG())
              .append(" sugar_g=").append(n.sugarG())
              .append(" sodium_mg=").append(n.sodiumMg())
              .append(" serving=").append(n.servingSize()).append('\n');
        }

        sb.append("Heuristic scores: ");
        for (Map.Entry<String, Integer> e : baseline.allScores().asMap().entrySet()) {
            sb.append(e.getKey()).append('=').append(e.getValue()).append(' ');
        }
        sb.append('\n');

        FoodAssessment food = baseline.food();
        if (food == null) {
            sb.append("No nutrition data: omit health_score and sustainability_score.\n");
        }
        return sb.toString();
    }

    ObjectNode buildRequest(String userPrompt) {
        ObjectNode root = om.createObjectNode();

        ObjectNode sys = root.putObject("systemInstruction");
        sys.putArray("parts").addObject().put("text", SYSTEM_PROMPT);

        ArrayNode contents = root.putArray("contents");
        ObjectNode c0 = contents.addObject();
        c0.put("role", "user");
        c0.putArray("parts").addObject().put("text", userPrompt);

        ObjectNode gen = root.putObject("generationConfig");
        gen.put("responseMimeType", "application/json"); // ✅ 強制 JSON
        gen.set("_responseJsonSchema", responseJsonSchema());
        gen.put("maxOutputTokens", props.getMaxOutputTokens());
        gen.put("temperature", props.getTemperature());

        return root;
    }

    private ObjectNode responseJsonSchema() {
        ObjectNode schema = om.createObjectNode();
        schema.put("type", "object");
        ObjectNode p = schema.putObject("properties");

        ObjectNode sub = p.putObject("sub_scores");
        sub.put("type", "object");
        ObjectNode subProps = sub.putObject("properties");
        for (String k : new String[]{"packaging", "carbon", "materials", "health_score", "sustainability_score"}) {
            ObjectNode n = subProps.putObject(k);
            n.put("type", "number");
            n.put("minimum", 0);
            n.put("maximum", 100);
        }

        for (String k : new String[]{"certifications", "insights", "recommendations"}) {
            ObjectNode arr = p.putObject(k);
            arr.put("type", "array");
            arr.putObject("items").put("type", "string");
        }

        p.putObject("impact_summary").put("type", "string");

        schema.putArray("required").add("sub_scores").add("certifications").add("insights").add("recommendations");
        return schema;
    }

    private static String extractJoinedTextOrNull(JsonNode resp) {
        if (resp == null || resp.isNull()) return null;
        JsonNode parts = resp.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray()) return null;

        StringBuilder sb = new StringBuilder(256);
        for (JsonNode part : parts) {
            String t = part.path("text").asText(null);
            if (t != null) sb.append(t);
        }
        String joined = sb.toString().trim();
        return joined.isEmpty() ? null : joined;
    }

    private static String safeOneLine200(String s) {
        if (s == null) return null;
        String t = s.replace("\r", " ").replace("\n", " ").trim();
        return (t.length() > PREVIEW_LEN) ? t.substring(0, PREVIEW_LEN) : t;
    }

    private String requireApiKey() {
        String k = props.getApiKey();
        if (k == null || k.isBlank()) throw new IllegalStateException("GEMINI_API_KEY_MISSING");
        return k.trim();
    }
}

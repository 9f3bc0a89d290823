package com.ecosnap.backend.analysis.scoring;

import com.ecosnap.backend.analysis.model.ProductCategory;
import com.ecosnap.backend.analysis.model.ProductFacts;
import com.ecosnap.backend.analysis.model.SubScoreSet;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * 環境子分數：packaging / carbon / materials / health。
 * 每個維度 = 類別基準 + 訊號加減分，逐一夾在 0..100 後再加權。
 */
@Service
public class EnvironmentalScorer {

    static final int ORGANIC_MATERIALS_BONUS = 8;
    static final int CERT_BONUS_EACH = 5;
    static final int CERT_BONUS_CAP = 15;
    static final int CARBON_NEUTRAL_BONUS = 10;
    static final int LOCAL_BONUS = 5;
    static final int SHIPPING_TIER_PENALTY = 5;
    static final int ADDITIVE_HEALTH_PENALTY_EACH = 5;
    static final int ADDITIVE_HEALTH_PENALTY_CAP = 15;

    record Baseline(int packaging, int carbon, int materials, int health) {}

    private static final Map<ProductCategory, Baseline> BASELINES = new EnumMap<>(ProductCategory.class);

    static {
        BASELINES.put(ProductCategory.FOOD, new Baseline(60, 55, 60, 60));
        BASELINES.put(ProductCategory.ELECTRONICS, new Baseline(50, 40, 45, 55));
        BASELINES.put(ProductCategory.PERSONAL_CARE, new Baseline(55, 55, 55, 55));
        BASELINES.put(ProductCategory.GENERAL, new Baseline(55, 50, 50, 50));
    }

    // ✅ 負面關鍵字一律 -10
    private static final List<KeywordRule> PACKAGING_NEGATIVE = List.of(
            KeywordRule.of("plastic", -10),
            KeywordRule.of("single-use", -10),
            KeywordRule.of("styrofoam", -10),
            KeywordRule.of("polystyrene", -10),
            KeywordRule.of("non-recyclable", -10),
            KeywordRule.of("blister", -10),
            KeywordRule.of("multi-layer", -10),
            KeywordRule.of("multilayer", -10),
            KeywordRule.of("pvc", -10),
            KeywordRule.of("sachet", -10)
    );

    private static final List<KeywordRule> PACKAGING_POSITIVE = List.of(
            KeywordRule.of("plastic-free", 10),
            KeywordRule.of("compostable", 15),
            KeywordRule.of("biodegradable", 10),
            KeywordRule.of("recyclable", 10),
            KeywordRule.of("recycled", 10),
            KeywordRule.of("reusable", 10),
            KeywordRule.of("refillable", 10),
            KeywordRule.of("glass", 10),
            KeywordRule.of("aluminum", 5),
            KeywordRule.of("aluminium", 5),
            KeywordRule.of("paper", 5),
            KeywordRule.of("cardboard", 5),
            KeywordRule.of("minimal", 5),
            KeywordRule.of("bulk", 5)
    );

    private static final List<KeywordRule> MATERIAL_RULES = List.of(
            KeywordRule.of("recycled", 10),
            KeywordRule.of("bamboo", 10),
            KeywordRule.of("organic cotton", 8),
            KeywordRule.of("hemp", 8),
            KeywordRule.of("plant-based", 5),
            KeywordRule.of("natural", 5),
            KeywordRule.of("renewable", 5),
            KeywordRule.of("palm oil", -10),
            KeywordRule.of("microbead", -10),
            KeywordRule.of("pvc", -10),
            KeywordRule.of("synthetic", -5),
            KeywordRule.of("plastic", -5)
    );

    // 長途製造產地（小寫）
    private static final List<Pattern> LONG_HAUL_ORIGINS = Stream.of(
            "china", "prc", "india", "vietnam", "bangladesh", "indonesia", "thailand", "malaysia",
            "philippines", "cambodia", "pakistan", "sri lanka", "taiwan", "brazil", "mexico", "peru", "chile"
    ).map(KeywordRule::wordPattern).toList();

    private static final List<Pattern> LOCAL_ORIGIN_MARKERS = Stream.of(
            "local", "locally", "regional", "domestic", "farm", "farms"
    ).map(KeywordRule::wordPattern).toList();

    private final ScoringWeights weights;

    public EnvironmentalScorer(ScoringWeights weights) {
        weights.validate();
        this.weights = weights;
    }

    public SubScoreSet scoreEnvironment(ProductFacts facts) {
        Baseline b = BASELINES.get(facts.category());

        int certBonus = certificationBonus(facts);

        return SubScoreSet.builder()
                .put(SubScoreSet.PACKAGING, b.packaging() + packagingDelta(facts.packaging()))
                .put(SubScoreSet.CARBON, b.carbon() + carbonDelta(facts))
                .put(SubScoreSet.MATERIALS, b.materials() + certBonus + materialsDelta(facts))
                .put(SubScoreSet.HEALTH, b.health() + certBonus - additivePenalty(facts))
                .build();
    }

    /**
     * 加權平均（除以權重總和）；缺少的維度不計入分母。
     */
    public int overall(SubScoreSet s) {
        double num = 0.0;
        double den = 0.0;

        double[][] pairs = {
                {weights.getPackaging(), s.getOrDefault(SubScoreSet.PACKAGING, -1)},
                {weights.getCarbon(), s.getOrDefault(SubScoreSet.CARBON, -1)},
                {weights.getMaterials(), s.getOrDefault(SubScoreSet.MATERIALS, -1)},
                {weights.getHealth(), s.getOrDefault(SubScoreSet.HEALTH, -1)}
        };
        for (double[] p : pairs) {
            if (p[1] < 0 || p[0] <= 0.0) continue;
            num += p[0] * p[1];
            den += p[0];
        }
        if (den <= 0.0) return 0;
        return SubScoreSet.clamp(num / den);
    }

    static int certificationBonus(ProductFacts facts) {
        int n = CertificationRegistry.recognized(facts.certifications()).size();
        return Math.min(CERT_BONUS_CAP, n * CERT_BONUS_EACH);
    }

    static int packagingDelta(String packaging) {
        if (packaging == null || ProductFacts.UNKNOWN_PACKAGING.equals(packaging)) return 0;
        String lower = packaging.toLowerCase(Locale.ROOT);

        // "plastic-free" / "non-recyclable" 不能被當成 plastic / recyclable
        String forNegative = lower.replaceAll("plastic[- ]free", " ");
        String forPositive = lower.replaceAll("(non|not)[- ]?recyclable", " ");

        int delta = KeywordRule.sum(PACKAGING_NEGATIVE, forNegative);
        delta += KeywordRule.sum(PACKAGING_POSITIVE, forPositive);
        return delta;
    }

    static int materialsDelta(ProductFacts facts) {
        int delta = facts.organic() ? ORGANIC_MATERIALS_BONUS : 0;

        StringBuilder sb = new StringBuilder();
        if (!ProductFacts.UNSPECIFIED.equals(facts.materials())) sb.append(facts.materials()).append(' ');
        for (String ing : facts.ingredients()) sb.append(ing).append(' ');

        String lower = sb.toString().toLowerCase(Locale.ROOT).replaceAll("plastic[- ]free", " ");
        if (!lower.isBlank()) delta += KeywordRule.sum(MATERIAL_RULES, lower);
        return delta;
    }

    static int carbonDelta(ProductFacts facts) {
        int delta = 0;
        if (facts.carbonNeutral()) delta += CARBON_NEUTRAL_BONUS;
        if (facts.locallySourced()) delta += LOCAL_BONUS;
        delta -= SHIPPING_TIER_PENALTY * shippingTier(facts);
        return delta;
    }

    /**
     * 0 = 在地、1 = 未標示、2 = 其他有名字的國家、3 = 長途製造產地
     */
    static int shippingTier(ProductFacts facts) {
        if (facts.locallySourced()) return 0;

        String origin = facts.originCountry();
        if (origin == null || ProductFacts.UNSPECIFIED.equals(origin)) return 1;

        String lower = origin.toLowerCase(Locale.ROOT).trim();
        for (Pattern m : LOCAL_ORIGIN_MARKERS) {
            if (m.matcher(lower).find()) return 0;
        }
        for (Pattern c : LONG_HAUL_ORIGINS) {
            if (c.matcher(lower).find()) return 3;
        }
        return 2;
    }

    static int additivePenalty(ProductFacts facts) {
        int n = AdditiveDenylist.flagged(facts.ingredients()).size();
        return Math.min(ADDITIVE_HEALTH_PENALTY_CAP, n * ADDITIVE_HEALTH_PENALTY_EACH);
    }
}

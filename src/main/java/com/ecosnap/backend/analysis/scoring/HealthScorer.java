package com.ecosnap.backend.analysis.scoring;

import com.ecosnap.backend.analysis.model.FoodAssessment;
import com.ecosnap.backend.analysis.model.NutrientLevel;
import com.ecosnap.backend.analysis.model.NutritionBuckets;
import com.ecosnap.backend.analysis.model.NutritionFacts;
import com.ecosnap.backend.analysis.model.ProductFacts;
import com.ecosnap.backend.analysis.model.SubScoreSet;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * ⚠️ 粗略的營養規則（非醫療建議）。
 * 沒有營養資料 → Optional.empty()（不是 0 分），Aggregator 靠這個決定模式。
 */
@Service
public class HealthScorer {

    static final int HEALTH_BASE = 60;
    static final int SUSTAINABILITY_BASE = 50;

    static final int ORGANIC_BONUS = 10;
    static final int LOCAL_BONUS = 10;
    static final int FAIR_TRADE_BONUS = 5;
    static final int TOKEN_BONUS_EACH = 5;
    static final int TOKEN_BONUS_CAP = 10;
    static final int ADDITIVE_PENALTY_EACH = 8;
    static final int ADDITIVE_PENALTY_CAP = 30;
    static final int PLASTIC_PENALTY = 5;

    // "inorganic" / "non-organic" 不算
    private static final Pattern ORGANIC_TOKEN = KeywordRule.affirmedWordPattern("organic");

    public Optional<FoodAssessment> scoreHealth(ProductFacts facts) {
        if (!facts.hasNutrition()) return Optional.empty();

        NutritionFacts n = facts.nutrition();
        List<String> flagged = AdditiveDenylist.flagged(facts.ingredients());

        NutritionBuckets buckets = new NutritionBuckets(
                calorieDensity(n),
                bucket(n.sugarG(), 5, 15, false),
                bucket(n.sodiumMg(), 140, 600, false),
                bucket(n.fiberG(), 3, 6, true),
                bucket(n.proteinG(), 5, 15, true),
                additivesLevel(flagged.size())
        );

        SubScoreSet scores = SubScoreSet.builder()
                .put(SubScoreSet.HEALTH_SCORE, healthScore(buckets))
                .put(SubScoreSet.SUSTAINABILITY_SCORE, sustainabilityScore(facts, flagged.size()))
                .build();

        return Optional.of(new FoodAssessment(
                scores,
                buckets,
                benefits(facts, buckets),
                concerns(facts, buckets, flagged.size()),
                flagged.size()
        ));
    }

    /**
     * 有 serving 克數 → kcal/100g（<150 低、>400 高）；否則用每份熱量（<200 低、>500 高）
     */
    static NutrientLevel calorieDensity(NutritionFacts n) {
        Double kcal = n.calories();
        if (kcal == null) return NutrientLevel.MODERATE;

        Double grams = n.servingGrams();
        if (grams != null && grams > 0) {
            return bucket(kcal * 100.0 / grams, 150, 400, false);
        }
        return bucket(kcal, 200, 500, false);
    }

    /**
     * 缺值 → MODERATE。
     * highInclusive=true 時 high 門檻含等號（fiber/protein 用 ≥），否則是嚴格大於。
     */
    static NutrientLevel bucket(Double v, double lowBelow, double high, boolean highInclusive) {
        if (v == null) return NutrientLevel.MODERATE;
        if (v < lowBelow) return NutrientLevel.LOW;
        if (highInclusive ? v >= high : v > high) return NutrientLevel.HIGH;
        return NutrientLevel.MODERATE;
    }

    static NutrientLevel additivesLevel(int flagged) {
        if (flagged <= 0) return NutrientLevel.LOW;
        if (flagged == 1) return NutrientLevel.MODERATE;
        return NutrientLevel.HIGH;
    }

    static int healthScore(NutritionBuckets b) {
        int s = HEALTH_BASE;

        // calorie density：+5 / -10
        if (b.calorieDensity() == NutrientLevel.LOW) s += 5;
        else if (b.calorieDensity() == NutrientLevel.HIGH) s -= 10;

        // sugar：+10 / -15
        if (b.sugar() == NutrientLevel.LOW) s += 10;
        else if (b.sugar() == NutrientLevel.HIGH) s -= 15;

        // sodium：+10 / -15
        if (b.sodium() == NutrientLevel.LOW) s += 10;
        else if (b.sodium() == NutrientLevel.HIGH) s -= 15;

        // fiber：高是好事
        if (b.fiber() == NutrientLevel.HIGH) s += 10;
        else if (b.fiber() == NutrientLevel.LOW) s -= 5;

        // protein：高是好事
        if (b.protein() == NutrientLevel.HIGH) s += 10;
        else if (b.protein() == NutrientLevel.LOW) s -= 5;

        if (b.additives() == NutrientLevel.MODERATE) s -= 5;
        else if (b.additives() == NutrientLevel.HIGH) s -= 10;

        return SubScoreSet.clamp(s);
    }

    static int sustainabilityScore(ProductFacts facts, int flaggedAdditives) {
        int s = SUSTAINABILITY_BASE;
        if (facts.organic()) s += ORGANIC_BONUS;
        if (facts.locallySourced()) s += LOCAL_BONUS;
        if (facts.fairTrade()) s += FAIR_TRADE_BONUS;

        String tokens = tokenText(facts);
        int tokenBonus = 0;
        if (ORGANIC_TOKEN.matcher(tokens).find()) tokenBonus += TOKEN_BONUS_EACH;
        if (tokens.contains("non-gmo") || tokens.contains("non gmo") || tokens.contains("nongmo")) tokenBonus += TOKEN_BONUS_EACH;
        s += Math.min(TOKEN_BONUS_CAP, tokenBonus);

        s -= Math.min(ADDITIVE_PENALTY_CAP, flaggedAdditives * ADDITIVE_PENALTY_EACH);

        String packaging = facts.packaging().toLowerCase(Locale.ROOT).replaceAll("plastic[- ]free", " ");
        if (packaging.contains("plastic")) s -= PLASTIC_PENALTY;

        return SubScoreSet.clamp(s);
    }

    static List<String> benefits(ProductFacts facts, NutritionBuckets b) {
        List<String> out = new ArrayList<>();
        String ing = ingredientText(facts);

        if (b.fiber() == NutrientLevel.HIGH || ing.contains("whole grain")) {
            out.add("Supports digestive health and satiety");
        }
        if (b.protein() == NutrientLevel.HIGH) {
            out.add("Provides essential amino acids for muscle health");
        }
        // "vegetable oil" 不算蔬菜
        String produce = ing.replace("vegetable oil", " ");
        if (produce.contains("fruit") || produce.contains("vegetable") || produce.contains("berries")
            || produce.contains("spinach") || produce.contains("kale")) {
            out.add("Rich in vitamins, minerals, and antioxidants");
        }
        if (facts.organic()) {
            out.add("Reduced exposure to synthetic pesticides");
        }
        if (ing.contains("omega") || ing.contains("fish") || ing.contains("salmon") || ing.contains("flax")) {
            out.add("Contains beneficial omega-3 fatty acids");
        }
        return out;
    }

    static List<String> concerns(ProductFacts facts, NutritionBuckets b, int flaggedAdditives) {
        List<String> out = new ArrayList<>();
        String ing = ingredientText(facts);

        if (b.sugar() == NutrientLevel.HIGH) {
            out.add("High sugar content may contribute to blood sugar spikes");
        }
        if (b.sodium() == NutrientLevel.HIGH) {
            out.add("High sodium content may affect blood pressure");
        }
        if (b.calorieDensity() == NutrientLevel.HIGH) {
            out.add("High calorie density; watch portion sizes");
        }
        if (flaggedAdditives > 0) {
            out.add("Contains artificial additives or preservatives");
        }
        if (ing.contains("hydrogenated") || ing.contains("trans fat")) {
            out.add("Contains unhealthy trans fats");
        }
        return out;
    }

    private static String ingredientText(ProductFacts facts) {
        return String.join(" ", facts.ingredients()).toLowerCase(Locale.ROOT);
    }

    private static String tokenText(ProductFacts facts) {
        return (ingredientText(facts) + " " + String.join(" ", facts.certifications())).toLowerCase(Locale.ROOT);
    }
}

package com.ecosnap.backend.analysis.scoring;

import com.ecosnap.backend.analysis.ProductFixtures;
import com.ecosnap.backend.analysis.model.ProductFacts;
import com.ecosnap.backend.analysis.model.SubScoreSet;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvironmentalScorerTest {

    private final EnvironmentalScorer scorer = new EnvironmentalScorer(new ScoringWeights());

    private static ProductFacts facts(Object... kv) {
        Map<String, Object> raw = new HashMap<>();
        raw.put("name", "Test Product");
        for (int i = 0; i < kv.length; i += 2) raw.put((String) kv[i], kv[i + 1]);
        return ProductFixtures.facts(raw);
    }

    @Test
    void general_product_with_no_signals_should_get_baseline_minus_unknown_origin() {
        SubScoreSet s = scorer.scoreEnvironment(facts());

        assertThat(s.get(SubScoreSet.PACKAGING)).isEqualTo(55);
        assertThat(s.get(SubScoreSet.CARBON)).isEqualTo(45); // 50 - 5（未標示產地）
        assertThat(s.get(SubScoreSet.MATERIALS)).isEqualTo(50);
        assertThat(s.get(SubScoreSet.HEALTH)).isEqualTo(50);
        assertThat(s.names()).containsExactly("packaging", "carbon", "materials", "health");
    }

    @Test
    void plastic_bottle_should_lose_packaging_points_and_land_on_grade_D_overall() {
        SubScoreSet s = scorer.scoreEnvironment(facts("packaging", "single-use plastic bottle"));

        assertThat(s.get(SubScoreSet.PACKAGING)).isEqualTo(35);
        assertThat(s.get(SubScoreSet.CARBON)).isEqualTo(45);
        assertThat(s.get(SubScoreSet.MATERIALS)).isEqualTo(50);
        // 0.3*35 + 0.4*45 + 0.3*50 = 43.5
        assertThat(scorer.overall(s)).isEqualTo(44);
    }

    @Test
    void organic_flag_should_raise_materials_above_category_baseline() {
        int plain = scorer.scoreEnvironment(facts("category", "food")).get(SubScoreSet.MATERIALS);
        int organic = scorer.scoreEnvironment(facts("category", "food", "organic", true)).get(SubScoreSet.MATERIALS);

        assertThat(plain).isEqualTo(60);
        assertThat(organic).isGreaterThan(plain);
        assertThat(organic - plain).isEqualTo(EnvironmentalScorer.ORGANIC_MATERIALS_BONUS);
    }

    @Test
    void certification_bonus_should_be_capped_at_15() {
        ProductFacts many = facts("certifications", List.of("rainforest-alliance", "fsc", "b-corp", "msc", "epeat"));

        assertThat(EnvironmentalScorer.certificationBonus(many)).isEqualTo(15);
    }

    @Test
    void certification_aliases_should_not_double_count() {
        ProductFacts f = facts("certifications", List.of("organic", "USDA Organic", "EU Organic"));

        assertThat(EnvironmentalScorer.certificationBonus(f)).isEqualTo(5);
    }

    @Test
    void unknown_certifications_should_not_score() {
        ProductFacts f = facts("certifications", List.of("best-in-show", "award winning"));

        assertThat(EnvironmentalScorer.certificationBonus(f)).isZero();
    }

    @Test
    void plastic_free_and_non_recyclable_should_not_match_their_opposites() {
        assertThat(EnvironmentalScorer.packagingDelta("plastic-free cardboard box")).isEqualTo(15);
        assertThat(EnvironmentalScorer.packagingDelta("non-recyclable pouch")).isEqualTo(-10);
        assertThat(EnvironmentalScorer.packagingDelta("recyclable glass jar")).isEqualTo(20);
    }

    @Test
    void unknown_packaging_should_be_neutral() {
        assertThat(EnvironmentalScorer.packagingDelta(ProductFacts.UNKNOWN_PACKAGING)).isZero();
        assertThat(EnvironmentalScorer.packagingDelta(null)).isZero();
    }

    @Test
    void shipping_tier_should_follow_origin() {
        assertThat(EnvironmentalScorer.shippingTier(facts())).isEqualTo(1);
        assertThat(EnvironmentalScorer.shippingTier(facts("origin", "Local farm"))).isZero();
        assertThat(EnvironmentalScorer.shippingTier(facts("origin", "France"))).isEqualTo(2);
        assertThat(EnvironmentalScorer.shippingTier(facts("origin", "Made in China"))).isEqualTo(3);
        assertThat(EnvironmentalScorer.shippingTier(facts("origin", "China", "locally_sourced", true))).isZero();
    }

    @Test
    void shipping_tier_should_match_whole_place_names_only() {
        assertThat(EnvironmentalScorer.shippingTier(facts("origin", "Indiana, USA"))).isEqualTo(2);
        assertThat(EnvironmentalScorer.shippingTier(facts("origin", "Ohio, USA"))).isEqualTo(2);
        assertThat(EnvironmentalScorer.shippingTier(facts("origin", "Farmington, NM"))).isEqualTo(2);
        assertThat(EnvironmentalScorer.shippingTier(facts("origin", "Locale, Italy"))).isEqualTo(2);
        assertThat(EnvironmentalScorer.shippingTier(facts("origin", "Kerala, India"))).isEqualTo(3);
        assertThat(EnvironmentalScorer.shippingTier(facts("origin", "Family farms, Vermont"))).isZero();
    }

    @Test
    void carbon_neutral_and_local_should_stack() {
        ProductFacts f = facts("carbon_neutral", true, "locally_sourced", true);

        assertThat(EnvironmentalScorer.carbonDelta(f)).isEqualTo(15);
    }

    @Test
    void additives_should_penalize_environmental_health_with_cap() {
        ProductFacts f = facts("ingredients", "msg, aspartame, red 40, tbhq, carrageenan");

        assertThat(EnvironmentalScorer.additivePenalty(f)).isEqualTo(15);
    }

    @Test
    void extreme_inputs_should_stay_in_range() {
        ProductFacts worst = facts(
                "category", "electronics",
                "packaging", "single-use pvc plastic blister multilayer styrofoam sachet",
                "materials", "pvc plastic synthetic microbeads palm oil",
                "origin", "China");
        ProductFacts best = facts(
                "packaging", "compostable biodegradable recyclable recycled reusable refillable glass paper",
                "materials", "recycled bamboo hemp organic cotton natural renewable plant-based",
                "certifications", "fsc, b-corp, cradle-to-cradle, eu-ecolabel",
                "organic", true, "carbon_neutral", true, "locally_sourced", true);

        for (SubScoreSet s : List.of(scorer.scoreEnvironment(worst), scorer.scoreEnvironment(best))) {
            for (String n : s.names()) {
                assertThat(s.get(n)).as(n).isBetween(0, 100);
            }
        }
        assertThat(scorer.scoreEnvironment(worst).get(SubScoreSet.PACKAGING)).isZero();
        assertThat(scorer.scoreEnvironment(best).get(SubScoreSet.PACKAGING)).isEqualTo(100);
    }

    @Test
    void overall_should_divide_by_weight_total_and_honor_custom_weights() {
        SubScoreSet s = SubScoreSet.builder()
                .put(SubScoreSet.PACKAGING, 20)
                .put(SubScoreSet.CARBON, 80)
                .put(SubScoreSet.MATERIALS, 40)
                .put(SubScoreSet.HEALTH, 0)
                .build();

        ScoringWeights carbonOnly = new ScoringWeights();
        carbonOnly.setPackaging(0);
        carbonOnly.setMaterials(0);
        carbonOnly.setCarbon(2.0);

        ScoringWeights unnormalized = new ScoringWeights();
        unnormalized.setPackaging(3);
        unnormalized.setCarbon(4);
        unnormalized.setMaterials(3);

        assertThat(new EnvironmentalScorer(carbonOnly).overall(s)).isEqualTo(80);
        // 0.3*20 + 0.4*80 + 0.3*40 = 50，權重放大 10 倍結果相同
        assertThat(scorer.overall(s)).isEqualTo(50);
        assertThat(new EnvironmentalScorer(unnormalized).overall(s)).isEqualTo(50);
    }

    @Test
    void invalid_weights_should_fail_fast() {
        ScoringWeights negative = new ScoringWeights();
        negative.setCarbon(-0.1);

        ScoringWeights empty = new ScoringWeights();
        empty.setPackaging(0);
        empty.setCarbon(0);
        empty.setMaterials(0);

        assertThatThrownBy(() -> new EnvironmentalScorer(negative))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("ANALYSIS_WEIGHT_NEGATIVE");
        assertThatThrownBy(() -> new EnvironmentalScorer(empty))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("ANALYSIS_WEIGHTS_EMPTY");
    }

    @Test
    void quinoa_salad_should_score_well() {
        SubScoreSet s = scorer.scoreEnvironment(ProductFixtures.quinoaSalad());

        assertThat(s.get(SubScoreSet.PACKAGING)).isEqualTo(80);
        assertThat(s.get(SubScoreSet.CARBON)).isEqualTo(60);
        assertThat(s.get(SubScoreSet.MATERIALS)).isEqualTo(78);
        assertThat(scorer.overall(s)).isEqualTo(71);
    }

    @Test
    void same_facts_should_score_identically() {
        ProductFacts f = ProductFixtures.chips();

        assertThat(scorer.scoreEnvironment(f)).isEqualTo(scorer.scoreEnvironment(f));
    }
}

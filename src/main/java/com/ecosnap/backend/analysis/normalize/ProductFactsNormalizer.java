package com.ecosnap.backend.analysis.normalize;

import com.ecosnap.backend.analysis.model.NutritionFacts;
import com.ecosnap.backend.analysis.model.ProductCategory;
import com.ecosnap.backend.analysis.model.ProductFacts;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * 原始 payload → {@link ProductFacts}。純函式；只有缺商品名稱才會丟例外，其餘欄位都有預設值。
 */
@Component
public class ProductFactsNormalizer {

    /** salt(g) → sodium(mg) */
    private static final double SALT_TO_SODIUM_MG = 393.4;

    public ProductFacts normalize(Map<String, ?> raw) {
        FieldAliasTable t = FieldAliasTable.index(raw);

        String name = RawValues.text(t.get(ProductField.PRODUCT_NAME));
        if (name == null) throw NormalizationException.productNameRequired();

        List<String> ingredients = RawValues.stringList(t.get(ProductField.INGREDIENTS));
        SortedSet<String> certifications = canonicalCertifications(t.get(ProductField.CERTIFICATIONS));

        boolean organic = RawValues.bool(t.get(ProductField.ORGANIC)) || hasCertContaining(certifications, "organic");
        boolean fairTrade = RawValues.bool(t.get(ProductField.FAIR_TRADE)) || hasCertContaining(certifications, "fair-trade");
        boolean carbonNeutral = RawValues.bool(t.get(ProductField.CARBON_NEUTRAL)) || hasCertContaining(certifications, "carbon-neutral");

        return new ProductFacts(
                name,
                RawValues.text(t.get(ProductField.BRAND)),
                ProductCategory.parseOrGeneral(RawValues.text(t.get(ProductField.CATEGORY))),
                ingredients,
                certifications,
                RawValues.text(t.get(ProductField.PACKAGING)),
                RawValues.text(t.get(ProductField.ORIGIN)),
                RawValues.text(t.get(ProductField.MATERIALS)),
                nutrition(t),
                organic,
                fairTrade,
                RawValues.bool(t.get(ProductField.LOCALLY_SOURCED)),
                carbonNeutral
        );
    }

    /**
     * 營養欄位：巢狀物件優先，沒有再看頂層 key。全部都沒有 → null（Health Scorer 會跳過）。
     */
    private static NutritionFacts nutrition(FieldAliasTable top) {
        Object nested = top.get(ProductField.NUTRITION);
        FieldAliasTable inner = (nested instanceof Map<?, ?> m) ? FieldAliasTable.index(m) : null;

        Double calories = num(inner, top, ProductField.CALORIES);
        Double protein = num(inner, top, ProductField.PROTEIN);
        Double carbs = num(inner, top, ProductField.CARBS);
        Double fat = num(inner, top, ProductField.FAT);
        Double fiber = num(inner, top, ProductField.FIBER);
        Double sugar = num(inner, top, ProductField.SUGAR);
        Double sodiumMg = sodiumMg(inner, top);

        String serving = RawValues.text(first(inner, top, ProductField.SERVING_SIZE));

        NutritionFacts n = new NutritionFacts(
                calories, protein, carbs, fat, fiber, sugar, sodiumMg,
                serving, RawValues.servingGrams(serving)
        );
        return n.hasAnyValue() ? n : null;
    }

    private static Double sodiumMg(FieldAliasTable inner, FieldAliasTable top) {
        Double mg = num(inner, top, ProductField.SODIUM_MG);
        if (mg != null) return mg;

        Double g = num(inner, top, ProductField.SODIUM_G);
        if (g != null) return g * 1000.0;

        Double salt = num(inner, top, ProductField.SALT_G);
        if (salt != null) return salt * SALT_TO_SODIUM_MG;

        return null;
    }

    private static Double num(FieldAliasTable inner, FieldAliasTable top, ProductField f) {
        return RawValues.number(first(inner, top, f));
    }

    private static Object first(FieldAliasTable inner, FieldAliasTable top, ProductField f) {
        Object v = (inner == null) ? null : inner.get(f);
        return (v != null) ? v : top.get(f);
    }

    /** "Fair Trade" / "fair_trade" → "fair-trade" */
    static SortedSet<String> canonicalCertifications(Object raw) {
        SortedSet<String> out = new TreeSet<>();
        for (String it : RawValues.stringList(raw)) {
            String c = it.toLowerCase(Locale.ROOT)
                    .replaceAll("[\\s_]+", "-")
                    .replaceAll("-{2,}", "-")
                    .replaceAll("^-|-$", "");
            if (c.equals("fairtrade")) c = "fair-trade";
            if (c.equals("nongmo")) c = "non-gmo";
            if (!c.isEmpty()) out.add(c);
        }
        return out;
    }

    /** "usda-organic" 算 organic；"inorganic" / "non-organic" 不算 */
    static boolean hasCertContaining(SortedSet<String> certs, String token) {
        Pattern p = Pattern.compile("(?<![a-z])(?<!non-)" + Pattern.quote(token) + "(?![a-z])");
        for (String c : certs) {
            if (p.matcher(c).find()) return true;
        }
        return false;
    }
}

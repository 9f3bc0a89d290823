package com.ecosnap.backend.analysis.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 正規化後的商品描述。建立後不可變；所有 scorer 只看這個型別。
 */
public record ProductFacts(
        String productName,
        String brand,
        ProductCategory category,
        List<String> ingredients,
        SortedSet<String> certifications,
        String packaging,
        String originCountry,
        String materials,
        NutritionFacts nutrition,
        boolean organic,
        boolean fairTrade,
        boolean locallySourced,
        boolean carbonNeutral
) {

    public static final String UNKNOWN_BRAND = "unknown brand";
    public static final String UNKNOWN_PACKAGING = "unknown packaging";
    public static final String UNSPECIFIED = "unspecified";

    /** completeness() 的分母：brand/category/ingredients/certifications/packaging/origin/materials/nutrition */
    private static final int OPTIONAL_FIELD_COUNT = 8;

    public ProductFacts {
        Objects.requireNonNull(productName, "productName");
        brand = (brand == null || brand.isBlank()) ? UNKNOWN_BRAND : brand;
        category = (category == null) ? ProductCategory.GENERAL : category;
        ingredients = (ingredients == null) ? List.of() : List.copyOf(ingredients);
        certifications = (certifications == null)
                ? Collections.unmodifiableSortedSet(new TreeSet<>())
                : Collections.unmodifiableSortedSet(new TreeSet<>(certifications));
        packaging = (packaging == null || packaging.isBlank()) ? UNKNOWN_PACKAGING : packaging;
        originCountry = (originCountry == null || originCountry.isBlank()) ? UNSPECIFIED : originCountry;
        materials = (materials == null || materials.isBlank()) ? UNSPECIFIED : materials;
    }

    public boolean hasNutrition() {
        return nutrition != null && nutrition.hasAnyValue();
    }

    /**
     * 有提供的 optional 欄位比例（0..1）；預設值不算有提供。
     */
    public double completeness() {
        int present = 0;
        if (!UNKNOWN_BRAND.equals(brand)) present++;
        if (category != ProductCategory.GENERAL) present++;
        if (!ingredients.isEmpty()) present++;
        if (!certifications.isEmpty()) present++;
        if (!UNKNOWN_PACKAGING.equals(packaging)) present++;
        if (!UNSPECIFIED.equals(originCountry)) present++;
        if (!UNSPECIFIED.equals(materials)) present++;
        if (hasNutrition()) present++;
        return present / (double) OPTIONAL_FIELD_COUNT;
    }

    /**
     * 內容指紋（SHA-256 hex），給呼叫端當 cache key。
     * 每個值都帶長度前綴，清單帶元素數，避免 ["a,b"] 跟 ["a","b"] 撞成同一個字串。
     */
    public String fingerprint() {
        StringBuilder sb = new StringBuilder(256);
        put(sb, productName);
        put(sb, brand);
        put(sb, category.name());
        putAll(sb, ingredients);
        putAll(sb, certifications);
        put(sb, packaging);
        put(sb, originCountry);
        put(sb, materials);
        if (nutrition == null) {
            sb.append("N;");
        } else {
            sb.append("n;");
            put(sb, nutrition.calories());
            put(sb, nutrition.proteinG());
            put(sb, nutrition.carbsG());
            put(sb, nutrition.fatG());
            put(sb, nutrition.fiberG());
            put(sb, nutrition.sugarG());
            put(sb, nutrition.sodiumMg());
            put(sb, nutrition.servingSize());
            put(sb, nutrition.servingGrams());
        }
        sb.append(organic ? '1' : '0')
          .append(fairTrade ? '1' : '0')
          .append(locallySourced ? '1' : '0')
          .append(carbonNeutral ? '1' : '0');

        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(sb.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA256_UNAVAILABLE", e);
        }
    }

    // null 用 "-;"，跟空字串 "0:;" 分開
    private static void put(StringBuilder sb, Object v) {
        if (v == null) {
            sb.append("-;");
            return;
        }
        String s = String.valueOf(v);
        sb.append(s.length()).append(':').append(s).append(';');
    }

    private static void putAll(StringBuilder sb, Collection<String> values) {
        sb.append('[').append(values.size()).append(']');
        for (String v : values) put(sb, v);
    }
}

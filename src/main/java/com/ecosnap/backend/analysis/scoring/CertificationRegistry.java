package com.ecosnap.backend.analysis.scoring;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 固定的認證清單。輸入必須是正規化過的 token（小寫、連字號）。
 * 同一個認證的別名會歸到同一個 canonical 名稱，避免重複加分。
 */
public final class CertificationRegistry {

    private CertificationRegistry() {}

    private static final Map<String, String> KNOWN = new LinkedHashMap<>();

    static {
        alias("organic", "organic", "usda-organic", "eu-organic", "certified-organic", "ecocert");
        alias("non-gmo", "non-gmo", "non-gmo-project", "non-gmo-project-verified", "gmo-free");
        alias("fair-trade", "fair-trade", "fairtrade-international", "fair-trade-certified", "fair-trade-usa");
        alias("rainforest-alliance", "rainforest-alliance", "rainforest-alliance-certified");
        alias("fsc", "fsc", "fsc-certified", "forest-stewardship-council");
        alias("msc", "msc", "marine-stewardship-council");
        alias("carbon-neutral", "carbon-neutral", "climate-neutral", "climate-neutral-certified");
        alias("b-corp", "b-corp", "certified-b-corporation", "b-corporation");
        alias("energy-star", "energy-star");
        alias("epeat", "epeat", "epeat-gold", "epeat-silver");
        alias("tco-certified", "tco-certified", "tco");
        alias("cradle-to-cradle", "cradle-to-cradle", "c2c", "cradle-to-cradle-certified");
        alias("leaping-bunny", "leaping-bunny", "cruelty-free");
        alias("eu-ecolabel", "eu-ecolabel", "ecolabel");
    }

    private static void alias(String canonical, String... tokens) {
        for (String t : tokens) KNOWN.put(t, canonical);
    }

    /** 不認得 → null */
    public static String canonicalOrNull(String token) {
        if (token == null) return null;
        return KNOWN.get(token);
    }

    /**
     * 回傳認得的認證（canonical，依輸入順序去重）
     */
    public static List<String> recognized(Collection<String> tokens) {
        List<String> out = new ArrayList<>();
        if (tokens == null) return out;
        for (String t : tokens) {
            String c = canonicalOrNull(t);
            if (c != null && !out.contains(c)) out.add(c);
        }
        return out;
    }
}

package com.ecosnap.backend.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public enum ProductCategory {
    FOOD("food"),
    ELECTRONICS("electronics"),
    PERSONAL_CARE("personal-care"),
    GENERAL("general");

    // 順序即比對優先序（子字串比對時要可預期）
    private static final Map<String, ProductCategory> ALIAS = new LinkedHashMap<>();

    static {
        for (String k : List.of("food", "foods", "beverage", "beverages", "drink", "snack", "snacks",
                "grocery", "produce", "dairy", "meat")) {
            ALIAS.put(k, FOOD);
        }
        for (String k : List.of("electronics", "electronic", "tech", "appliance", "appliances")) {
            ALIAS.put(k, ELECTRONICS);
        }
        for (String k : List.of("personalcare", "cosmetics", "beauty", "hygiene", "toiletries")) {
            ALIAS.put(k, PERSONAL_CARE);
        }
        ALIAS.put("general", GENERAL);
    }

    private final String wire;

    ProductCategory(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /**
     * 未知或空白一律視為 GENERAL（不丟例外）
     */
    public static ProductCategory parseOrGeneral(String raw) {
        if (raw == null) return GENERAL;
        String k = raw.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_\\-]+", "");
        if (k.isEmpty()) return GENERAL;

        ProductCategory exact = ALIAS.get(k);
        if (exact != null) return exact;

        // "Food & Beverages" / "organic snacks"
        for (Map.Entry<String, ProductCategory> e : ALIAS.entrySet()) {
            if (e.getValue() != GENERAL && k.contains(e.getKey())) return e.getValue();
        }
        return GENERAL;
    }
}

package com.ecosnap.backend.analysis.normalize;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * 把鬆散的原始 key/value 建成 canonical key 索引，再依 {@link ProductField} 的別名順序取值。
 */
final class FieldAliasTable {

    private final Map<String, Object> byCanonicalKey;

    private FieldAliasTable(Map<String, Object> byCanonicalKey) {
        this.byCanonicalKey = byCanonicalKey;
    }

    static FieldAliasTable index(Map<?, ?> raw) {
        // TreeMap：raw key 排序後再建索引，同一 canonical key 撞名時結果固定
        Map<String, Object> sortedRaw = new TreeMap<>();
        if (raw != null) {
            for (Map.Entry<?, ?> e : raw.entrySet()) {
                if (e.getKey() == null) continue;
                sortedRaw.put(String.valueOf(e.getKey()), e.getValue());
            }
        }

        Map<String, Object> idx = new TreeMap<>();
        for (Map.Entry<String, Object> e : sortedRaw.entrySet()) {
            if (e.getValue() == null) continue;
            idx.putIfAbsent(canonicalKey(e.getKey()), e.getValue());
        }
        return new FieldAliasTable(idx);
    }

    static String canonicalKey(String key) {
        if (key == null) return "";
        return key.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    Object get(ProductField field) {
        for (String alias : field.aliases()) {
            Object v = byCanonicalKey.get(alias);
            if (v == null) continue;
            if (v instanceof String s && s.isBlank()) continue;
            // 只有 nutrition 收物件；其他欄位遇到物件就換下一個別名（"product": {...} 不能擋住 "title"）
            if (v instanceof Map<?, ?> && !field.objectValued()) continue;
            return v;
        }
        return null;
    }
}

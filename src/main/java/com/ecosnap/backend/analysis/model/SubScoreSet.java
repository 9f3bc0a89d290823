package com.ecosnap.backend.analysis.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 一組具名的 0..100 分數。寫入時就夾在範圍內，讀出來不會越界。
 */
public final class SubScoreSet {

    public static final String PACKAGING = "packaging";
    public static final String CARBON = "carbon";
    public static final String MATERIALS = "materials";
    public static final String HEALTH = "health";

    public static final String HEALTH_SCORE = "health_score";
    public static final String SUSTAINABILITY_SCORE = "sustainability_score";

    private final Map<String, Integer> scores;

    private SubScoreSet(Map<String, Integer> scores) {
        this.scores = Collections.unmodifiableMap(scores);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Integer get(String name) {
        return scores.get(name);
    }

    public int getOrDefault(String name, int fallback) {
        Integer v = scores.get(name);
        return v == null ? fallback : v;
    }

    public boolean has(String name) {
        return scores.containsKey(name);
    }

    public Set<String> names() {
        return scores.keySet();
    }

    /** 保持插入順序，序列化時欄位順序穩定 */
    public Map<String, Integer> asMap() {
        return scores;
    }

    public SubScoreSet with(String name, double value) {
        Map<String, Integer> copy = new LinkedHashMap<>(scores);
        copy.put(name, clamp(value));
        return new SubScoreSet(copy);
    }

    public static int clamp(double v) {
        if (Double.isNaN(v)) return 0;
        long r = Math.round(v);
        if (r < 0) return 0;
        if (r > 100) return 100;
        return (int) r;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubScoreSet other)) return false;
        return scores.equals(other.scores);
    }

    @Override
    public int hashCode() {
        return scores.hashCode();
    }

    @Override
    public String toString() {
        return "SubScoreSet" + scores;
    }

    public static final class Builder {
        private final Map<String, Integer> scores = new LinkedHashMap<>();

        public Builder put(String name, double value) {
            scores.put(name, clamp(value));
            return this;
        }

        public SubScoreSet build() {
            return new SubScoreSet(new LinkedHashMap<>(scores));
        }
    }
}

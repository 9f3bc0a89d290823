package com.ecosnap.backend.analysis.model;

/**
 * 門檻含下界：90→A、75→B、60→C、40→D，其餘 E。
 */
public enum SustainabilityGrade {
    A(90),
    B(75),
    C(60),
    D(40),
    E(0);

    private final int minScore;

    SustainabilityGrade(int minScore) {
        this.minScore = minScore;
    }

    public static SustainabilityGrade fromScore(int score) {
        for (SustainabilityGrade g : values()) {
            if (score >= g.minScore) return g;
        }
        return E;
    }

    /** A 比 B 好；isAtLeast(B) 對 A/B 都成立 */
    public boolean isAtLeast(SustainabilityGrade other) {
        return this.ordinal() <= other.ordinal();
    }
}

package com.ecosnap.backend.analysis.scoring;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 環境總分的權重表。預設 packaging 0.3 / carbon 0.4 / materials 0.3；health 只當參考（0）。
 * 不要求總和為 1，計算時會除以總和。
 */
@Data
@ConfigurationProperties(prefix = "app.analysis.weights")
public class ScoringWeights {

    private double packaging = 0.3;
    private double carbon = 0.4;
    private double materials = 0.3;
    private double health = 0.0;

    public double total() {
        return packaging + carbon + materials + health;
    }

    /** 負數或全為 0 → 啟動就失敗 */
    public void validate() {
        if (packaging < 0 || carbon < 0 || materials < 0 || health < 0) {
            throw new IllegalStateException("ANALYSIS_WEIGHT_NEGATIVE");
        }
        if (total() <= 0.0) {
            throw new IllegalStateException("ANALYSIS_WEIGHTS_EMPTY");
        }
    }
}

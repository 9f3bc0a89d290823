package com.ecosnap.backend.analysis.provider.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.provider.gemini")
public class GeminiProperties {

    /** 開關：dev 沒 key 也能啟動（預設 false → 全部走 heuristic） */
    private boolean enabled = false;

    private String baseUrl = "https://generativelanguage.googleapis.com";

    private String model = "gemini-2.5-flash";

    /** 用環境變數帶入：GEMINI_API_KEY */
    private String apiKey;

    private Duration connectTimeout = Duration.ofSeconds(2);

    /** 要比 app.analysis.enrichment.deadline 短或相近；deadline 才是最後防線 */
    private Duration readTimeout = Duration.ofSeconds(4);

    /** 成本守門 */
    private int maxOutputTokens = 768;

    /** 低溫度降低亂講 */
    private double temperature = 0.2;

    // ===== getters/setters =====
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }

    public int getMaxOutputTokens() { return maxOutputTokens; }
    public void setMaxOutputTokens(int maxOutputTokens) { this.maxOutputTokens = maxOutputTokens; }

    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }
}

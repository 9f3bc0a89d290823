package com.ecosnap.backend.analysis.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.analysis.enrichment")
public class EnrichmentProperties {

    /** AI enrichment 的硬上限；超過就取消並走 fallback */
    private Duration deadline = Duration.ofSeconds(4);

    /** enrichment executor 執行緒數 */
    private int poolSize = 4;

    /** 排隊上限；滿了直接 fallback（不阻塞請求） */
    private int queueCapacity = 50;
}

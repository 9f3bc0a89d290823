package com.ecosnap.backend.analysis.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.analysis.cache")
public class AnalysisCacheProperties {

    /** 關掉時每次都重新分析 */
    private boolean enabled = true;

    private Duration ttl = Duration.ofHours(6);

    private long maxSize = 10_000;
}

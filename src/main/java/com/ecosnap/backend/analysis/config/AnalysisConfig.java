package com.ecosnap.backend.analysis.config;

import com.ecosnap.backend.analysis.scoring.ScoringWeights;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableConfigurationProperties({ScoringWeights.class, EnrichmentProperties.class, AnalysisCacheProperties.class})
public class AnalysisConfig {

    /**
     * AI enrichment 專用 pool。佇列滿了直接拒絕（gateway 會轉成 fallback），不讓請求排隊等待。
     */
    @Bean("enrichmentExecutor")
    public ThreadPoolTaskExecutor enrichmentExecutor(EnrichmentProperties props) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(props.getPoolSize());
        ex.setMaxPoolSize(props.getPoolSize());
        ex.setQueueCapacity(props.getQueueCapacity());
        ex.setThreadNamePrefix("enrich-");
        ex.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        ex.setWaitForTasksToCompleteOnShutdown(false);
        ex.initialize();
        return ex;
    }
}

package com.ecosnap.backend.analysis.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.cache.support.NoOpCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableCaching
public class AnalysisCacheConfig {

    public static final String CACHE_NAME = "analysisResult";

    @Bean("analysisCacheManager")
    public CacheManager analysisCacheManager(AnalysisCacheProperties props) {
        // 關掉時給 NoOp，@Cacheable 照常呼叫但永遠 miss
        if (!props.isEnabled()) return new NoOpCacheManager();

        CaffeineCacheManager mgr = new CaffeineCacheManager(CACHE_NAME);
        mgr.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(props.getTtl())
                .maximumSize(props.getMaxSize())
        );
        return mgr;
    }
}

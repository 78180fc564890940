package com.example.earnings.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class CacheConfig {
    @Bean
    public CacheManager cacheManager(@Value("${decomposition.cache.max-size:10000}") long maxSize,
                                     @Value("${decomposition.cache.ttl-seconds:600}") long ttlSeconds) {
        CaffeineCacheManager cm = new CaffeineCacheManager("decomposition");
        cm.setCaffeine(Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(Duration.ofSeconds(ttlSeconds)));
        // 엔티티 단위 계산은 동기 반환이라 AsyncCache 불필요
        cm.setAsyncCacheMode(false);
        return cm;
    }
}

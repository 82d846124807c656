package com.aiinpocket.rewards.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * 快取配置。
 * 等級階梯很少變動，每次計算等級都會讀取，以 Caffeine 本地快取 10 分鐘。
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String TIER_LADDERS = "tierLadders";

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager(TIER_LADDERS);
        manager.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(10));
        return manager;
    }
}

package com.aiinpocket.studyquest.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 排行榜快取。
 * 只有排行榜走 Caffeine，key 為 limit，結算流程本身不讀快取。
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfig {

    public static final String LEADERBOARD_CACHE = "leaderboard";

    @Bean
    public CacheManager cacheManager(@Value("${gamification.ranking.leaderboard-ttl-seconds:60}") long ttlSeconds) {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.setAllowNullValues(false);
        // limit 只允許 1 ~ 100，實際上只會有少數幾種
        manager.registerCustomCache(LEADERBOARD_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofSeconds(ttlSeconds))
                .maximumSize(100)
                .build());
        log.info("[快取] 排行榜快取 TTL={}s", ttlSeconds);
        return manager;
    }
}

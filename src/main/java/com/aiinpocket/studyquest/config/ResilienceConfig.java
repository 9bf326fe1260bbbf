package com.aiinpocket.studyquest.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

import java.time.Clock;

/**
 * 事件儲存存取的重試設定。
 * 只重試暫時性的資料庫錯誤（連線中斷、鎖等待逾時、查詢逾時），違反唯一約束等錯誤直接往上拋。
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    public static final String EVENT_STORE_RETRY = "eventStore";

    @Bean
    public RetryRegistry retryRegistry(GamificationProperties properties) {
        GamificationProperties.PipelineParams pipeline = properties.pipeline();

        RetryConfig eventStoreConfig = RetryConfig.custom()
                .maxAttempts(pipeline.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(pipeline.backoffMs(), 2))
                .retryExceptions(
                        TransientDataAccessException.class,
                        RecoverableDataAccessException.class,
                        DataAccessResourceFailureException.class
                )
                .ignoreExceptions(
                        IllegalArgumentException.class,
                        DataIntegrityViolationException.class
                )
                .build();

        RetryRegistry registry = RetryRegistry.of(eventStoreConfig);
        registry.retry(EVENT_STORE_RETRY, eventStoreConfig);

        log.info("[事件儲存] 重試設定完成: 最多 {} 次, 初始退避 {}ms, 查詢逾時 {}s",
                pipeline.maxAttempts(), pipeline.backoffMs(), pipeline.queryTimeoutSeconds());
        return registry;
    }

    /** 計分流程所有「現在時間」都從這裡取得，測試時可替換為固定時鐘 */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

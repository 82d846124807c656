package com.aiinpocket.rewards.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * 背景任務執行緒池。
 *
 * <ul>
 *   <li>{@code validationExecutor}：挑戰驗證排程中，每位參加者的驗證與結算在此池中並行執行</li>
 * </ul>
 *
 * <p>佇列滿時由呼叫端執行（CallerRunsPolicy），排程不會丟棄任何參加者。
 */
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final RewardEngineProperties properties;

    @Bean
    public ThreadPoolTaskExecutor validationExecutor() {
        RewardEngineProperties.ValidationParams params = properties.validation();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(params.corePoolSize());
        executor.setMaxPoolSize(params.maxPoolSize());
        executor.setQueueCapacity(params.queueCapacity());
        executor.setThreadNamePrefix("validate-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}

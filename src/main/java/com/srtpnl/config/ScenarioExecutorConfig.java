package com.srtpnl.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for parallel scenario evaluation.
 *
 * <p>Only used when {@code srt.analysis.parallel-enabled=true}. Each task owns its own
 * simulation state, so the pool needs no coordination beyond re-ordering results.
 * Saturation falls back to running on the caller's thread.
 */
@Configuration
public class ScenarioExecutorConfig {

    @Bean("scenarioExecutor")
    public ThreadPoolTaskExecutor scenarioExecutor(StressAnalysisProperties stressAnalysisProperties) {
        StressAnalysisProperties.Executor settings = stressAnalysisProperties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("scenario-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}

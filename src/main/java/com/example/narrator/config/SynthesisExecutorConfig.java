package com.example.narrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for per-line speech synthesis and word transcription.
 */
@Configuration
@EnableConfigurationProperties(SynthesisProperties.class)
public class SynthesisExecutorConfig {

    @Bean(name = "synthesisTaskExecutor")
    public ThreadPoolTaskExecutor synthesisTaskExecutor(SynthesisProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(properties.getExecutorThreads(), properties.getMaxConcurrency());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getExecutorQueueCapacity());
        executor.setThreadNamePrefix("synth-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}

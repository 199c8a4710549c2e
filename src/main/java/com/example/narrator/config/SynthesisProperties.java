package com.example.narrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Concurrency limits for per-line speech synthesis.
 */
@ConfigurationProperties(prefix = "narrator.synthesis")
public class SynthesisProperties {

    private int maxConcurrency = 4;
    private int executorThreads = 4;
    private int executorQueueCapacity = 200;
    private boolean transcribeWords = true;
    private long lineTimeoutSeconds = 300;

    public int getMaxConcurrency() { return maxConcurrency; }
    public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

    public int getExecutorThreads() { return executorThreads; }
    public void setExecutorThreads(int executorThreads) { this.executorThreads = executorThreads; }

    public int getExecutorQueueCapacity() { return executorQueueCapacity; }
    public void setExecutorQueueCapacity(int executorQueueCapacity) { this.executorQueueCapacity = executorQueueCapacity; }

    public boolean isTranscribeWords() { return transcribeWords; }
    public void setTranscribeWords(boolean transcribeWords) { this.transcribeWords = transcribeWords; }

    public long getLineTimeoutSeconds() { return lineTimeoutSeconds; }
    public void setLineTimeoutSeconds(long lineTimeoutSeconds) { this.lineTimeoutSeconds = lineTimeoutSeconds; }
}

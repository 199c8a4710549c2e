package com.example.narrator.config;

/**
 * Connection settings shared by the OpenAI-compatible HTTP clients (chat, speech, transcription).
 */
public class OpenAIServiceProperties {

    private boolean enabled = true;
    private String baseUrl = "https://api.openai.com";
    private String apiKey;
    private String model;
    private long timeoutSeconds = 120;
    private int maxAttempts = 3;
    private long backoffMillis = 500;

    public OpenAIServiceProperties() {
    }

    public OpenAIServiceProperties(String model) {
        this.model = model;
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public boolean hasApiKey() { return apiKey != null && !apiKey.isBlank(); }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public long getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(long timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public long getBackoffMillis() { return backoffMillis; }
    public void setBackoffMillis(long backoffMillis) { this.backoffMillis = backoffMillis; }
}

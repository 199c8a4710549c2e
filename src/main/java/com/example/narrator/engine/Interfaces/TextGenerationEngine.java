package com.example.narrator.engine.Interfaces;

/**
 * Language-model text service used by analysis, script writing and quality review.
 */
public interface TextGenerationEngine {
    record Request(String purpose, String systemPrompt, String prompt, boolean jsonResponse) {}

    String generate(Request request);

    /** False when no model is configured; callers then use their rule-based path. */
    default boolean isAvailable() {
        return true;
    }
}

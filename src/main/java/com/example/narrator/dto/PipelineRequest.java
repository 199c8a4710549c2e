package com.example.narrator.dto;

import com.example.narrator.util.SourceType;

/**
 * Input of one pipeline run. Null options fall back to configuration.
 */
public record PipelineRequest(String source,
                              SourceType sourceType,
                              Integer targetSeconds,
                              Boolean qualityCheckEnabled,
                              Boolean keepTemp) {

    public static PipelineRequest text(String text) {
        return new PipelineRequest(text, SourceType.TEXT, null, null, null);
    }
}

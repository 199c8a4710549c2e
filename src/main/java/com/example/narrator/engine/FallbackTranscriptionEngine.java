package com.example.narrator.engine;

import com.example.narrator.engine.Interfaces.TranscriptionEngine;
import com.example.narrator.exception.NarratorException;
import com.example.narrator.model.WordTimestamp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Uses the primary engine and falls back to even-split estimates when it is unavailable or returns nothing.
 */
public class FallbackTranscriptionEngine implements TranscriptionEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(FallbackTranscriptionEngine.class);

    private final TranscriptionEngine primary;
    private final TranscriptionEngine fallback;

    public FallbackTranscriptionEngine(TranscriptionEngine primary, TranscriptionEngine fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public List<WordTimestamp> transcribe(Request request) {
        if (primary == null) {
            return fallback.transcribe(request);
        }
        try {
            List<WordTimestamp> words = primary.transcribe(request);
            if (words != null && !words.isEmpty()) {
                return words;
            }
            LOGGER.warn("Transcription empty lineId={} - using even split", request.lineId());
        } catch (NarratorException e) {
            LOGGER.warn("Transcription unavailable lineId={} error={} - using even split", request.lineId(), e.getMessage());
        }
        return fallback.transcribe(request);
    }
}

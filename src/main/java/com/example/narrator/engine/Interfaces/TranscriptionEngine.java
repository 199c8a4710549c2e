package com.example.narrator.engine.Interfaces;

import com.example.narrator.model.WordTimestamp;

import java.nio.file.Path;
import java.util.List;

/**
 * Word-level timestamps for one synthesised utterance, relative to the utterance start.
 */
public interface TranscriptionEngine {
    record Request(String lineId, Path audio, String text, double durationSeconds) {}

    List<WordTimestamp> transcribe(Request request);
}

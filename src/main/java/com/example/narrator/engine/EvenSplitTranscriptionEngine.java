package com.example.narrator.engine;

import com.example.narrator.engine.Interfaces.TranscriptionEngine;
import com.example.narrator.model.WordTimestamp;
import com.example.narrator.util.TextUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Estimates word timing by dividing the utterance duration evenly across its words.
 */
public class EvenSplitTranscriptionEngine implements TranscriptionEngine {

    @Override
    public List<WordTimestamp> transcribe(Request request) {
        List<String> tokens = TextUtil.words(request.text());
        if (tokens.isEmpty() || request.durationSeconds() <= 0) {
            return List.of();
        }
        double step = request.durationSeconds() / tokens.size();
        List<WordTimestamp> words = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            words.add(new WordTimestamp(tokens.get(i), i * step, (i + 1) * step));
        }
        return words;
    }
}

package com.example.narrator.dto;

import com.example.narrator.model.Script;
import com.example.narrator.model.Timeline;
import com.example.narrator.model.WordTimestamp;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Speech output: the script with times filled in, the gapless timeline, the merged audio track and,
 * when requested, per-line word timestamps relative to each line's start.
 */
public record SynthesisResult(Script timedScript,
                              Timeline timeline,
                              Path masterAudio,
                              Map<String, Path> lineAudio,
                              Map<String, List<WordTimestamp>> wordsByLine) {

    public SynthesisResult {
        lineAudio = Map.copyOf(lineAudio);
        wordsByLine = Map.copyOf(wordsByLine);
    }

    public double totalDuration() {
        return timeline.totalDuration();
    }
}

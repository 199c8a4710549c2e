package com.example.narrator.engine.Interfaces;

import java.nio.file.Path;

public interface SpeechSynthesisEngine {
    record VoiceOptions(String voice, double speed) {}
    record Request(String lineId, String text, VoiceOptions voice, Path target) {}
    record Result(Path audio, double durationSeconds) {}

    Result synthesize(Request request);
}

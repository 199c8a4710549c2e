package com.example.narrator.dto;

import java.nio.file.Path;
import java.time.Instant;

public record OutputPackage(String jobId, Paths paths, Summary metadata) {

    public record Paths(Path directory,
                        Path video,
                        Path videoClean,
                        Path subtitles,
                        Path audio,
                        Path script,
                        Path thumbnail,
                        Path metadata) {}

    public record Summary(String originalSource, String title, double duration, Instant createdAt, double processingTime) {}
}

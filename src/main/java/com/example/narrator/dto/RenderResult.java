package com.example.narrator.dto;

import java.nio.file.Path;

public record RenderResult(Path videoPath, Path cleanVideoPath, String resolution, double duration, long fileSize) {
}

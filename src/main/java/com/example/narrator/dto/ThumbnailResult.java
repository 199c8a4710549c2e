package com.example.narrator.dto;

import java.nio.file.Path;

public record ThumbnailResult(Path thumbnailPath, int width, int height, String format) {
}

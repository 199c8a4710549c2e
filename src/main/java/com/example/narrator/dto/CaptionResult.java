package com.example.narrator.dto;

import java.nio.file.Path;
import java.util.List;

public record CaptionResult(Path file, String format, List<Entry> entries) {
    public CaptionResult {
        entries = List.copyOf(entries);
    }

    public record Entry(int index, String start, String end, String text) {}
}

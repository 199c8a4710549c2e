package com.example.narrator.dto;

import com.example.narrator.model.Slide;
import com.example.narrator.util.SourceType;

import java.util.List;

public record IntakeResult(String cleanedText,
                           String originalSource,
                           SourceType sourceType,
                           SourceMetadata metadata,
                           List<Slide> slides) {
    public IntakeResult {
        slides = slides == null ? List.of() : List.copyOf(slides);
    }

    public boolean hasSlides() {
        return !slides.isEmpty();
    }
}

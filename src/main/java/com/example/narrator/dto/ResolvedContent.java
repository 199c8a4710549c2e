package com.example.narrator.dto;

import com.example.narrator.model.Slide;

import java.util.List;

/**
 * Raw text fetched or parsed from a source reference, before cleaning.
 */
public record ResolvedContent(String text, SourceMetadata metadata, List<Slide> slides) {
    public ResolvedContent {
        slides = slides == null ? List.of() : List.copyOf(slides);
    }
}

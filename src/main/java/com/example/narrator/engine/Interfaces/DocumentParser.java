package com.example.narrator.engine.Interfaces;

import com.example.narrator.model.Slide;

import java.nio.file.Path;
import java.util.List;

public interface DocumentParser {
    /**
     * Parses a slide document; element boxes are scaled into a frame of the given pixel size.
     */
    List<Slide> parse(Path document, int frameWidth, int frameHeight);

    boolean supports(Path document);
}

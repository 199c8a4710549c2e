package com.example.narrator.engine;

import com.example.narrator.config.VideoProperties;
import com.example.narrator.dto.ResolvedContent;
import com.example.narrator.dto.SourceMetadata;
import com.example.narrator.engine.Interfaces.ContentResolver;
import com.example.narrator.engine.Interfaces.DocumentParser;
import com.example.narrator.exception.ValidationException;
import com.example.narrator.model.Slide;
import com.example.narrator.util.SourceType;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Turns a local slide document into text plus slide elements for keyword highlighting.
 */
public class DocumentContentResolver implements ContentResolver {

    private final DocumentParser parser;
    private final VideoProperties video;
    private final Clock clock;

    public DocumentContentResolver(DocumentParser parser, VideoProperties video, Clock clock) {
        this.parser = parser;
        this.video = video;
        this.clock = clock;
    }

    @Override
    public boolean supports(SourceType sourceType) {
        return sourceType == SourceType.DOCUMENT;
    }

    @Override
    public ResolvedContent resolve(String sourceRef) {
        if (sourceRef == null || sourceRef.isBlank()) {
            throw new ValidationException("document path is blank");
        }
        Path document = Path.of(sourceRef.trim());
        if (!parser.supports(document)) {
            throw new ValidationException("Unsupported document type: " + document.getFileName());
        }
        List<Slide> slides = parser.parse(document, video.getWidth(), video.getHeight());
        if (slides.isEmpty()) {
            throw new ValidationException("Document has no pages: " + document);
        }
        StringBuilder text = new StringBuilder();
        for (Slide slide : slides) {
            if (slide.text() == null || slide.text().isBlank()) continue;
            if (text.length() > 0) text.append("\n\n");
            text.append(slide.text());
        }
        String title = slides.get(0).title();
        return new ResolvedContent(text.toString(), new SourceMetadata(title, null, null, clock.instant()), slides);
    }
}

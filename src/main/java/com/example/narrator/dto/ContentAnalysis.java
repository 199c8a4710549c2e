package com.example.narrator.dto;

import java.util.List;

public record ContentAnalysis(String contentType,
                              String tone,
                              List<Paragraph> paragraphs,
                              List<String> keywords,
                              String coreMessage,
                              int readingMinutes,
                              String complexity) {

    public ContentAnalysis {
        paragraphs = List.copyOf(paragraphs);
        keywords = List.copyOf(keywords);
    }

    public record Paragraph(String content, int startIndex, int endIndex) {}
}

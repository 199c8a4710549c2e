package com.example.narrator.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Shape of {@code metadata.json}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PackageMetadata(String jobId,
                              String originalSource,
                              String title,
                              String author,
                              String publishedDate,
                              String contentType,
                              String tone,
                              List<String> keywords,
                              double duration,
                              String resolution,
                              long fileSize,
                              Instant createdAt,
                              double processingTime) {
}

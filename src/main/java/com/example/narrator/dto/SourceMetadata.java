package com.example.narrator.dto;

import java.time.Instant;

public record SourceMetadata(String title, String author, String publishedDate, Instant extractedAt) {
}

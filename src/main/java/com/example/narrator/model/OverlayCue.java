package com.example.narrator.model;

/**
 * Highlight region with an absolute time window on the master timeline.
 */
public record OverlayCue(String lineId,
                         String text,
                         BoundingBox box,
                         double start,
                         double end,
                         CueConfidence confidence) {
}

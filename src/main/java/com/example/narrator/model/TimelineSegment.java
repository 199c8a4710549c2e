package com.example.narrator.model;

public record TimelineSegment(String lineId, double start, double end) {
    public double duration() {
        return end - start;
    }
}

package com.example.narrator.model;

/**
 * Rectangle in output pixel space.
 */
public record BoundingBox(int x, int y, int width, int height) {

    public long area() {
        return (long) width * height;
    }

    public BoundingBox clampTo(int frameWidth, int frameHeight) {
        int cx = Math.max(0, Math.min(x, frameWidth));
        int cy = Math.max(0, Math.min(y, frameHeight));
        int right = Math.max(cx, Math.min(x + width, frameWidth));
        int bottom = Math.max(cy, Math.min(y + height, frameHeight));
        return new BoundingBox(cx, cy, right - cx, bottom - cy);
    }
}

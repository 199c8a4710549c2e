package com.example.narrator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Gapless ordered mapping of script lines onto the master timeline.
 * <p>
 * The first segment starts at 0 and every segment starts exactly where the previous one ended.
 * Appends must happen in line order; callers that synthesise concurrently collect durations first.
 * Each line id appears at most once.
 */
public class Timeline {
    private final List<TimelineSegment> segments = new ArrayList<>();
    private final Set<String> lineIds = new HashSet<>();
    private double cursor = 0.0;

    public synchronized TimelineSegment append(String lineId, double duration) {
        if (lineId == null || lineId.isBlank()) {
            throw new IllegalArgumentException("lineId is blank");
        }
        if (!Double.isFinite(duration) || duration < 0) {
            throw new IllegalArgumentException("Invalid duration for line " + lineId + ": " + duration);
        }
        if (!lineIds.add(lineId)) {
            throw new IllegalArgumentException("Line " + lineId + " is already on the timeline");
        }
        double start = cursor;
        double end = start + duration;
        TimelineSegment segment = new TimelineSegment(lineId, start, end);
        segments.add(segment);
        cursor = end;
        return segment;
    }

    public synchronized List<TimelineSegment> segments() {
        return Collections.unmodifiableList(new ArrayList<>(segments));
    }

    public synchronized double totalDuration() {
        return cursor;
    }

    public synchronized int size() {
        return segments.size();
    }

    public synchronized Map<String, TimelineSegment> byLineId() {
        Map<String, TimelineSegment> map = new LinkedHashMap<>();
        for (TimelineSegment segment : segments) {
            map.put(segment.lineId(), segment);
        }
        return map;
    }
}

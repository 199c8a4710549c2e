package com.example.narrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One spoken line. Text is fixed at generation; times are absolute seconds on the master timeline
 * and stay null until speech synthesis assigns them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScriptLine(String id,
                         String sectionId,
                         String text,
                         int order,
                         Double startTime,
                         Double endTime,
                         String visualCue,
                         Integer slideIndex) {

    public ScriptLine(String id, String sectionId, String text, int order) {
        this(id, sectionId, text, order, null, null, null, null);
    }

    public ScriptLine withTiming(double start, double end) {
        return new ScriptLine(id, sectionId, text, order, start, end, visualCue, slideIndex);
    }

    public ScriptLine withSlideIndex(Integer slide) {
        return new ScriptLine(id, sectionId, text, order, startTime, endTime, visualCue, slide);
    }

    public boolean isTimed() {
        return startTime != null && endTime != null;
    }
}

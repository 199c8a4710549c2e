package com.example.narrator.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Generated narration, grouped by section.
 */
public record Script(List<ScriptSection> sections,
                     double totalEstimatedDuration,
                     int wordCount,
                     int sentenceCount) {

    public Script {
        sections = List.copyOf(sections);
    }

    /** All lines in speaking order. */
    public List<ScriptLine> lines() {
        List<ScriptLine> all = new ArrayList<>();
        for (ScriptSection section : sections) {
            all.addAll(section.lines());
        }
        return all;
    }

    public String fullText() {
        StringBuilder sb = new StringBuilder();
        for (ScriptLine line : lines()) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(line.text());
        }
        return sb.toString();
    }

    /** Copy with every line replaced by the mapped one (matched by id). */
    public Script mapLines(Function<ScriptLine, ScriptLine> mapper) {
        List<ScriptSection> mapped = new ArrayList<>(sections.size());
        for (ScriptSection section : sections) {
            List<ScriptLine> lines = section.lines().stream().map(mapper).toList();
            mapped.add(new ScriptSection(section.id(), section.type(), section.title(), lines, section.order()));
        }
        return new Script(mapped, totalEstimatedDuration, wordCount, sentenceCount);
    }

    public Script withTimeline(Timeline timeline) {
        Map<String, TimelineSegment> byLine = timeline.byLineId();
        return mapLines(line -> {
            TimelineSegment segment = byLine.get(line.id());
            return segment == null ? line : line.withTiming(segment.start(), segment.end());
        });
    }
}

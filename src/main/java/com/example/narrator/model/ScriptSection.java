package com.example.narrator.model;

import java.util.List;

public record ScriptSection(String id, SectionType type, String title, List<ScriptLine> lines, int order) {
    public ScriptSection {
        lines = List.copyOf(lines);
    }
}

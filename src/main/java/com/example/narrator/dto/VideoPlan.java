package com.example.narrator.dto;

import com.example.narrator.model.SectionType;

import java.util.List;

public record VideoPlan(double targetDuration,
                        List<PlannedSection> structure,
                        String tone,
                        String pacing,
                        String visualStyle) {

    public VideoPlan {
        structure = List.copyOf(structure);
    }

    public record PlannedSection(SectionType sectionType, double estimatedDuration, List<String> objectives) {}
}

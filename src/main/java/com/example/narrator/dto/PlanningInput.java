package com.example.narrator.dto;

/**
 * Analysis plus the requested target length in seconds, or null to derive it from reading time.
 */
public record PlanningInput(ContentAnalysis analysis, Integer targetSeconds) {
}

package com.example.narrator.dto;

public record ScriptInput(IntakeResult intake, ContentAnalysis analysis, VideoPlan plan) {
}

package com.example.narrator.model;

public record QualityIssue(Severity severity, String category, String description, String suggestion) {
}

package com.example.narrator.model;

import java.util.List;

public record QualityVerdict(int score, List<QualityIssue> issues, Recommendation recommendation, boolean passed) {
    public QualityVerdict {
        issues = List.copyOf(issues);
    }
}

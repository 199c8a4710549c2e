package com.example.narrator.service.quality;

import com.example.narrator.dto.QualityReviewInput;
import com.example.narrator.model.QualityIssue;
import com.example.narrator.model.ScriptLine;
import com.example.narrator.model.Severity;

import java.util.ArrayList;
import java.util.List;

public class EmptyLineCheck implements QualityCheck {

    @Override
    public String name() {
        return "empty-lines";
    }

    @Override
    public List<QualityIssue> inspect(QualityReviewInput input) {
        List<QualityIssue> issues = new ArrayList<>();
        List<ScriptLine> lines = input.script().lines();
        if (lines.isEmpty()) {
            issues.add(new QualityIssue(Severity.CRITICAL, "structure", "Script has no lines",
                    "Provide more source text"));
            return issues;
        }
        for (ScriptLine line : lines) {
            if (line.text() == null || line.text().isBlank()) {
                issues.add(new QualityIssue(Severity.MEDIUM, "structure", "Line " + line.id() + " is empty",
                        "Remove the line or give it narration"));
            }
        }
        return issues;
    }
}

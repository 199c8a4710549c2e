package com.example.narrator.service.quality;

import com.example.narrator.dto.QualityReviewInput;
import com.example.narrator.model.QualityIssue;
import com.example.narrator.model.Severity;

import java.util.List;

/**
 * Estimated narration length against the planned target.
 */
public class DurationDeviationCheck implements QualityCheck {
    static final double MAX_DEVIATION = 0.25;

    @Override
    public String name() {
        return "duration";
    }

    @Override
    public List<QualityIssue> inspect(QualityReviewInput input) {
        if (input.plan() == null || input.plan().targetDuration() <= 0) {
            return List.of();
        }
        double target = input.plan().targetDuration();
        double estimated = input.script().totalEstimatedDuration();
        double deviation = Math.abs(estimated - target) / target;
        if (deviation <= MAX_DEVIATION) {
            return List.of();
        }
        return List.of(new QualityIssue(Severity.LOW, "duration",
                String.format("Estimated %.0fs against a %.0fs target", estimated, target),
                estimated > target ? "Shorten the narration" : "Expand the narration"));
    }
}

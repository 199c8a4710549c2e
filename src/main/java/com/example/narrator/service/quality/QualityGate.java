package com.example.narrator.service.quality;

import com.example.narrator.dto.QualityReviewInput;
import com.example.narrator.model.QualityIssue;
import com.example.narrator.model.QualityVerdict;
import com.example.narrator.model.Recommendation;
import com.example.narrator.model.Script;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores a script against its source. Every issue costs its severity penalty; the score starts at 100
 * and never drops below 0, so the order in which issues are found does not matter.
 */
public class QualityGate {
    private static final Logger LOGGER = LoggerFactory.getLogger(QualityGate.class);

    public static final int APPROVE_THRESHOLD = 80;
    public static final int REVISE_THRESHOLD = 60;

    private final List<QualityCheck> checks;
    private final int minScore;

    public QualityGate(List<QualityCheck> checks, int minScore) {
        this.checks = List.copyOf(checks);
        this.minScore = minScore;
    }

    public QualityVerdict review(String sourceText, Script script) {
        return review(new QualityReviewInput(sourceText, script, null));
    }

    public QualityVerdict review(QualityReviewInput input) {
        List<QualityIssue> issues = new ArrayList<>();
        for (QualityCheck check : checks) {
            List<QualityIssue> found = check.inspect(input);
            if (!found.isEmpty()) {
                LOGGER.debug("Quality check {} found {} issue(s)", check.name(), found.size());
                issues.addAll(found);
            }
        }
        return verdictFor(issues);
    }

    public QualityVerdict verdictFor(List<QualityIssue> issues) {
        int score = score(issues);
        return new QualityVerdict(score, issues, recommend(score), score >= minScore);
    }

    public static int score(List<QualityIssue> issues) {
        int penalty = 0;
        for (QualityIssue issue : issues) {
            penalty += issue.severity().penalty();
        }
        return Math.max(0, 100 - penalty);
    }

    public static Recommendation recommend(int score) {
        if (score >= APPROVE_THRESHOLD) return Recommendation.APPROVE;
        if (score >= REVISE_THRESHOLD) return Recommendation.REVISE;
        return Recommendation.REJECT;
    }
}

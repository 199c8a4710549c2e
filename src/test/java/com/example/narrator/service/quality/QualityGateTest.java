package com.example.narrator.service.quality;

import com.example.narrator.dto.QualityReviewInput;
import com.example.narrator.dto.VideoPlan;
import com.example.narrator.model.QualityIssue;
import com.example.narrator.model.QualityVerdict;
import com.example.narrator.model.Recommendation;
import com.example.narrator.model.Script;
import com.example.narrator.model.Severity;
import com.example.narrator.testsupport.Scripts;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QualityGateTest {

    private static final String SOURCE = "Fusion reactors confine plasma with strong magnetic fields. "
            + "Tokamaks shape plasma into a torus.";

    @Test
    void noIssuesScoresHundredAndApproves() {
        QualityGate gate = new QualityGate(List.of(), 70);

        QualityVerdict verdict = gate.verdictFor(List.of());

        assertThat(verdict.score()).isEqualTo(100);
        assertThat(verdict.recommendation()).isEqualTo(Recommendation.APPROVE);
        assertThat(verdict.passed()).isTrue();
    }

    @Test
    void addingAnIssueNeverRaisesTheScore() {
        List<QualityIssue> issues = new ArrayList<>();
        int previous = QualityGate.score(issues);
        Severity[] pattern = {Severity.LOW, Severity.CRITICAL, Severity.MEDIUM, Severity.HIGH};
        for (int i = 0; i < 20; i++) {
            issues.add(issue(pattern[i % pattern.length]));
            int current = QualityGate.score(issues);
            assertThat(current).isLessThanOrEqualTo(previous).isBetween(0, 100);
            previous = current;
        }
        assertThat(previous).isZero();
    }

    @Test
    void scoreDoesNotDependOnIssueOrder() {
        List<QualityIssue> issues = List.of(issue(Severity.HIGH), issue(Severity.LOW), issue(Severity.MEDIUM));
        List<QualityIssue> reversed = new ArrayList<>(issues);
        Collections.reverse(reversed);

        assertThat(QualityGate.score(issues)).isEqualTo(QualityGate.score(reversed)).isEqualTo(65);
    }

    @Test
    void recommendationFollowsThresholds() {
        assertThat(QualityGate.recommend(100)).isEqualTo(Recommendation.APPROVE);
        assertThat(QualityGate.recommend(80)).isEqualTo(Recommendation.APPROVE);
        assertThat(QualityGate.recommend(79)).isEqualTo(Recommendation.REVISE);
        assertThat(QualityGate.recommend(60)).isEqualTo(Recommendation.REVISE);
        assertThat(QualityGate.recommend(59)).isEqualTo(Recommendation.REJECT);
        assertThat(QualityGate.recommend(0)).isEqualTo(Recommendation.REJECT);
    }

    @Test
    void passedFlagUsesConfiguredMinimum() {
        QualityGate gate = new QualityGate(List.of(), 75);

        QualityVerdict verdict = gate.verdictFor(List.of(issue(Severity.HIGH)));

        assertThat(verdict.score()).isEqualTo(80);
        assertThat(verdict.recommendation()).isEqualTo(Recommendation.APPROVE);
        assertThat(verdict.passed()).isTrue();
        assertThat(new QualityGate(List.of(), 85).verdictFor(List.of(issue(Severity.HIGH))).passed()).isFalse();
    }

    @Test
    void faithfulScriptIsApprovedByBuiltInChecks() {
        QualityGate gate = new QualityGate(List.of(new EmptyLineCheck(), new KeywordCoverageCheck(),
                new DurationDeviationCheck()), 70);
        Script script = Scripts.of(10.0,
                "Fusion reactors confine plasma with strong magnetic fields.",
                "Tokamaks shape plasma into a torus.");

        QualityVerdict verdict = gate.review(new QualityReviewInput(SOURCE, script, plan(10.0)));

        assertThat(verdict.issues()).isEmpty();
        assertThat(verdict.recommendation()).isEqualTo(Recommendation.APPROVE);
    }

    @Test
    void unrelatedScriptLosesCoverage() {
        KeywordCoverageCheck check = new KeywordCoverageCheck();
        Script script = Scripts.of(5.0, "Cats enjoy sleeping in warm sunlight.");

        List<QualityIssue> issues = check.inspect(new QualityReviewInput(SOURCE, script, null));

        assertThat(issues).singleElement().satisfies(i -> {
            assertThat(i.severity()).isEqualTo(Severity.HIGH);
            assertThat(i.category()).isEqualTo("factual_error");
        });
    }

    @Test
    void emptyScriptIsCritical() {
        QualityGate gate = new QualityGate(List.of(new EmptyLineCheck()), 70);

        QualityVerdict verdict = gate.review(SOURCE, Scripts.empty());

        assertThat(verdict.issues()).extracting(QualityIssue::severity).containsExactly(Severity.CRITICAL);
        assertThat(verdict.score()).isEqualTo(70);
    }

    @Test
    void durationFarFromTargetIsFlagged() {
        DurationDeviationCheck check = new DurationDeviationCheck();

        assertThat(check.inspect(new QualityReviewInput(SOURCE, Scripts.of(30.0, "Plasma."), plan(60.0))))
                .singleElement().extracting(QualityIssue::category).isEqualTo("duration");
        assertThat(check.inspect(new QualityReviewInput(SOURCE, Scripts.of(55.0, "Plasma."), plan(60.0)))).isEmpty();
        assertThat(check.inspect(new QualityReviewInput(SOURCE, Scripts.of(55.0, "Plasma."), null))).isEmpty();
    }

    private static VideoPlan plan(double target) {
        return new VideoPlan(target, List.of(), "neutral", "medium", "slideshow");
    }

    private static QualityIssue issue(Severity severity) {
        return new QualityIssue(severity, "clarity", "issue", null);
    }
}

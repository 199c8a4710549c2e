package com.example.narrator.service.stage;

import com.example.narrator.dto.ContentAnalysis;
import com.example.narrator.dto.PlanningInput;
import com.example.narrator.dto.VideoPlan;
import com.example.narrator.exception.ValidationException;
import com.example.narrator.model.SectionType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.narrator.testsupport.Contexts.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PlanningStageTest {

    private final PlanningStage stage = new PlanningStage();

    @Test
    void sixtySecondPlanUsesFixedRatios() {
        VideoPlan plan = stage.execute(new PlanningInput(analysis(2, "moderate"), 60), context());

        assertThat(plan.targetDuration()).isEqualTo(60.0);
        assertThat(plan.structure()).extracting(VideoPlan.PlannedSection::sectionType).containsExactly(
                SectionType.HOOK, SectionType.INTRODUCTION, SectionType.MAIN_CONTENT, SectionType.SUMMARY,
                SectionType.CONCLUSION);
        double[] expected = {6.0, 9.0, 36.0, 6.0, 3.0};
        for (int i = 0; i < expected.length; i++) {
            assertThat(plan.structure().get(i).estimatedDuration()).isCloseTo(expected[i], within(1e-9));
        }
        assertThat(plan.pacing()).isEqualTo("medium");
        assertThat(plan.tone()).isEqualTo("neutral");
    }

    @Test
    void hookIsCappedForLongVideos() {
        VideoPlan plan = stage.execute(new PlanningInput(analysis(1, "simple"), 600), context());

        assertThat(plan.structure().get(0).estimatedDuration()).isEqualTo(PlanningStage.MAX_HOOK_SECONDS);
        assertThat(plan.structure().get(2).estimatedDuration()).isCloseTo(360.0, within(1e-9));
        assertThat(plan.pacing()).isEqualTo("fast");
    }

    @Test
    void targetDefaultsToReadingTime() {
        assertThat(PlanningStage.targetDuration(null, 3)).isEqualTo(180.0);
        assertThat(PlanningStage.targetDuration(null, 0)).isEqualTo(10.0);
        assertThat(PlanningStage.targetDuration(45, 3)).isEqualTo(45.0);
    }

    @Test
    void nonPositiveTargetIsRejected() {
        assertThatThrownBy(() -> stage.execute(new PlanningInput(analysis(1, "simple"), 0), context()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> PlanningStage.targetDuration(-5, 1)).isInstanceOf(ValidationException.class);
    }

    private static ContentAnalysis analysis(int readingMinutes, String complexity) {
        return new ContentAnalysis("informational", "neutral", List.of(), List.of("plasma"), "Plasma.",
                readingMinutes, complexity);
    }
}

package com.example.narrator.service.stage;

import com.example.narrator.dto.ContentAnalysis;
import com.example.narrator.dto.PlanningInput;
import com.example.narrator.dto.VideoPlan;
import com.example.narrator.dto.VideoPlan.PlannedSection;
import com.example.narrator.exception.ValidationException;
import com.example.narrator.model.SectionType;
import com.example.narrator.service.Interfaces.StageAdapter;
import com.example.narrator.service.StageContext;
import com.example.narrator.util.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Splits the target duration into the fixed five-part narrative structure.
 */
public class PlanningStage implements StageAdapter<PlanningInput, VideoPlan> {
    private static final Logger LOGGER = LoggerFactory.getLogger(PlanningStage.class);

    static final double MAX_HOOK_SECONDS = 15.0;
    private static final double MIN_TARGET_SECONDS = 10.0;

    @Override
    public Stage stage() {
        return Stage.PLANNING;
    }

    @Override
    public VideoPlan execute(PlanningInput input, StageContext context) {
        ContentAnalysis analysis = input.analysis();
        if (analysis == null) {
            throw new ValidationException("Planning needs a content analysis");
        }
        double target = targetDuration(input.targetSeconds(), analysis.readingMinutes());

        List<PlannedSection> structure = List.of(
                new PlannedSection(SectionType.HOOK, Math.min(MAX_HOOK_SECONDS, target * 0.10),
                        List.of("Catch the viewer's attention", "Tease the core message")),
                new PlannedSection(SectionType.INTRODUCTION, target * 0.15,
                        List.of("Introduce the topic", "Give background")),
                new PlannedSection(SectionType.MAIN_CONTENT, target * 0.60,
                        List.of("Deliver the key points", "Explain the details")),
                new PlannedSection(SectionType.SUMMARY, target * 0.10,
                        List.of("Summarise the key points")),
                new PlannedSection(SectionType.CONCLUSION, target * 0.05,
                        List.of("Close", "Restate the message")));

        VideoPlan plan = new VideoPlan(target, structure, analysis.tone(), pacing(analysis.complexity()), "slideshow");
        LOGGER.info("Plan ready jobId={} targetSec={} pacing={}", context.jobId(), target, plan.pacing());
        return plan;
    }

    static double targetDuration(Integer requestedSeconds, int readingMinutes) {
        if (requestedSeconds != null) {
            if (requestedSeconds <= 0) {
                throw new ValidationException("Target length must be positive: " + requestedSeconds);
            }
            return requestedSeconds;
        }
        return Math.max(MIN_TARGET_SECONDS, readingMinutes * 60.0);
    }

    static String pacing(String complexity) {
        if ("simple".equals(complexity)) return "fast";
        if ("complex".equals(complexity)) return "slow";
        return "medium";
    }
}

package com.example.narrator.service.stage;

import com.example.narrator.dto.AlignmentInput;
import com.example.narrator.model.CueConfidence;
import com.example.narrator.model.OverlayCue;
import com.example.narrator.model.ScriptLine;
import com.example.narrator.model.Slide;
import com.example.narrator.model.SlideElement;
import com.example.narrator.service.AlignmentEngine;
import com.example.narrator.service.Interfaces.StageAdapter;
import com.example.narrator.service.StageContext;
import com.example.narrator.util.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the keywords spoken on each slide line and hands them to the {@link AlignmentEngine}.
 */
public class AlignmentStage implements StageAdapter<AlignmentInput, List<OverlayCue>> {
    private static final Logger LOGGER = LoggerFactory.getLogger(AlignmentStage.class);

    private final AlignmentEngine engine;

    public AlignmentStage(AlignmentEngine engine) {
        this.engine = engine;
    }

    @Override
    public Stage stage() {
        return Stage.ALIGNMENT;
    }

    @Override
    public List<OverlayCue> execute(AlignmentInput input, StageContext context) {
        List<SlideElement> elements = new ArrayList<>();
        for (Slide slide : input.slides()) {
            elements.addAll(slide.elements());
        }
        if (elements.isEmpty()) {
            return List.of();
        }
        List<ScriptLine> lines = input.synthesis().timedScript().lines();
        Map<String, List<String>> keywordsByLine = new LinkedHashMap<>();
        for (ScriptLine line : lines) {
            if (line.slideIndex() != null) {
                keywordsByLine.put(line.id(), AlignmentEngine.keywordsInLine(line.text(), input.keywords()));
            }
        }
        List<OverlayCue> cues = engine.resolve(input.synthesis().timeline(), lines, keywordsByLine, elements,
                input.synthesis().wordsByLine());
        long exact = cues.stream().filter(c -> c.confidence() == CueConfidence.EXACT).count();
        LOGGER.info("Alignment done jobId={} cues={} exact={} interpolated={}",
                context.jobId(), cues.size(), exact, cues.size() - exact);
        return cues;
    }
}

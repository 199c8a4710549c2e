package com.example.narrator.service.quality;

import com.example.narrator.dto.QualityReviewInput;
import com.example.narrator.engine.Interfaces.TextGenerationEngine;
import com.example.narrator.exception.NarratorException;
import com.example.narrator.model.QualityIssue;
import com.example.narrator.model.Severity;
import com.example.narrator.util.TextUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks the language model for factual and clarity problems. Skipped when no model is configured;
 * a failing or unparseable answer is logged and contributes no issues.
 */
public class LanguageModelReviewCheck implements QualityCheck {
    private static final Logger LOGGER = LoggerFactory.getLogger(LanguageModelReviewCheck.class);
    private static final int MAX_SOURCE_CHARS = 6000;

    private static final String SYSTEM_PROMPT = """
            You review narration scripts written from a source text.
            Answer with JSON only: {"issues":[{"severity":"low|medium|high|critical","category":"...","description":"...","suggestion":"..."}]}.
            Report only real problems: facts not supported by the source, confusing wording, missing key points.
            """;

    private final TextGenerationEngine textEngine;
    private final ObjectMapper om;

    public LanguageModelReviewCheck(TextGenerationEngine textEngine, ObjectMapper om) {
        this.textEngine = textEngine;
        this.om = om;
    }

    @Override
    public String name() {
        return "language-model";
    }

    @Override
    public List<QualityIssue> inspect(QualityReviewInput input) {
        if (!textEngine.isAvailable()) {
            return List.of();
        }
        String prompt = "SOURCE:\n" + TextUtil.truncate(input.sourceText(), MAX_SOURCE_CHARS)
                + "\n\nSCRIPT:\n" + input.script().fullText();
        try {
            String answer = textEngine.generate(new TextGenerationEngine.Request("quality-review", SYSTEM_PROMPT, prompt, true));
            return parse(answer);
        } catch (NarratorException | JsonProcessingException e) {
            LOGGER.warn("Model review skipped: {}", e.getMessage());
            return List.of();
        }
    }

    List<QualityIssue> parse(String answer) throws JsonProcessingException {
        JsonNode root = om.readTree(answer);
        List<QualityIssue> issues = new ArrayList<>();
        for (JsonNode node : root.path("issues")) {
            Severity severity;
            try {
                severity = Severity.fromValue(node.path("severity").asText("low"));
            } catch (IllegalArgumentException e) {
                LOGGER.debug("Unknown severity '{}' treated as low", node.path("severity").asText());
                severity = Severity.LOW;
            }
            issues.add(new QualityIssue(severity,
                    node.path("category").asText("clarity"),
                    node.path("description").asText(""),
                    node.path("suggestion").asText(null)));
        }
        return issues;
    }
}

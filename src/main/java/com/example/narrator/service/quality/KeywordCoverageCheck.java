package com.example.narrator.service.quality;

import com.example.narrator.dto.QualityReviewInput;
import com.example.narrator.model.QualityIssue;
import com.example.narrator.model.Severity;
import com.example.narrator.util.TextUtil;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Flags scripts that drift away from the source vocabulary.
 */
public class KeywordCoverageCheck implements QualityCheck {
    static final double MIN_COVERAGE = 0.5;
    private static final int MIN_WORD_LENGTH = 4;

    @Override
    public String name() {
        return "keyword-coverage";
    }

    @Override
    public List<QualityIssue> inspect(QualityReviewInput input) {
        Set<String> sourceWords = new LinkedHashSet<>();
        for (String word : TextUtil.normalizedWords(input.sourceText())) {
            if (word.length() >= MIN_WORD_LENGTH) {
                sourceWords.add(word);
            }
        }
        if (sourceWords.isEmpty()) {
            return List.of();
        }
        Set<String> scriptWords = new HashSet<>(TextUtil.normalizedWords(input.script().fullText()));
        long matched = sourceWords.stream().filter(scriptWords::contains).count();
        double coverage = (double) matched / sourceWords.size();
        if (coverage > MIN_COVERAGE) {
            return List.of();
        }
        return List.of(new QualityIssue(Severity.HIGH, "factual_error",
                String.format("Script covers only %.0f%% of the source vocabulary", coverage * 100),
                "Keep the narration closer to the source wording"));
    }
}

package com.example.narrator.service.quality;

import com.example.narrator.dto.QualityReviewInput;
import com.example.narrator.engine.Interfaces.TextGenerationEngine;
import com.example.narrator.exception.ExternalServiceException;
import com.example.narrator.model.QualityIssue;
import com.example.narrator.model.Severity;
import com.example.narrator.testsupport.Scripts;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LanguageModelReviewCheckTest {

    @Mock
    private TextGenerationEngine textEngine;

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void parsesIssuesAndMapsUnknownSeverityToLow() {
        when(textEngine.isAvailable()).thenReturn(true);
        when(textEngine.generate(any())).thenReturn("""
                {"issues":[
                  {"severity":"high","category":"factual_error","description":"Date is wrong","suggestion":"Use 1958"},
                  {"severity":"urgent","category":"clarity","description":"Long sentence"}
                ]}""");
        LanguageModelReviewCheck check = new LanguageModelReviewCheck(textEngine, om);

        List<QualityIssue> issues = check.inspect(input());

        assertThat(issues).extracting(QualityIssue::severity).containsExactly(Severity.HIGH, Severity.LOW);
        assertThat(issues.get(0).suggestion()).isEqualTo("Use 1958");
        assertThat(issues.get(1).suggestion()).isNull();
    }

    @Test
    void failingModelContributesNoIssues() {
        when(textEngine.isAvailable()).thenReturn(true);
        when(textEngine.generate(any())).thenThrow(new ExternalServiceException("llm", 503, "llm down"));

        assertThat(new LanguageModelReviewCheck(textEngine, om).inspect(input())).isEmpty();
    }

    @Test
    void malformedAnswerContributesNoIssues() {
        when(textEngine.isAvailable()).thenReturn(true);
        when(textEngine.generate(any())).thenReturn("not json {");

        assertThat(new LanguageModelReviewCheck(textEngine, om).inspect(input())).isEmpty();
    }

    @Test
    void skippedWithoutModel() {
        when(textEngine.isAvailable()).thenReturn(false);

        assertThat(new LanguageModelReviewCheck(textEngine, om).inspect(input())).isEmpty();
        verify(textEngine, never()).generate(any());
    }

    private static QualityReviewInput input() {
        return new QualityReviewInput("Plasma is hot.", Scripts.of(2.0, "Plasma is hot."), null);
    }
}

package com.example.narrator.service.stage;

import com.example.narrator.dto.IntakeResult;
import com.example.narrator.dto.PipelineRequest;
import com.example.narrator.dto.ResolvedContent;
import com.example.narrator.dto.SourceMetadata;
import com.example.narrator.engine.Interfaces.ContentResolver;
import com.example.narrator.exception.ValidationException;
import com.example.narrator.util.SourceType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.example.narrator.testsupport.Contexts.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContentIntakeStageTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private ContentResolver urlResolver;

    @Test
    void plainTextIsCleanedWithoutResolver() {
        ContentIntakeStage stage = new ContentIntakeStage(List.of(urlResolver), CLOCK);

        IntakeResult result = stage.execute(PipelineRequest.text("  Plasma   is &amp; hot.  \n\n\n\n Stars  glow. "), context());

        assertThat(result.cleanedText()).isEqualTo("Plasma is & hot.\n\nStars glow.");
        assertThat(result.sourceType()).isEqualTo(SourceType.TEXT);
        assertThat(result.metadata().extractedAt()).isEqualTo(CLOCK.instant());
        assertThat(result.hasSlides()).isFalse();
        verify(urlResolver, never()).resolve(any());
    }

    @Test
    void urlGoesThroughMatchingResolver() {
        when(urlResolver.supports(SourceType.URL)).thenReturn(true);
        when(urlResolver.resolve("https://example.org/a")).thenReturn(new ResolvedContent("Title text&nbsp;here.",
                new SourceMetadata("A title", "Ann", "2024-01-01", CLOCK.instant()), List.of()));
        ContentIntakeStage stage = new ContentIntakeStage(List.of(urlResolver), CLOCK);

        IntakeResult result = stage.execute(new PipelineRequest(" https://example.org/a ", SourceType.URL, null, null, null), context());

        assertThat(result.cleanedText()).isEqualTo("Title text here.");
        assertThat(result.originalSource()).isEqualTo("https://example.org/a");
        assertThat(result.metadata().title()).isEqualTo("A title");
    }

    @Test
    void blankSourceIsRejected() {
        ContentIntakeStage stage = new ContentIntakeStage(List.of(), CLOCK);

        assertThatThrownBy(() -> stage.execute(PipelineRequest.text("   "), context()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void unsupportedTypeIsRejected() {
        when(urlResolver.supports(SourceType.DOCUMENT)).thenReturn(false);
        ContentIntakeStage stage = new ContentIntakeStage(List.of(urlResolver), CLOCK);

        assertThatThrownBy(() -> stage.execute(new PipelineRequest("deck.pdf", SourceType.DOCUMENT, null, null, null), context()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("DOCUMENT");
    }

    @Test
    void resolverReturningOnlyWhitespaceIsRejected() {
        when(urlResolver.supports(SourceType.URL)).thenReturn(true);
        when(urlResolver.resolve(any())).thenReturn(new ResolvedContent(" \n \t ", null, List.of()));
        ContentIntakeStage stage = new ContentIntakeStage(List.of(urlResolver), CLOCK);

        assertThatThrownBy(() -> stage.execute(new PipelineRequest("https://example.org", SourceType.URL, null, null, null), context()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("No readable text");
    }

    @Test
    void cleanTextKeepsParagraphBreaks() {
        assertThat(ContentIntakeStage.cleanText("a  b \n  c\n\n\n\nd")).isEqualTo("a b\nc\n\nd");
        assertThat(ContentIntakeStage.cleanText(null)).isEmpty();
        assertThat(ContentIntakeStage.cleanText("&lt;b&gt; &quot;x&quot; it&#39;s")).isEqualTo("<b> \"x\" it's");
    }
}

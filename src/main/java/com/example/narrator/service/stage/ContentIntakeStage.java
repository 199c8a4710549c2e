package com.example.narrator.service.stage;

import com.example.narrator.dto.IntakeResult;
import com.example.narrator.dto.PipelineRequest;
import com.example.narrator.dto.ResolvedContent;
import com.example.narrator.dto.SourceMetadata;
import com.example.narrator.engine.Interfaces.ContentResolver;
import com.example.narrator.exception.ValidationException;
import com.example.narrator.service.Interfaces.StageAdapter;
import com.example.narrator.service.StageContext;
import com.example.narrator.util.SourceType;
import com.example.narrator.util.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns a raw source reference into cleaned plain text. Plain text is cleaned directly; URLs and
 * documents go through the matching {@link ContentResolver}.
 */
public class ContentIntakeStage implements StageAdapter<PipelineRequest, IntakeResult> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ContentIntakeStage.class);

    private static final Pattern INLINE_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f\\u00A0]+");
    private static final Pattern SPACE_AROUND_NEWLINE = Pattern.compile(" *\\r?\\n *");
    private static final Pattern EXTRA_BLANK_LINES = Pattern.compile("\\n{3,}");

    private final List<ContentResolver> resolvers;
    private final Clock clock;

    public ContentIntakeStage(List<ContentResolver> resolvers, Clock clock) {
        this.resolvers = List.copyOf(resolvers);
        this.clock = clock;
    }

    @Override
    public Stage stage() {
        return Stage.INTAKE;
    }

    @Override
    public IntakeResult execute(PipelineRequest request, StageContext context) {
        if (request == null || request.source() == null || request.source().isBlank()) {
            throw new ValidationException("Source is empty");
        }
        SourceType type = request.sourceType() == null ? SourceType.URL : request.sourceType();
        String source = request.source().trim();

        ResolvedContent resolved;
        if (type == SourceType.TEXT) {
            resolved = new ResolvedContent(source, new SourceMetadata(null, null, null, Instant.now(clock)), List.of());
        } else {
            context.checkCancelled();
            resolved = resolverFor(type).resolve(source);
        }

        String cleaned = cleanText(resolved.text());
        if (cleaned.isEmpty()) {
            throw new ValidationException("No readable text found in " + type.name().toLowerCase(Locale.ROOT) + " source");
        }
        LOGGER.info("Intake done jobId={} sourceType={} chars={} slides={}",
                context.jobId(), type, cleaned.length(), resolved.slides().size());
        return new IntakeResult(cleaned, source, type, resolved.metadata(), resolved.slides());
    }

    /**
     * Decodes the common HTML entities, collapses runs of spaces and keeps at most one blank line
     * between paragraphs.
     */
    public static String cleanText(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = text
                .replace("&nbsp;", " ")
                .replace("&amp;", "&")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'");
        cleaned = INLINE_WHITESPACE.matcher(cleaned).replaceAll(" ");
        cleaned = SPACE_AROUND_NEWLINE.matcher(cleaned).replaceAll("\n");
        cleaned = EXTRA_BLANK_LINES.matcher(cleaned).replaceAll("\n\n");
        return cleaned.trim();
    }

    private ContentResolver resolverFor(SourceType type) {
        for (ContentResolver resolver : resolvers) {
            if (resolver.supports(type)) {
                return resolver;
            }
        }
        throw new ValidationException("Unsupported source type: " + type);
    }
}

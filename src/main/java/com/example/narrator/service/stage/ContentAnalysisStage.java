package com.example.narrator.service.stage;

import com.example.narrator.dto.ContentAnalysis;
import com.example.narrator.dto.IntakeResult;
import com.example.narrator.engine.Interfaces.TextGenerationEngine;
import com.example.narrator.exception.NarratorException;
import com.example.narrator.exception.ValidationException;
import com.example.narrator.service.Interfaces.StageAdapter;
import com.example.narrator.service.StageContext;
import com.example.narrator.util.Stage;
import com.example.narrator.util.TextUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives content type, tone, structure, keywords and pacing hints from the cleaned text.
 * The rule-based path always runs; when a language model is available its answer replaces the
 * type, tone and core message.
 */
public class ContentAnalysisStage implements StageAdapter<IntakeResult, ContentAnalysis> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ContentAnalysisStage.class);

    static final Set<String> CONTENT_TYPES = Set.of("informational", "tutorial", "opinion", "news", "review", "story");
    static final Set<String> TONES = Set.of("neutral", "formal", "casual", "enthusiastic", "serious");
    static final int MAX_KEYWORDS = 10;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "are", "but", "not", "you", "all", "any", "can", "had", "her", "was", "one",
            "our", "out", "has", "have", "his", "how", "its", "may", "new", "now", "own", "she", "who", "why",
            "with", "this", "that", "from", "they", "them", "then", "than", "there", "their", "these", "those",
            "what", "when", "where", "which", "while", "will", "would", "could", "should", "into", "also",
            "been", "being", "were", "more", "most", "some", "such", "only", "very", "just", "over", "about",
            "each", "other", "your");
    private static final Pattern PARAGRAPH_SPLIT = Pattern.compile("\\n\\s*\\n");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern HANGUL = Pattern.compile("[가-힣]");
    private static final Pattern LATIN_WORD = Pattern.compile("[a-zA-Z]+");
    private static final int MAX_PROMPT_CHARS = 6000;

    private static final String SYSTEM_PROMPT = """
            You classify source texts that will be turned into narrated videos.
            Answer with JSON only: {"contentType":"informational|tutorial|opinion|news|review|story",
            "tone":"neutral|formal|casual|enthusiastic|serious","coreMessage":"one sentence"}.
            """;

    private final TextGenerationEngine textEngine;
    private final ObjectMapper om;
    private final int minTextLength;

    public ContentAnalysisStage(TextGenerationEngine textEngine, ObjectMapper om, int minTextLength) {
        this.textEngine = textEngine;
        this.om = om;
        this.minTextLength = minTextLength;
    }

    @Override
    public Stage stage() {
        return Stage.ANALYSIS;
    }

    @Override
    public ContentAnalysis execute(IntakeResult intake, StageContext context) {
        String text = intake.cleanedText();
        if (text == null || text.isBlank()) {
            throw new ValidationException("Nothing to analyse: text is empty");
        }
        if (text.length() < minTextLength) {
            throw new ValidationException("Text is too short: " + text.length() + " chars, at least "
                    + minTextLength + " required");
        }

        String contentType = "informational";
        String tone = "neutral";
        String coreMessage = coreMessage(text);

        if (textEngine.isAvailable()) {
            context.checkCancelled();
            ModelAnswer answer = askModel(text);
            if (answer != null) {
                contentType = answer.contentType() != null ? answer.contentType() : contentType;
                tone = answer.tone() != null ? answer.tone() : tone;
                coreMessage = answer.coreMessage() != null ? answer.coreMessage() : coreMessage;
            }
        }

        ContentAnalysis analysis = new ContentAnalysis(contentType, tone, paragraphs(text), keywords(text),
                coreMessage, readingMinutes(text), complexity(text));
        LOGGER.info("Analysis done jobId={} type={} tone={} keywords={} readingMin={} complexity={}",
                context.jobId(), contentType, tone, analysis.keywords().size(),
                analysis.readingMinutes(), analysis.complexity());
        return analysis;
    }

    static List<ContentAnalysis.Paragraph> paragraphs(String text) {
        List<ContentAnalysis.Paragraph> paragraphs = new ArrayList<>();
        int searchFrom = 0;
        for (String part : PARAGRAPH_SPLIT.split(text)) {
            String content = part.trim();
            if (content.isEmpty()) continue;
            int start = text.indexOf(content, searchFrom);
            paragraphs.add(new ContentAnalysis.Paragraph(content, start, start + content.length()));
            searchFrom = start + content.length();
        }
        return paragraphs;
    }

    /** Most frequent words, ties broken by first occurrence. */
    static List<String> keywords(String text) {
        Map<String, Integer> frequency = new LinkedHashMap<>();
        String normalized = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        for (String word : TextUtil.words(normalized)) {
            if (word.length() > 2 && !STOP_WORDS.contains(word)) {
                frequency.merge(word, 1, Integer::sum);
            }
        }
        return frequency.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(MAX_KEYWORDS)
                .map(Map.Entry::getKey)
                .toList();
    }

    static String coreMessage(String text) {
        List<String> sentences = TextUtil.sentences(text);
        return sentences.isEmpty() ? text.trim() : sentences.get(0);
    }

    static int readingMinutes(String text) {
        double minutes = count(HANGUL, text) / 300.0 + count(LATIN_WORD, text) / 200.0;
        return (int) Math.ceil(minutes);
    }

    static String complexity(String text) {
        int sentences = Math.max(1, TextUtil.sentences(text).size());
        double average = (double) text.length() / sentences;
        if (average < 50) return "simple";
        if (average < 100) return "moderate";
        return "complex";
    }

    private ModelAnswer askModel(String text) {
        try {
            String raw = textEngine.generate(new TextGenerationEngine.Request(
                    "content-analysis", SYSTEM_PROMPT, TextUtil.truncate(text, MAX_PROMPT_CHARS), true));
            JsonNode node = om.readTree(raw);
            return new ModelAnswer(
                    allowed(node.path("contentType").asText(null), CONTENT_TYPES),
                    allowed(node.path("tone").asText(null), TONES),
                    blankToNull(node.path("coreMessage").asText(null)));
        } catch (NarratorException | JsonProcessingException e) {
            LOGGER.warn("Model analysis unavailable, using heuristics: {}", e.getMessage());
            return null;
        }
    }

    private static String allowed(String value, Set<String> values) {
        if (value == null) return null;
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return values.contains(normalized) ? normalized : null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int n = 0;
        while (matcher.find()) n++;
        return n;
    }

    private record ModelAnswer(String contentType, String tone, String coreMessage) {}
}

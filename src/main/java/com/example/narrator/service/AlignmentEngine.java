package com.example.narrator.service;

import com.example.narrator.model.BoundingBox;
import com.example.narrator.model.CueConfidence;
import com.example.narrator.model.OverlayCue;
import com.example.narrator.model.ScriptLine;
import com.example.narrator.model.SlideElement;
import com.example.narrator.model.Timeline;
import com.example.narrator.model.TimelineSegment;
import com.example.narrator.model.WordTimestamp;
import com.example.narrator.util.TextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns spoken keywords into highlight cues on the slide element that shows them.
 * <p>
 * Pure and deterministic: the same timeline, lines, elements and word timings always produce the same cues.
 * A keyword with no matching element produces no cue. Word lookups move forward only, per slide, so a keyword
 * said twice resolves to its next unconsumed occurrence.
 */
public class AlignmentEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(AlignmentEngine.class);

    static final Comparator<SlideElement> ELEMENT_ORDER = Comparator
            .comparingLong((SlideElement e) -> e.box().area())
            .thenComparingInt(e -> e.box().y())
            .thenComparingInt(e -> e.box().x());

    private final int frameWidth;
    private final int frameHeight;

    public AlignmentEngine(int frameWidth, int frameHeight) {
        if (frameWidth <= 0 || frameHeight <= 0) {
            throw new IllegalArgumentException("Frame size must be positive: " + frameWidth + "x" + frameHeight);
        }
        this.frameWidth = frameWidth;
        this.frameHeight = frameHeight;
    }

    /**
     * @param timeline        gapless line timeline
     * @param lines           timed lines in speaking order; lines without a slide index are skipped
     * @param keywordsByLine  candidate keywords per line id, in spoken order
     * @param elements        slide elements of the whole document
     * @param wordsByLine     word timestamps per line id, relative to the line start; may be empty
     */
    public List<OverlayCue> resolve(Timeline timeline,
                                    List<ScriptLine> lines,
                                    Map<String, List<String>> keywordsByLine,
                                    List<SlideElement> elements,
                                    Map<String, List<WordTimestamp>> wordsByLine) {
        Map<String, TimelineSegment> segments = timeline.byLineId();
        Map<Integer, List<SlideElement>> elementsBySlide = groupElements(elements);
        Map<Integer, SlideWords> wordsBySlide = indexWords(lines, wordsByLine);
        Map<Integer, Integer> cursorBySlide = new HashMap<>();
        Map<String, Pattern> patternCache = new HashMap<>();

        List<OverlayCue> cues = new ArrayList<>();
        for (ScriptLine line : lines) {
            Integer slideIndex = line.slideIndex();
            TimelineSegment segment = segments.get(line.id());
            if (slideIndex == null || segment == null) {
                continue;
            }
            List<SlideElement> candidates = elementsBySlide.getOrDefault(slideIndex, List.of());
            List<String> keywords = keywordsByLine.getOrDefault(line.id(), List.of());
            if (candidates.isEmpty() || keywords.isEmpty()) {
                continue;
            }
            SlideWords slideWords = wordsBySlide.get(slideIndex);
            List<String> lineTokens = TextUtil.normalizedWords(line.text());
            Map<String, Integer> occurrences = new HashMap<>();

            for (String keyword : keywords) {
                if (keyword == null || keyword.isBlank()) {
                    continue;
                }
                Pattern pattern = patternCache.computeIfAbsent(keyword.toLowerCase(Locale.ROOT), TextUtil::wordBoundaryPattern);
                SlideElement element = bestElement(candidates, pattern);
                int occurrence = occurrences.merge(keyword.toLowerCase(Locale.ROOT), 1, Integer::sum) - 1;
                if (element == null) {
                    LOGGER.debug("No element for keyword lineId={} slide={} keyword={}", line.id(), slideIndex, keyword);
                    continue;
                }
                cues.add(cueFor(line, segment, keyword, occurrence, lineTokens, element, slideWords,
                        cursorBySlide, slideIndex));
            }
        }
        LOGGER.debug("Alignment resolved lines={} cues={}", lines.size(), cues.size());
        return cues;
    }

    /**
     * Keywords from {@code candidates} as they occur in the line text, one entry per occurrence, in spoken order.
     */
    public static List<String> keywordsInLine(String lineText, List<String> candidates) {
        if (lineText == null || lineText.isBlank() || candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        TreeMap<Integer, String> byPosition = new TreeMap<>();
        for (String candidate : candidates) {
            if (candidate == null || candidate.isBlank()) continue;
            Matcher matcher = TextUtil.wordBoundaryPattern(candidate).matcher(lineText);
            while (matcher.find()) {
                byPosition.putIfAbsent(matcher.start(), candidate);
            }
        }
        return new ArrayList<>(byPosition.values());
    }

    private OverlayCue cueFor(ScriptLine line,
                              TimelineSegment segment,
                              String keyword,
                              int occurrence,
                              List<String> lineTokens,
                              SlideElement element,
                              SlideWords slideWords,
                              Map<Integer, Integer> cursorBySlide,
                              int slideIndex) {
        List<String> keywordTokens = TextUtil.normalizedWords(keyword);
        double start;
        double end;
        CueConfidence confidence;

        int[] range = slideWords == null ? null : slideWords.rangeOf(line.id());
        int match = -1;
        if (range != null && !keywordTokens.isEmpty()) {
            int from = Math.max(cursorBySlide.getOrDefault(slideIndex, 0), range[0]);
            match = slideWords.find(keywordTokens, from, range[1]);
        }

        if (match >= 0) {
            WordTimestamp first = slideWords.words.get(match).word;
            WordTimestamp last = slideWords.words.get(match + keywordTokens.size() - 1).word;
            start = segment.start() + first.start();
            end = segment.start() + last.end();
            confidence = CueConfidence.EXACT;
            cursorBySlide.put(slideIndex, match + keywordTokens.size());
        } else {
            int total = Math.max(1, lineTokens.size());
            int wordIndex = occurrenceIndex(lineTokens, keywordTokens, occurrence);
            double lineDuration = segment.duration();
            double relativeStart = ((double) wordIndex / total) * lineDuration;
            start = segment.start() + relativeStart;
            end = start + lineDuration / total;
            confidence = CueConfidence.INTERPOLATED;
        }

        BoundingBox box = element.box().clampTo(frameWidth, frameHeight);
        return new OverlayCue(line.id(), keyword, box, start, end, confidence);
    }

    private static SlideElement bestElement(List<SlideElement> candidates, Pattern pattern) {
        for (SlideElement element : candidates) {
            if (element.text() != null && pattern.matcher(element.text()).find()) {
                return element;
            }
        }
        return null;
    }

    /** Index of the n-th occurrence of the keyword in the line tokens, or 0 when it is not there. */
    private static int occurrenceIndex(List<String> lineTokens, List<String> keywordTokens, int occurrence) {
        if (keywordTokens.isEmpty()) {
            return 0;
        }
        int seen = 0;
        for (int i = 0; i + keywordTokens.size() <= lineTokens.size(); i++) {
            if (lineTokens.subList(i, i + keywordTokens.size()).equals(keywordTokens)) {
                if (seen == occurrence) {
                    return i;
                }
                seen++;
            }
        }
        return 0;
    }

    private static Map<Integer, List<SlideElement>> groupElements(List<SlideElement> elements) {
        Map<Integer, List<SlideElement>> grouped = new HashMap<>();
        for (SlideElement element : elements) {
            if (element.box() == null) continue;
            grouped.computeIfAbsent(element.slideIndex(), k -> new ArrayList<>()).add(element);
        }
        // List.sort is stable, so equal boxes keep document order
        grouped.values().forEach(list -> list.sort(ELEMENT_ORDER));
        return grouped;
    }

    private static Map<Integer, SlideWords> indexWords(List<ScriptLine> lines, Map<String, List<WordTimestamp>> wordsByLine) {
        Map<Integer, SlideWords> bySlide = new LinkedHashMap<>();
        for (ScriptLine line : lines) {
            if (line.slideIndex() == null) continue;
            List<WordTimestamp> words = wordsByLine.getOrDefault(line.id(), List.of());
            bySlide.computeIfAbsent(line.slideIndex(), k -> new SlideWords()).add(line.id(), words);
        }
        return bySlide;
    }

    private record IndexedWord(WordTimestamp word, String normalized) {}

    /** All transcribed words of one slide, in spoken order, with the index range each line occupies. */
    private static final class SlideWords {
        private final List<IndexedWord> words = new ArrayList<>();
        private final Map<String, int[]> ranges = new HashMap<>();

        void add(String lineId, List<WordTimestamp> lineWords) {
            int from = words.size();
            for (WordTimestamp word : lineWords) {
                words.add(new IndexedWord(word, TextUtil.normalizeToken(word.word())));
            }
            ranges.put(lineId, new int[]{from, words.size()});
        }

        int[] rangeOf(String lineId) {
            return ranges.get(lineId);
        }

        int find(List<String> tokens, int from, int to) {
            for (int i = from; i + tokens.size() <= to; i++) {
                boolean hit = true;
                for (int k = 0; k < tokens.size(); k++) {
                    if (!words.get(i + k).normalized.equals(tokens.get(k))) {
                        hit = false;
                        break;
                    }
                }
                if (hit) {
                    return i;
                }
            }
            return -1;
        }
    }
}

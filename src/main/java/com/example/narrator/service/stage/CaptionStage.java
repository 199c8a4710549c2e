package com.example.narrator.service.stage;

import com.example.narrator.dto.CaptionResult;
import com.example.narrator.dto.SynthesisResult;
import com.example.narrator.exception.StorageException;
import com.example.narrator.exception.ValidationException;
import com.example.narrator.model.ScriptLine;
import com.example.narrator.service.Interfaces.StageAdapter;
import com.example.narrator.service.StageContext;
import com.example.narrator.util.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes caption entries for the timed script lines, as SRT or WebVTT. A line too long for two caption rows is
 * split into several consecutive entries sharing the line's time window in proportion to their length.
 */
public class CaptionStage implements StageAdapter<SynthesisResult, CaptionResult> {
    private static final Logger LOGGER = LoggerFactory.getLogger(CaptionStage.class);
    static final int MAX_LINE_CHARS = 38;

    private final String format;

    public CaptionStage(String format) {
        String normalized = format == null ? "srt" : format.trim().toLowerCase(Locale.ROOT);
        if (!normalized.equals("srt") && !normalized.equals("vtt")) {
            throw new ValidationException("Unsupported subtitle format: " + format);
        }
        this.format = normalized;
    }

    @Override
    public Stage stage() {
        return Stage.CAPTIONS;
    }

    @Override
    public CaptionResult execute(SynthesisResult synthesis, StageContext context) {
        boolean vtt = format.equals("vtt");
        List<CaptionResult.Entry> entries = new ArrayList<>();
        int index = 1;
        for (ScriptLine line : synthesis.timedScript().lines()) {
            if (!line.isTimed()) {
                throw new ValidationException("Line " + line.id() + " has no timing");
            }
            long startMs = Math.round(line.startTime() * 1000);
            long endMs = Math.round(line.endTime() * 1000);
            List<String> cues = splitIntoCues(line.text());
            int totalChars = cues.stream().mapToInt(String::length).sum();
            int charsSoFar = 0;
            long cueStart = startMs;
            for (int i = 0; i < cues.size(); i++) {
                String cue = cues.get(i);
                charsSoFar += cue.length();
                long cueEnd = i == cues.size() - 1
                        ? endMs
                        : startMs + Math.round((endMs - startMs) * (double) charsSoFar / totalChars);
                entries.add(new CaptionResult.Entry(index++,
                        vtt ? formatVttTime(cueStart) : formatSrtTime(cueStart),
                        vtt ? formatVttTime(cueEnd) : formatSrtTime(cueEnd),
                        formatCueText(cue)));
                cueStart = cueEnd;
            }
        }

        String body = vtt ? buildVtt(entries) : buildSrt(entries);
        Path file = context.tempDir().resolve("subtitles." + format);
        try {
            Files.writeString(file, body, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Failed to write captions " + file, e);
        }
        LOGGER.info("Captions written jobId={} format={} entries={}", context.jobId(), format, entries.size());
        return new CaptionResult(file, format, entries);
    }

    static String buildSrt(List<CaptionResult.Entry> entries) {
        StringBuilder srt = new StringBuilder();
        for (CaptionResult.Entry entry : entries) {
            srt.append(entry.index()).append('\n');
            srt.append(entry.start()).append(" --> ").append(entry.end()).append('\n');
            srt.append(entry.text()).append("\n\n");
        }
        return srt.toString();
    }

    static String buildVtt(List<CaptionResult.Entry> entries) {
        StringBuilder vtt = new StringBuilder("WEBVTT\n\n");
        for (CaptionResult.Entry entry : entries) {
            vtt.append(entry.start()).append(" --> ").append(entry.end()).append('\n');
            vtt.append(entry.text()).append("\n\n");
        }
        return vtt.toString();
    }

    /**
     * Groups the words of a line into chunks that each fit on two caption rows. A single word longer than a row
     * gets a chunk of its own.
     */
    static List<String> splitIntoCues(String text) {
        String normalized = text == null ? "" : text.replaceAll("\\s+", " ").trim();
        if (normalized.length() <= 2 * MAX_LINE_CHARS) {
            return List.of(normalized);
        }
        List<String> cues = new ArrayList<>();
        String current = "";
        for (String word : normalized.split(" ")) {
            String candidate = current.isEmpty() ? word : current + " " + word;
            if (current.isEmpty() || fitsTwoRows(candidate)) {
                current = candidate;
            } else {
                cues.add(current);
                current = word;
            }
        }
        cues.add(current);
        return cues;
    }

    private static boolean fitsTwoRows(String text) {
        for (String row : formatCueText(text).split("\n")) {
            if (row.length() > MAX_LINE_CHARS) {
                return false;
            }
        }
        return true;
    }

    /** Splits long text into two lines, picking the break with the least overflow, then the best balance. */
    static String formatCueText(String text) {
        if (text == null) {
            return "";
        }
        String normalized = text.replaceAll("\\s+", " ").trim();
        if (normalized.length() <= MAX_LINE_CHARS) {
            return normalized;
        }
        String[] words = normalized.split(" ");
        if (words.length <= 1) {
            return normalized;
        }

        int bestSplit = 1;
        int bestPenalty = Integer.MAX_VALUE;
        int bestMax = Integer.MAX_VALUE;
        int bestBalance = Integer.MAX_VALUE;
        for (int split = 1; split < words.length; split++) {
            int len1 = String.join(" ", List.of(words).subList(0, split)).length();
            int len2 = String.join(" ", List.of(words).subList(split, words.length)).length();
            int penalty = Math.max(0, len1 - MAX_LINE_CHARS) + Math.max(0, len2 - MAX_LINE_CHARS);
            int maxLen = Math.max(len1, len2);
            int balance = Math.abs(len1 - len2);
            if (penalty < bestPenalty
                    || (penalty == bestPenalty && maxLen < bestMax)
                    || (penalty == bestPenalty && maxLen == bestMax && balance < bestBalance)) {
                bestPenalty = penalty;
                bestMax = maxLen;
                bestBalance = balance;
                bestSplit = split;
            }
        }
        return String.join(" ", List.of(words).subList(0, bestSplit)) + "\n"
                + String.join(" ", List.of(words).subList(bestSplit, words.length));
    }

    static String formatSrtTime(long ms) {
        return formatTime(ms, ',');
    }

    static String formatVttTime(long ms) {
        return formatTime(ms, '.');
    }

    private static String formatTime(long ms, char separator) {
        long safeMs = Math.max(0, ms);
        long hours = safeMs / 3_600_000;
        long minutes = (safeMs % 3_600_000) / 60_000;
        long seconds = (safeMs % 60_000) / 1000;
        long millis = safeMs % 1000;
        return String.format("%02d:%02d:%02d%c%03d", hours, minutes, seconds, separator, millis);
    }
}

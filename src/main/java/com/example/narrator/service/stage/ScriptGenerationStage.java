package com.example.narrator.service.stage;

import com.example.narrator.dto.IntakeResult;
import com.example.narrator.dto.ScriptContinuity;
import com.example.narrator.dto.ScriptInput;
import com.example.narrator.dto.VideoPlan;
import com.example.narrator.dto.VideoPlan.PlannedSection;
import com.example.narrator.engine.Interfaces.TextGenerationEngine;
import com.example.narrator.exception.ValidationException;
import com.example.narrator.model.Script;
import com.example.narrator.model.ScriptLine;
import com.example.narrator.model.ScriptSection;
import com.example.narrator.model.Slide;
import com.example.narrator.service.Interfaces.StageAdapter;
import com.example.narrator.service.StageContext;
import com.example.narrator.util.Stage;
import com.example.narrator.util.TextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Writes the narration. Source sentences are spread over the planned sections in proportion to each
 * section's duration and cut to the section's word budget, so the estimated length tracks the target.
 * With a language model available each passage is rewritten for speech, threading the narration
 * written so far into the next call.
 */
public class ScriptGenerationStage implements StageAdapter<ScriptInput, Script> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScriptGenerationStage.class);

    static final int MIN_FRAGMENT_WORDS = 3;
    private static final Pattern SLIDE_LINE_SPLIT = Pattern.compile("\\r?\\n|(?<=[.!?])\\s+");

    private static final String SYSTEM_PROMPT = """
            You write spoken narration for an explainer video.
            Rewrite the given source sentences as natural narration of about the requested number of words.
            Keep every fact from the source and add none. Continue smoothly from the narration so far.
            Answer with the narration text only.
            """;

    private final TextGenerationEngine textEngine;
    private final int wordsPerMinute;

    public ScriptGenerationStage(TextGenerationEngine textEngine, int wordsPerMinute) {
        this.textEngine = textEngine;
        this.wordsPerMinute = wordsPerMinute;
    }

    @Override
    public Stage stage() {
        return Stage.SCRIPT;
    }

    @Override
    public Script execute(ScriptInput input, StageContext context) {
        List<SourceSentence> sentences = sourceSentences(input.intake());
        if (sentences.isEmpty()) {
            throw new ValidationException("No sentences to narrate");
        }
        VideoPlan plan = input.plan();
        List<List<SourceSentence>> allocation = allocate(sentences, plan.structure());
        boolean rewrite = textEngine.isAvailable();

        ScriptContinuity continuity = ScriptContinuity.empty();
        List<ScriptSection> sections = new ArrayList<>();
        int sectionNo = 0;
        for (int i = 0; i < plan.structure().size(); i++) {
            PlannedSection planned = plan.structure().get(i);
            List<SourceSentence> assigned = allocation.get(i);
            if (assigned.isEmpty()) {
                continue;
            }
            context.checkCancelled();
            int budget = wordBudget(planned.estimatedDuration());
            List<SourceSentence> narration = rewrite
                    ? rewritePassages(assigned, planned, plan, budget, continuity, context)
                    : assigned;
            List<SourceSentence> trimmed = trimToBudget(narration, budget);
            if (trimmed.isEmpty()) {
                continue;
            }
            sectionNo++;
            String sectionId = "s" + sectionNo;
            List<ScriptLine> lines = new ArrayList<>();
            for (int l = 0; l < trimmed.size(); l++) {
                SourceSentence sentence = trimmed.get(l);
                lines.add(new ScriptLine(sectionId + "-l" + (l + 1), sectionId, sentence.text(), l,
                        null, null, sentence.visualCue(), sentence.slideIndex()));
                continuity = continuity.append(sentence.text());
            }
            sections.add(new ScriptSection(sectionId, planned.sectionType(), planned.sectionType().title(), lines, sectionNo - 1));
        }

        Script script = assemble(sections);
        LOGGER.info("Script ready jobId={} sections={} lines={} words={} estSec={} rewritten={}",
                context.jobId(), sections.size(), script.lines().size(), script.wordCount(),
                String.format("%.1f", script.totalEstimatedDuration()), rewrite);
        return script;
    }

    /** Words that fit in the given number of seconds at the configured speaking rate. */
    int wordBudget(double seconds) {
        return Math.max(1, (int) Math.round(seconds * wordsPerMinute / 60.0));
    }

    double estimateSeconds(int words) {
        return words * 60.0 / wordsPerMinute;
    }

    /**
     * Slide documents yield one sentence per bullet or sentence, each tagged with its slide; plain text is
     * split on sentence punctuation.
     */
    static List<SourceSentence> sourceSentences(IntakeResult intake) {
        List<SourceSentence> out = new ArrayList<>();
        if (intake.hasSlides()) {
            for (Slide slide : intake.slides()) {
                if (slide.text() == null) continue;
                for (String part : SLIDE_LINE_SPLIT.split(slide.text())) {
                    String sentence = stripTerminal(part);
                    if (!sentence.isEmpty()) {
                        out.add(new SourceSentence(sentence + ".", slide.index(), slide.title()));
                    }
                }
            }
            return out;
        }
        for (String sentence : TextUtil.sentences(intake.cleanedText())) {
            out.add(new SourceSentence(sentence + ".", null, null));
        }
        return out;
    }

    /** Contiguous, order-preserving split of sentences across sections by cumulative duration share. */
    static List<List<SourceSentence>> allocate(List<SourceSentence> sentences, List<PlannedSection> structure) {
        double total = structure.stream().mapToDouble(PlannedSection::estimatedDuration).sum();
        List<List<SourceSentence>> allocation = new ArrayList<>();
        int n = sentences.size();
        double cumulative = 0;
        int from = 0;
        for (int i = 0; i < structure.size(); i++) {
            cumulative += structure.get(i).estimatedDuration();
            int to = i == structure.size() - 1 || total <= 0
                    ? n
                    : (int) Math.min(n, Math.round(cumulative / total * n));
            to = Math.max(from, to);
            allocation.add(new ArrayList<>(sentences.subList(from, to)));
            from = to;
        }
        return allocation;
    }

    /** Keeps whole sentences while they fit, then a fragment of the next one if enough budget is left. */
    static List<SourceSentence> trimToBudget(List<SourceSentence> sentences, int budget) {
        List<SourceSentence> kept = new ArrayList<>();
        int used = 0;
        for (SourceSentence sentence : sentences) {
            List<String> words = TextUtil.words(sentence.text());
            if (words.isEmpty()) continue;
            if (used + words.size() <= budget) {
                kept.add(sentence);
                used += words.size();
                continue;
            }
            int remaining = budget - used;
            if (remaining >= MIN_FRAGMENT_WORDS || kept.isEmpty()) {
                String fragment = stripTerminal(String.join(" ", words.subList(0, Math.max(1, remaining))));
                kept.add(sentence.withText(fragment + "."));
            }
            break;
        }
        return kept;
    }

    private List<SourceSentence> rewritePassages(List<SourceSentence> assigned,
                                                 PlannedSection planned,
                                                 VideoPlan plan,
                                                 int budget,
                                                 ScriptContinuity continuity,
                                                 StageContext context) {
        int totalWords = assigned.stream().mapToInt(s -> TextUtil.wordCount(s.text())).sum();
        List<SourceSentence> out = new ArrayList<>();
        ScriptContinuity running = continuity;
        for (List<SourceSentence> group : groupBySlide(assigned)) {
            context.checkCancelled();
            int groupWords = group.stream().mapToInt(s -> TextUtil.wordCount(s.text())).sum();
            int groupBudget = Math.max(MIN_FRAGMENT_WORDS, (int) Math.round((double) budget * groupWords / Math.max(1, totalWords)));
            String prompt = prompt(group, planned, plan, groupBudget, running);
            String answer = textEngine.generate(new TextGenerationEngine.Request("script-" + planned.sectionType().jsonValue(),
                    SYSTEM_PROMPT, prompt, false));
            SourceSentence head = group.get(0);
            List<String> rewritten = TextUtil.sentences(answer);
            if (rewritten.isEmpty()) {
                LOGGER.warn("Empty rewrite for section={} - keeping source sentences", planned.sectionType());
                out.addAll(group);
                continue;
            }
            for (String sentence : rewritten) {
                out.add(new SourceSentence(sentence + ".", head.slideIndex(), head.visualCue()));
            }
            running = running.append(answer);
        }
        return out;
    }

    private static String prompt(List<SourceSentence> group, PlannedSection planned, VideoPlan plan,
                                 int words, ScriptContinuity continuity) {
        StringBuilder sb = new StringBuilder();
        sb.append("Section: ").append(planned.sectionType().title())
          .append(" (").append(String.join("; ", planned.objectives())).append(")\n");
        sb.append("Tone: ").append(plan.tone()).append(", pacing: ").append(plan.pacing()).append('\n');
        sb.append("Target words: ").append(words).append('\n');
        if (!continuity.isEmpty()) {
            sb.append("Narration so far: ").append(continuity.previousNarration()).append('\n');
        }
        sb.append("Source sentences:\n");
        for (SourceSentence sentence : group) {
            sb.append("- ").append(sentence.text()).append('\n');
        }
        return sb.toString();
    }

    private static List<List<SourceSentence>> groupBySlide(List<SourceSentence> sentences) {
        List<List<SourceSentence>> groups = new ArrayList<>();
        List<SourceSentence> current = new ArrayList<>();
        for (SourceSentence sentence : sentences) {
            if (!current.isEmpty() && !Objects.equals(current.get(0).slideIndex(), sentence.slideIndex())) {
                groups.add(current);
                current = new ArrayList<>();
            }
            current.add(sentence);
        }
        if (!current.isEmpty()) groups.add(current);
        return groups;
    }

    private Script assemble(List<ScriptSection> sections) {
        int words = 0;
        int lines = 0;
        for (ScriptSection section : sections) {
            for (ScriptLine line : section.lines()) {
                words += TextUtil.wordCount(line.text());
                lines++;
            }
        }
        return new Script(sections, estimateSeconds(words), words, lines);
    }

    private static String stripTerminal(String text) {
        return text.trim().replaceAll("[.!?]+$", "").trim();
    }

    record SourceSentence(String text, Integer slideIndex, String visualCue) {
        SourceSentence withText(String replacement) {
            return new SourceSentence(replacement, slideIndex, visualCue);
        }
    }
}

package com.example.narrator.testsupport;

import com.example.narrator.model.Script;
import com.example.narrator.model.ScriptLine;
import com.example.narrator.model.ScriptSection;
import com.example.narrator.model.SectionType;
import com.example.narrator.util.TextUtil;

import java.util.ArrayList;
import java.util.List;

/** Builds single-section scripts for tests. */
public final class Scripts {

    private Scripts() {
    }

    public static Script of(double estimatedSeconds, String... lineTexts) {
        List<ScriptLine> lines = new ArrayList<>();
        int words = 0;
        for (int i = 0; i < lineTexts.length; i++) {
            lines.add(new ScriptLine("s1-l" + (i + 1), "s1", lineTexts[i], i));
            words += TextUtil.wordCount(lineTexts[i]);
        }
        ScriptSection section = new ScriptSection("s1", SectionType.MAIN_CONTENT, SectionType.MAIN_CONTENT.title(), lines, 0);
        return new Script(List.of(section), estimatedSeconds, words, lines.size());
    }

    public static Script withSlides(double estimatedSeconds, List<ScriptLine> lines) {
        int words = lines.stream().mapToInt(l -> TextUtil.wordCount(l.text())).sum();
        ScriptSection section = new ScriptSection("s1", SectionType.MAIN_CONTENT, SectionType.MAIN_CONTENT.title(), lines, 0);
        return new Script(List.of(section), estimatedSeconds, words, lines.size());
    }

    public static Script empty() {
        return new Script(List.of(), 0, 0, 0);
    }
}

package com.example.narrator.dto;

import com.example.narrator.util.TextUtil;

import java.util.List;

/**
 * Narration written so far, carried from one script-writing call into the next. Only the tail is kept
 * so prompts stay bounded.
 */
public record ScriptContinuity(String previousNarration, int passages) {
    public static final int TAIL_WORDS = 80;

    public static ScriptContinuity empty() {
        return new ScriptContinuity("", 0);
    }

    public ScriptContinuity append(String narration) {
        String joined = previousNarration.isEmpty() ? narration : previousNarration + " " + narration;
        List<String> words = TextUtil.words(joined);
        int from = Math.max(0, words.size() - TAIL_WORDS);
        return new ScriptContinuity(String.join(" ", words.subList(from, words.size())), passages + 1);
    }

    public boolean isEmpty() {
        return passages == 0;
    }
}

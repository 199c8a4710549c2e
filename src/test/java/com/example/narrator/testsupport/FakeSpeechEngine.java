package com.example.narrator.testsupport;

import com.example.narrator.engine.Interfaces.SpeechSynthesisEngine;
import com.example.narrator.util.TextUtil;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

/**
 * Writes the line text as the "audio" file and reports a duration of 0.4s per word.
 * Optionally sleeps so that later lines finish before earlier ones.
 */
public class FakeSpeechEngine implements SpeechSynthesisEngine {
    public static final double SECONDS_PER_WORD = 0.4;

    private final AtomicInteger calls = new AtomicInteger();
    private final List<String> completed = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private boolean reverseDelays;
    private IntConsumer onCall = n -> { };

    public FakeSpeechEngine reverseDelays() {
        this.reverseDelays = true;
        return this;
    }

    public FakeSpeechEngine onCall(IntConsumer hook) {
        this.onCall = hook;
        return this;
    }

    @Override
    public Result synthesize(Request request) {
        int n = calls.incrementAndGet();
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        try {
            onCall.accept(n);
            if (reverseDelays) {
                sleep(Math.max(0, 60 - 10 * lineNumber(request.lineId())));
            }
            Files.createDirectories(request.target().getParent());
            Files.writeString(request.target(), request.text(), StandardCharsets.UTF_8);
            completed.add(request.lineId());
            return new Result(request.target(), TextUtil.wordCount(request.text()) * SECONDS_PER_WORD);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    public int calls() {
        return calls.get();
    }

    public List<String> completionOrder() {
        return List.copyOf(completed);
    }

    public int maxInFlight() {
        return maxInFlight.get();
    }

    private static int lineNumber(String lineId) {
        String digits = lineId.substring(lineId.lastIndexOf('l') + 1);
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

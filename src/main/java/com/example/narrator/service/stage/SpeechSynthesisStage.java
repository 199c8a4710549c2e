package com.example.narrator.service.stage;

import com.example.narrator.config.SynthesisProperties;
import com.example.narrator.dto.SynthesisInput;
import com.example.narrator.dto.SynthesisResult;
import com.example.narrator.engine.Interfaces.RenderEngine;
import com.example.narrator.engine.Interfaces.SpeechSynthesisEngine;
import com.example.narrator.engine.Interfaces.TranscriptionEngine;
import com.example.narrator.exception.NarratorException;
import com.example.narrator.exception.PipelineCancelledException;
import com.example.narrator.exception.RenderException;
import com.example.narrator.exception.StorageException;
import com.example.narrator.exception.TransientServiceException;
import com.example.narrator.exception.ValidationException;
import com.example.narrator.model.Script;
import com.example.narrator.model.ScriptLine;
import com.example.narrator.model.Timeline;
import com.example.narrator.model.WordTimestamp;
import com.example.narrator.service.Interfaces.StageAdapter;
import com.example.narrator.service.StageContext;
import com.example.narrator.util.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Voices every script line, then lays the lines end to end on the timeline.
 * <p>
 * Lines are synthesised concurrently, bounded by a semaphore, but durations are appended to the
 * timeline strictly in line order once all of them are known.
 */
public class SpeechSynthesisStage implements StageAdapter<SynthesisInput, SynthesisResult> {
    private static final Logger LOGGER = LoggerFactory.getLogger(SpeechSynthesisStage.class);
    private static final String SERVICE = "Speech synthesis";

    private final SpeechSynthesisEngine speechEngine;
    private final TranscriptionEngine transcriptionEngine;
    private final RenderEngine renderEngine;
    private final Executor executor;
    private final SpeechSynthesisEngine.VoiceOptions voice;
    private final SynthesisProperties props;
    private final Semaphore semaphore;

    public SpeechSynthesisStage(SpeechSynthesisEngine speechEngine,
                                TranscriptionEngine transcriptionEngine,
                                RenderEngine renderEngine,
                                Executor executor,
                                SpeechSynthesisEngine.VoiceOptions voice,
                                SynthesisProperties props) {
        this.speechEngine = speechEngine;
        this.transcriptionEngine = transcriptionEngine;
        this.renderEngine = renderEngine;
        this.executor = executor;
        this.voice = voice;
        this.props = props;
        this.semaphore = new Semaphore(Math.max(1, props.getMaxConcurrency()));
    }

    @Override
    public Stage stage() {
        return Stage.SPEECH_SYNTHESIS;
    }

    @Override
    public SynthesisResult execute(SynthesisInput input, StageContext context) {
        Script script = input.script();
        List<ScriptLine> lines = script.lines();
        if (lines.isEmpty()) {
            throw new ValidationException("Script has no lines to synthesise");
        }
        Path audioDir = audioDir(context.tempDir());
        boolean wordTimings = input.wordTimings() && props.isTranscribeWords();
        AtomicBoolean aborted = new AtomicBoolean(false);
        long t0 = System.nanoTime();

        List<CompletableFuture<LineAudio>> futures = submitLines(lines, audioDir, wordTimings, context, aborted);
        List<LineAudio> results = collect(futures, aborted);
        if (results.size() < lines.size()) {
            context.checkCancelled();
            throw new NarratorException("Speech synthesis stopped after " + results.size() + " of " + lines.size() + " lines");
        }

        Timeline timeline = new Timeline();
        Map<String, Path> lineAudio = new LinkedHashMap<>();
        Map<String, List<WordTimestamp>> wordsByLine = new LinkedHashMap<>();
        List<Path> segments = new ArrayList<>(results.size());
        for (LineAudio result : results) {
            timeline.append(result.lineId(), result.duration());
            lineAudio.put(result.lineId(), result.audio());
            segments.add(result.audio());
            if (!result.words().isEmpty()) {
                wordsByLine.put(result.lineId(), result.words());
            }
        }

        context.checkCancelled();
        Path master = mergeAudio(segments, context.tempDir().resolve("audio_master.wav"));
        LOGGER.info("Speech done jobId={} lines={} durationSec={} wordTimings={} in={}ms",
                context.jobId(), lines.size(), String.format("%.2f", timeline.totalDuration()),
                wordTimings, (System.nanoTime() - t0) / 1_000_000);
        return new SynthesisResult(script.withTimeline(timeline), timeline, master, lineAudio, wordsByLine);
    }

    /**
     * Submits one task per line. The permit is taken here, before submission, so no more than
     * {@code maxConcurrency} tasks are ever queued and submission stops as soon as a line fails or the
     * job is cancelled.
     */
    private List<CompletableFuture<LineAudio>> submitLines(List<ScriptLine> lines, Path audioDir, boolean wordTimings,
                                                           StageContext context, AtomicBoolean aborted) {
        List<CompletableFuture<LineAudio>> futures = new ArrayList<>(lines.size());
        try {
            for (int i = 0; i < lines.size(); i++) {
                ScriptLine line = lines.get(i);
                Path target = audioDir.resolve("line-" + (i + 1) + ".wav");
                acquirePermit(context);
                if (aborted.get() || context.cancellation().isCancelled()) {
                    semaphore.release();
                    LOGGER.debug("Line submission stopped jobId={} submitted={} lines={}", context.jobId(), i, lines.size());
                    break;
                }
                try {
                    futures.add(CompletableFuture.supplyAsync(
                            () -> synthesizeLine(line, target, wordTimings, context, aborted), executor));
                } catch (RuntimeException e) {
                    semaphore.release();
                    throw e;
                }
            }
        } catch (RuntimeException e) {
            aborted.set(true);
            throw e;
        }
        return futures;
    }

    private void acquirePermit(StageContext context) {
        try {
            semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineCancelledException(context.jobId());
        }
    }

    /** Runs with a permit already held and gives it back when done. */
    private LineAudio synthesizeLine(ScriptLine line, Path target, boolean wordTimings,
                                     StageContext context, AtomicBoolean aborted) {
        try {
            if (aborted.get()) {
                throw new NarratorException("Skipped line " + line.id() + " after an earlier failure");
            }
            context.checkCancelled();
            SpeechSynthesisEngine.Result result = speechEngine.synthesize(
                    new SpeechSynthesisEngine.Request(line.id(), line.text(), voice, target));
            List<WordTimestamp> words = List.of();
            if (wordTimings) {
                context.checkCancelled();
                words = transcriptionEngine.transcribe(new TranscriptionEngine.Request(
                        line.id(), result.audio(), line.text(), result.durationSeconds()));
            }
            LOGGER.debug("Line voiced lineId={} durationSec={} words={}", line.id(), result.durationSeconds(), words.size());
            return new LineAudio(line.id(), result.audio(), result.durationSeconds(), words);
        } catch (RuntimeException e) {
            aborted.set(true);
            throw e;
        } finally {
            semaphore.release();
        }
    }

    /** Waits for every line in order; the first failure stops lines that have not started yet. */
    private List<LineAudio> collect(List<CompletableFuture<LineAudio>> futures, AtomicBoolean aborted) {
        List<LineAudio> results = new ArrayList<>(futures.size());
        for (CompletableFuture<LineAudio> future : futures) {
            try {
                results.add(future.get(props.getLineTimeoutSeconds(), TimeUnit.SECONDS));
            } catch (ExecutionException e) {
                aborted.set(true);
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new NarratorException("Line synthesis failed", cause);
            } catch (TimeoutException e) {
                aborted.set(true);
                throw new TransientServiceException(SERVICE, "Line synthesis timed out after "
                        + props.getLineTimeoutSeconds() + "s", e);
            } catch (InterruptedException e) {
                aborted.set(true);
                Thread.currentThread().interrupt();
                throw new NarratorException("Interrupted while waiting for speech synthesis", e);
            }
        }
        return results;
    }

    private Path mergeAudio(List<Path> segments, Path target) {
        try {
            return renderEngine.mergeAudio(segments, target);
        } catch (IOException e) {
            throw new RenderException("Audio merge failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderException("Audio merge interrupted", e);
        }
    }

    private static Path audioDir(Path tempDir) {
        Path dir = tempDir.resolve("audio");
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Cannot create audio directory " + dir, e);
        }
    }

    private record LineAudio(String lineId, Path audio, double duration, List<WordTimestamp> words) {}
}

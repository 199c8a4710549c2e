package com.example.narrator.service.stage;

import com.example.narrator.dto.RenderInput;
import com.example.narrator.dto.RenderRequest;
import com.example.narrator.dto.RenderResult;
import com.example.narrator.dto.RenderSpec;
import com.example.narrator.engine.Interfaces.RenderEngine;
import com.example.narrator.exception.RenderException;
import com.example.narrator.service.Interfaces.StageAdapter;
import com.example.narrator.service.StageContext;
import com.example.narrator.util.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

public class RenderStage implements StageAdapter<RenderInput, RenderResult> {
    private static final Logger LOGGER = LoggerFactory.getLogger(RenderStage.class);
    static final String VIDEO_FILE = "video.mp4";

    private final RenderEngine renderEngine;
    private final RenderSpec spec;
    private final boolean burnSubtitles;

    public RenderStage(RenderEngine renderEngine, RenderSpec spec, boolean burnSubtitles) {
        this.renderEngine = renderEngine;
        this.spec = spec;
        this.burnSubtitles = burnSubtitles;
    }

    @Override
    public Stage stage() {
        return Stage.RENDER;
    }

    @Override
    public RenderResult execute(RenderInput input, StageContext context) {
        context.checkCancelled();
        Path output = context.tempDir().resolve(VIDEO_FILE);
        Path captions = input.captions() != null ? input.captions().file() : null;
        RenderRequest request = new RenderRequest(spec, input.synthesis().masterAudio(), captions, input.cues(),
                input.synthesis().totalDuration(), output, burnSubtitles);
        long t0 = System.nanoTime();
        try {
            RenderResult result = renderEngine.render(request);
            LOGGER.info("Render done jobId={} resolution={} durationSec={} cues={} in={}ms", context.jobId(),
                    result.resolution(), String.format("%.2f", result.duration()), input.cues().size(),
                    (System.nanoTime() - t0) / 1_000_000);
            return result;
        } catch (IOException e) {
            throw new RenderException("Render failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderException("Render interrupted", e);
        }
    }
}

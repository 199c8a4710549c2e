package com.example.narrator.service.stage;

import com.example.narrator.dto.RenderResult;
import com.example.narrator.dto.RenderSpec;
import com.example.narrator.dto.ThumbnailInput;
import com.example.narrator.dto.ThumbnailResult;
import com.example.narrator.engine.Interfaces.RenderEngine;
import com.example.narrator.exception.RenderException;
import com.example.narrator.service.Interfaces.StageAdapter;
import com.example.narrator.service.StageContext;
import com.example.narrator.util.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Grabs the middle frame of the caption-free video, falling back to the final one.
 */
public class ThumbnailStage implements StageAdapter<ThumbnailInput, ThumbnailResult> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ThumbnailStage.class);
    static final String THUMBNAIL_FILE = "thumbnail.png";

    private final RenderEngine renderEngine;
    private final RenderSpec spec;

    public ThumbnailStage(RenderEngine renderEngine, RenderSpec spec) {
        this.renderEngine = renderEngine;
        this.spec = spec;
    }

    @Override
    public Stage stage() {
        return Stage.THUMBNAIL;
    }

    @Override
    public ThumbnailResult execute(ThumbnailInput input, StageContext context) {
        context.checkCancelled();
        RenderResult video = input.video();
        Path source = video.cleanVideoPath() != null ? video.cleanVideoPath() : video.videoPath();
        double at = video.duration() / 2.0;
        Path target = context.tempDir().resolve(THUMBNAIL_FILE);
        try {
            Path frame = renderEngine.extractFrame(source, at, target);
            LOGGER.info("Thumbnail extracted jobId={} atSec={} source={}", context.jobId(),
                    String.format("%.2f", at), source.getFileName());
            return new ThumbnailResult(frame, spec.width(), spec.height(), "png");
        } catch (IOException e) {
            throw new RenderException("Thumbnail extraction failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderException("Thumbnail extraction interrupted", e);
        }
    }
}

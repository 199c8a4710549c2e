package com.example.narrator.dto;

import com.example.narrator.model.OverlayCue;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything the renderer needs for one video: background spec, narration, captions and highlight cues.
 */
public record RenderRequest(RenderSpec spec,
                            Path audio,
                            Path captions,
                            List<OverlayCue> cues,
                            double duration,
                            Path output,
                            boolean burnSubtitles) {
    public RenderRequest {
        cues = cues == null ? List.of() : List.copyOf(cues);
    }
}

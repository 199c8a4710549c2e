package com.example.narrator.dto;

/**
 * Stage outputs handed to the packager.
 */
public record PipelineArtifacts(IntakeResult intake,
                                ContentAnalysis analysis,
                                SynthesisResult synthesis,
                                CaptionResult captions,
                                RenderResult video,
                                ThumbnailResult thumbnail) {
}

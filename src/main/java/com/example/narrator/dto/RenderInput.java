package com.example.narrator.dto;

import com.example.narrator.model.OverlayCue;

import java.util.List;

public record RenderInput(SynthesisResult synthesis, CaptionResult captions, List<OverlayCue> cues) {
}

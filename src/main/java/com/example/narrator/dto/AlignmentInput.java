package com.example.narrator.dto;

import com.example.narrator.model.Slide;

import java.util.List;

public record AlignmentInput(SynthesisResult synthesis, List<Slide> slides, List<String> keywords) {
}

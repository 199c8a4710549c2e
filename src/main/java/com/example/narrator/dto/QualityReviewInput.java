package com.example.narrator.dto;

import com.example.narrator.model.Script;

public record QualityReviewInput(String sourceText, Script script, VideoPlan plan) {
}

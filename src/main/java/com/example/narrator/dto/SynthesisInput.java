package com.example.narrator.dto;

import com.example.narrator.model.Script;

/**
 * Script to voice; word timings are only worth requesting when there are slide elements to align against.
 */
public record SynthesisInput(Script script, boolean wordTimings) {
}

package com.example.narrator.util;

/**
 * Named pipeline steps, in execution order.
 */
public enum Stage {
    INTAKE,
    ANALYSIS,
    PLANNING,
    SCRIPT,
    QUALITY_REVIEW,
    SPEECH_SYNTHESIS,
    CAPTIONS,
    ALIGNMENT,
    RENDER,
    THUMBNAIL,
    PACKAGING
}

package com.example.narrator.model;

public enum CueConfidence {
    EXACT,
    INTERPOLATED
}

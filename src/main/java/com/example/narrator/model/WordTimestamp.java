package com.example.narrator.model;

/**
 * Spoken word with times in seconds relative to the start of its own utterance.
 */
public record WordTimestamp(String word, double start, double end) {
}

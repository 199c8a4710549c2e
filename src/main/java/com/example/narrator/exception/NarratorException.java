package com.example.narrator.exception;

/**
 * Base type for every failure raised by the pipeline.
 */
public class NarratorException extends RuntimeException {
    public NarratorException(String message) {
        super(message);
    }

    public NarratorException(String message, Throwable cause) {
        super(message, cause);
    }
}

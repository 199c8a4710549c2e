package com.example.narrator.exception;

/**
 * Malformed or missing input. Never retried.
 */
public class ValidationException extends NarratorException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

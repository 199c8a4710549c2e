package com.example.narrator.exception;

public class RenderException extends NarratorException {
    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.example.narrator.exception;

import com.example.narrator.util.Stage;

/**
 * Failure of a single pipeline stage, naming the stage and keeping the underlying cause.
 */
public class StageException extends NarratorException {
    private final Stage stage;

    public StageException(Stage stage, Throwable cause) {
        super("Stage " + stage + " failed: " + describe(cause), cause);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }

    private static String describe(Throwable cause) {
        if (cause == null) return "unknown error";
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}

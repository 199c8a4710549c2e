package com.example.narrator.exception;

public class StorageException extends NarratorException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.example.narrator.exception;

/**
 * Timeout, rate limit or dropped connection from an external service. Retried with backoff;
 * surfaces as fatal once attempts run out.
 */
public class TransientServiceException extends NarratorException {
    private final String service;

    public TransientServiceException(String service, String message) {
        super(message);
        this.service = service;
    }

    public TransientServiceException(String service, String message, Throwable cause) {
        super(message, cause);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}

package com.example.narrator.exception;

public class ExternalServiceException extends NarratorException {
    private final String service;
    private final int status;

    public ExternalServiceException(String service, int status, String message) {
        super(message);
        this.service = service;
        this.status = status;
    }

    public String getService() {
        return service;
    }

    public int getStatus() {
        return status;
    }
}

package com.example.narrator.exception;

public class PipelineCancelledException extends NarratorException {
    public PipelineCancelledException(String jobId) {
        super("Job " + jobId + " was cancelled");
    }
}

package com.example.narrator.service;

import com.example.narrator.exception.PipelineCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one job. Stages check it between units of work.
 */
public class CancellationToken {
    private final String jobId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public CancellationToken(String jobId) {
        this.jobId = jobId;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new PipelineCancelledException(jobId);
        }
    }
}

package com.example.narrator.service;

import java.nio.file.Path;

/**
 * Per-job state every stage may read: where to put intermediates and whether to stop.
 */
public record StageContext(String jobId, Path tempDir, CancellationToken cancellation) {

    public void checkCancelled() {
        cancellation.throwIfCancelled();
    }
}

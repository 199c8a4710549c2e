package com.example.narrator.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One end-to-end pipeline run. Only the orchestrator changes its state; other threads may read it while
 * the job runs.
 */
public class Job {
    private final String id;
    private final Path outputDir;
    private final Instant createdAt;
    private volatile JobStatus status = JobStatus.PENDING;
    private volatile Instant updatedAt;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    public Job(String id, Path outputDir, Instant createdAt) {
        this.id = id;
        this.outputDir = outputDir;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public Path getTempDir() {
        return outputDir.resolve("temp");
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public JobStatus getStatus() {
        return status;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void transitionTo(JobStatus next, Instant at) {
        this.status = next;
        this.updatedAt = at;
    }

    /** Snapshot in insertion order. */
    public synchronized Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public synchronized void putMetadata(String key, Object value) {
        if (value != null) {
            metadata.put(key, value);
        }
    }
}

package com.example.narrator.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class JobTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void pollingThreadSeesTheTerminalStatus() throws Exception {
        Job job = new Job("job-1", Path.of("out/job-1"), CREATED);
        job.transitionTo(JobStatus.IN_PROGRESS, CREATED);

        CompletableFuture<JobStatus> watcher = CompletableFuture.supplyAsync(() -> {
            while (job.getStatus() == JobStatus.IN_PROGRESS) {
                Thread.onSpinWait();
            }
            return job.getStatus();
        });
        Instant done = CREATED.plusSeconds(5);
        job.transitionTo(JobStatus.COMPLETED, done);

        assertThat(watcher.get(5, TimeUnit.SECONDS)).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getUpdatedAt()).isEqualTo(done);
    }

    @Test
    void metadataIsASnapshotInInsertionOrder() {
        Job job = new Job("job-2", Path.of("out/job-2"), CREATED);
        job.putMetadata("sourceType", "TEXT");
        job.putMetadata("qualityScore", 90);
        job.putMetadata("ignored", null);

        Map<String, Object> snapshot = job.getMetadata();
        job.putMetadata("failedStage", "RENDER");

        assertThat(snapshot.keySet()).containsExactly("sourceType", "qualityScore");
        assertThat(job.getMetadata()).containsEntry("failedStage", "RENDER").hasSize(3);
        assertThat(job.getTempDir()).isEqualTo(Path.of("out/job-2/temp"));
    }
}

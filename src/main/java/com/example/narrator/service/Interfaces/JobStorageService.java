package com.example.narrator.service.Interfaces;

import java.nio.file.Path;

/**
 * File layout for jobs: {@code <root>/<jobId>/} for final artifacts and {@code <root>/<jobId>/temp/}
 * for intermediates.
 */
public interface JobStorageService {

    /** Creates the job and temp directories. Calling it again for the same job is not an error. */
    Path prepareJobDirectories(String jobId);

    Path jobDir(String jobId);

    /** Resolves a relative name inside the job directory, rejecting traversal outside it. */
    Path resolveInJob(String jobId, String relativeName);

    Path resolveTemp(String jobId, String relativeName);

    /** Copies via a temporary sibling and an atomic rename, so readers never see a half-written file. */
    void copyAtomically(Path source, Path target);

    void writeAtomically(Path target, byte[] content);

    void deleteTemp(String jobId);

    Path root();
}

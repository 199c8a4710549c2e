package com.example.narrator.service;

import com.example.narrator.exception.StorageException;
import com.example.narrator.service.Interfaces.JobStorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

public class LocalJobStorageService implements JobStorageService {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalJobStorageService.class);
    private static final String TEMP_DIR = "temp";

    private final Path baseDir;

    public LocalJobStorageService(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.baseDir);
            LOGGER.info("LocalJobStorageService ready. base={}", this.baseDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create output directory " + this.baseDir, e);
        }
    }

    @Override
    public Path prepareJobDirectories(String jobId) {
        Path jobDir = jobDir(jobId);
        try {
            Files.createDirectories(jobDir.resolve(TEMP_DIR));
            return jobDir;
        } catch (IOException e) {
            throw new StorageException("Cannot create job directory " + jobDir, e);
        }
    }

    @Override
    public Path jobDir(String jobId) {
        return safeResolve(baseDir, jobId);
    }

    @Override
    public Path resolveInJob(String jobId, String relativeName) {
        return safeResolve(jobDir(jobId), relativeName);
    }

    @Override
    public Path resolveTemp(String jobId, String relativeName) {
        return safeResolve(jobDir(jobId).resolve(TEMP_DIR), relativeName);
    }

    @Override
    public void copyAtomically(Path source, Path target) {
        Path staging = stagingFor(target);
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            Files.copy(source, staging, REPLACE_EXISTING);
            move(staging, target);
        } catch (IOException e) {
            deleteQuietly(staging);
            throw new StorageException("Copy failed " + source + " -> " + target, e);
        }
    }

    @Override
    public void writeAtomically(Path target, byte[] content) {
        Path staging = stagingFor(target);
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            Files.write(staging, content);
            move(staging, target);
        } catch (IOException e) {
            deleteQuietly(staging);
            throw new StorageException("Write failed: " + target, e);
        }
    }

    @Override
    public void deleteTemp(String jobId) {
        Path temp = jobDir(jobId).resolve(TEMP_DIR);
        if (!Files.exists(temp)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(temp)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
            LOGGER.info("Temp directory removed jobId={} path={}", jobId, temp);
        } catch (IOException e) {
            throw new StorageException("Delete failed: " + temp, e);
        }
    }

    @Override
    public Path root() {
        return baseDir;
    }

    private Path safeResolve(Path root, String key) {
        if (key == null || key.isBlank()) {
            throw new StorageException("path key is blank");
        }
        // Force forward slashes; strip leading slashes
        String normalizedKey = key.replace('\\', '/').replaceAll("^/+", "");
        Path p = root.resolve(normalizedKey).normalize();
        if (!p.startsWith(root) || p.equals(root)) {
            throw new StorageException("Invalid path key (path traversal?): " + key);
        }
        return p;
    }

    private static Path stagingFor(Path target) {
        return target.resolveSibling("." + target.getFileName() + "." + UUID.randomUUID() + ".part");
    }

    private static void move(Path staging, Path target) throws IOException {
        try {
            Files.move(staging, target, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOGGER.debug("Atomic move unsupported for {} - falling back to replace", target);
            Files.move(staging, target, REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            LOGGER.warn("Could not remove staging file {}: {}", p, e.toString());
        }
    }
}

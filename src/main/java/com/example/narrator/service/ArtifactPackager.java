package com.example.narrator.service;

import com.example.narrator.dto.ContentAnalysis;
import com.example.narrator.dto.IntakeResult;
import com.example.narrator.dto.OutputPackage;
import com.example.narrator.dto.PackageMetadata;
import com.example.narrator.dto.PipelineArtifacts;
import com.example.narrator.dto.RenderResult;
import com.example.narrator.dto.SourceMetadata;
import com.example.narrator.exception.StorageException;
import com.example.narrator.model.Job;
import com.example.narrator.service.Interfaces.JobStorageService;
import com.example.narrator.util.TextUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Moves the finished artifacts of a job into its directory under fixed names and writes the
 * script and metadata documents. Every file goes through a temporary sibling and a rename, so a
 * re-run for the same job replaces files without ever exposing a partial one.
 */
public class ArtifactPackager {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactPackager.class);

    public static final String VIDEO = "final_video.mp4";
    public static final String VIDEO_CLEAN = "final_video_clean.mp4";
    public static final String SUBTITLES = "video_subtitles";
    public static final String AUDIO = "audio_master.wav";
    public static final String SCRIPT = "script.json";
    public static final String THUMBNAIL = "thumbnail_base.png";
    public static final String METADATA = "metadata.json";

    private static final int MAX_TITLE_CHARS = 80;

    private final JobStorageService storage;
    private final ObjectMapper om;
    private final Clock clock;

    public ArtifactPackager(JobStorageService storage, ObjectMapper om, Clock clock) {
        this.storage = storage;
        this.om = om;
        this.clock = clock;
    }

    public OutputPackage pack(Job job, PipelineArtifacts artifacts) {
        String jobId = job.getId();
        Path dir = storage.prepareJobDirectories(jobId);
        RenderResult video = artifacts.video();

        Path videoPath = copy(video.videoPath(), storage.resolveInJob(jobId, VIDEO));
        Path cleanPath = null;
        if (video.cleanVideoPath() != null && Files.exists(video.cleanVideoPath())) {
            cleanPath = copy(video.cleanVideoPath(), storage.resolveInJob(jobId, VIDEO_CLEAN));
        }
        Path subtitlesPath = copy(artifacts.captions().file(),
                storage.resolveInJob(jobId, SUBTITLES + "." + artifacts.captions().format()));
        Path audioPath = copy(artifacts.synthesis().masterAudio(), storage.resolveInJob(jobId, AUDIO));
        Path thumbnailPath = copy(artifacts.thumbnail().thumbnailPath(), storage.resolveInJob(jobId, THUMBNAIL));

        Path scriptPath = storage.resolveInJob(jobId, SCRIPT);
        storage.writeAtomically(scriptPath, toJson(artifacts.synthesis().timedScript()));

        Instant now = Instant.now(clock);
        double processingTime = Duration.between(job.getCreatedAt(), now).toMillis() / 1000.0;
        String title = title(artifacts.intake(), artifacts.analysis());
        SourceMetadata source = artifacts.intake().metadata();
        ContentAnalysis analysis = artifacts.analysis();
        PackageMetadata metadata = new PackageMetadata(
                jobId,
                artifacts.intake().originalSource(),
                title,
                source != null ? source.author() : null,
                source != null ? source.publishedDate() : null,
                analysis != null ? analysis.contentType() : null,
                analysis != null ? analysis.tone() : null,
                analysis != null ? analysis.keywords() : null,
                video.duration(),
                video.resolution(),
                video.fileSize(),
                job.getCreatedAt(),
                processingTime);
        Path metadataPath = storage.resolveInJob(jobId, METADATA);
        storage.writeAtomically(metadataPath, toJson(metadata));

        LOGGER.info("Package written jobId={} dir={} durationSec={} sizeBytes={} processingSec={}",
                jobId, dir, String.format("%.2f", video.duration()), video.fileSize(), processingTime);
        return new OutputPackage(jobId,
                new OutputPackage.Paths(dir, videoPath, cleanPath, subtitlesPath, audioPath, scriptPath,
                        thumbnailPath, metadataPath),
                new OutputPackage.Summary(artifacts.intake().originalSource(), title, video.duration(),
                        job.getCreatedAt(), processingTime));
    }

    static String title(IntakeResult intake, ContentAnalysis analysis) {
        if (intake.metadata() != null && intake.metadata().title() != null && !intake.metadata().title().isBlank()) {
            return intake.metadata().title().trim();
        }
        String fallback = analysis != null && analysis.coreMessage() != null
                ? analysis.coreMessage()
                : intake.cleanedText();
        return TextUtil.truncate(fallback.trim(), MAX_TITLE_CHARS);
    }

    private Path copy(Path source, Path target) {
        if (source == null || !Files.exists(source)) {
            throw new StorageException("Missing artifact for " + target.getFileName() + ": " + source);
        }
        storage.copyAtomically(source, target);
        return target;
    }

    private byte[] toJson(Object value) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialise " + value.getClass().getSimpleName(), e);
        }
    }
}

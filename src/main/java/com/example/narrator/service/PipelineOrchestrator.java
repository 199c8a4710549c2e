package com.example.narrator.service;

import com.example.narrator.config.PipelineProperties;
import com.example.narrator.dto.AlignmentInput;
import com.example.narrator.dto.CaptionResult;
import com.example.narrator.dto.ContentAnalysis;
import com.example.narrator.dto.IntakeResult;
import com.example.narrator.dto.OutputPackage;
import com.example.narrator.dto.PipelineArtifacts;
import com.example.narrator.dto.PipelineRequest;
import com.example.narrator.dto.PlanningInput;
import com.example.narrator.dto.QualityReviewInput;
import com.example.narrator.dto.RenderInput;
import com.example.narrator.dto.RenderResult;
import com.example.narrator.dto.ScriptInput;
import com.example.narrator.dto.SynthesisInput;
import com.example.narrator.dto.SynthesisResult;
import com.example.narrator.dto.ThumbnailInput;
import com.example.narrator.dto.ThumbnailResult;
import com.example.narrator.dto.VideoPlan;
import com.example.narrator.exception.QualityRejectedException;
import com.example.narrator.exception.StageException;
import com.example.narrator.model.Job;
import com.example.narrator.model.JobStatus;
import com.example.narrator.model.OverlayCue;
import com.example.narrator.model.QualityVerdict;
import com.example.narrator.model.Recommendation;
import com.example.narrator.model.Script;
import com.example.narrator.service.Interfaces.JobStorageService;
import com.example.narrator.service.Interfaces.StageAdapter;
import com.example.narrator.util.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Runs one job through every stage in order and owns its lifecycle.
 * <p>
 * Stages run strictly one after another. A failure stops the job at once: it is marked
 * {@link JobStatus#FAILED}, temporary artifacts stay on disk and the error names the stage that failed.
 * A rejected quality verdict surfaces as {@link QualityRejectedException}; a revise verdict only logs.
 * An {@link Error} thrown by a stage also fails the job before it propagates unchanged.
 */
public class PipelineOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final StageAdapter<PipelineRequest, IntakeResult> intake;
    private final StageAdapter<IntakeResult, ContentAnalysis> analysis;
    private final StageAdapter<PlanningInput, VideoPlan> planning;
    private final StageAdapter<ScriptInput, Script> scriptWriter;
    private final StageAdapter<QualityReviewInput, QualityVerdict> qualityReview;
    private final StageAdapter<SynthesisInput, SynthesisResult> speech;
    private final StageAdapter<SynthesisResult, CaptionResult> captions;
    private final StageAdapter<AlignmentInput, List<OverlayCue>> alignment;
    private final StageAdapter<RenderInput, RenderResult> render;
    private final StageAdapter<ThumbnailInput, ThumbnailResult> thumbnail;
    private final ArtifactPackager packager;
    private final JobStorageService storage;
    private final PipelineProperties props;
    private final Clock clock;

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final Map<String, CancellationToken> running = new ConcurrentHashMap<>();
    private final Map<String, Stage> currentStage = new ConcurrentHashMap<>();

    public PipelineOrchestrator(StageAdapter<PipelineRequest, IntakeResult> intake,
                                StageAdapter<IntakeResult, ContentAnalysis> analysis,
                                StageAdapter<PlanningInput, VideoPlan> planning,
                                StageAdapter<ScriptInput, Script> scriptWriter,
                                StageAdapter<QualityReviewInput, QualityVerdict> qualityReview,
                                StageAdapter<SynthesisInput, SynthesisResult> speech,
                                StageAdapter<SynthesisResult, CaptionResult> captions,
                                StageAdapter<AlignmentInput, List<OverlayCue>> alignment,
                                StageAdapter<RenderInput, RenderResult> render,
                                StageAdapter<ThumbnailInput, ThumbnailResult> thumbnail,
                                ArtifactPackager packager,
                                JobStorageService storage,
                                PipelineProperties props,
                                Clock clock) {
        this.intake = intake;
        this.analysis = analysis;
        this.planning = planning;
        this.scriptWriter = scriptWriter;
        this.qualityReview = qualityReview;
        this.speech = speech;
        this.captions = captions;
        this.alignment = alignment;
        this.render = render;
        this.thumbnail = thumbnail;
        this.packager = packager;
        this.storage = storage;
        this.props = props;
        this.clock = clock;
    }

    public OutputPackage execute(PipelineRequest request) {
        String jobId = UUID.randomUUID().toString();
        Job job = new Job(jobId, storage.jobDir(jobId), Instant.now(clock));
        jobs.put(jobId, job);
        CancellationToken token = new CancellationToken(jobId);
        running.put(jobId, token);

        boolean keepTemp = request.keepTemp() != null ? request.keepTemp() : props.isKeepTemp();
        boolean qualityCheck = request.qualityCheckEnabled() != null
                ? request.qualityCheckEnabled()
                : props.isQualityCheckEnabled();
        Integer targetSeconds = request.targetSeconds() != null ? request.targetSeconds() : props.getDefaultTargetSeconds();

        job.transitionTo(JobStatus.IN_PROGRESS, Instant.now(clock));
        LOGGER.info("PipelineOrchestrator START jobId={} sourceType={} targetSec={} qualityCheck={} keepTemp={}",
                jobId, request.sourceType(), targetSeconds, qualityCheck, keepTemp);
        long t0 = System.nanoTime();
        try {
            StageContext ctx = new StageContext(jobId, job.getTempDir(), token);
            step(Stage.INTAKE, jobId, () -> storage.prepareJobDirectories(jobId));

            IntakeResult intakeResult = run(intake, request, ctx);
            job.putMetadata("sourceType", intakeResult.sourceType().name());
            ContentAnalysis contentAnalysis = run(analysis, intakeResult, ctx);
            VideoPlan plan = run(planning, new PlanningInput(contentAnalysis, targetSeconds), ctx);
            Script script = run(scriptWriter, new ScriptInput(intakeResult, contentAnalysis, plan), ctx);

            if (qualityCheck) {
                QualityVerdict verdict = run(qualityReview,
                        new QualityReviewInput(intakeResult.cleanedText(), script, plan), ctx);
                job.putMetadata("qualityScore", verdict.score());
                job.putMetadata("qualityRecommendation", verdict.recommendation().name());
                applyVerdict(jobId, verdict);
            }

            SynthesisResult synthesis = run(speech, new SynthesisInput(script, intakeResult.hasSlides()), ctx);
            CaptionResult captionResult = run(captions, synthesis, ctx);
            List<OverlayCue> cues = intakeResult.hasSlides()
                    ? run(alignment, new AlignmentInput(synthesis, intakeResult.slides(), contentAnalysis.keywords()), ctx)
                    : List.of();
            RenderResult video = run(render, new RenderInput(synthesis, captionResult, cues), ctx);
            ThumbnailResult thumb = run(thumbnail, new ThumbnailInput(video), ctx);

            PipelineArtifacts artifacts = new PipelineArtifacts(intakeResult, contentAnalysis, synthesis,
                    captionResult, video, thumb);
            OutputPackage output = step(Stage.PACKAGING, jobId, () -> {
                token.throwIfCancelled();
                return packager.pack(job, artifacts);
            });

            job.transitionTo(JobStatus.COMPLETED, Instant.now(clock));
            if (!keepTemp) {
                removeTemp(jobId);
            }
            LOGGER.info("PipelineOrchestrator DONE jobId={} dir={} in={}ms",
                    jobId, output.paths().directory(), (System.nanoTime() - t0) / 1_000_000);
            return output;
        } catch (QualityRejectedException e) {
            fail(job, Stage.QUALITY_REVIEW, e);
            throw e;
        } catch (StageException e) {
            fail(job, e.getStage(), e);
            throw e;
        } catch (Error e) {
            fail(job, currentStage.getOrDefault(jobId, Stage.INTAKE), e);
            throw e;
        } finally {
            running.remove(jobId);
            currentStage.remove(jobId);
        }
    }

    /** Requests cancellation of an in-flight job. Returns false if the job is not running. */
    public boolean cancel(String jobId) {
        CancellationToken token = running.get(jobId);
        if (token == null) {
            return false;
        }
        token.cancel();
        LOGGER.info("PipelineOrchestrator CANCEL requested jobId={}", jobId);
        return true;
    }

    public List<String> activeJobs() {
        return new ArrayList<>(running.keySet());
    }

    public Optional<Job> findJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public List<Job> jobs() {
        return new ArrayList<>(jobs.values());
    }

    private void applyVerdict(String jobId, QualityVerdict verdict) {
        if (verdict.recommendation() == Recommendation.REJECT) {
            throw new QualityRejectedException(verdict);
        }
        if (verdict.recommendation() == Recommendation.REVISE) {
            LOGGER.warn("Quality verdict REVISE jobId={} score={} issues={} - continuing",
                    jobId, verdict.score(), verdict.issues().size());
        }
    }

    private <I, O> O run(StageAdapter<I, O> adapter, I input, StageContext ctx) {
        return step(adapter.stage(), ctx.jobId(), () -> {
            ctx.checkCancelled();
            return adapter.execute(input, ctx);
        });
    }

    private <O> O step(Stage stage, String jobId, Supplier<O> body) {
        long t0 = System.nanoTime();
        currentStage.put(jobId, stage);
        LOGGER.debug("Stage START jobId={} stage={}", jobId, stage);
        try {
            O out = body.get();
            LOGGER.info("Stage DONE jobId={} stage={} elapsedMs={}", jobId, stage, (System.nanoTime() - t0) / 1_000_000);
            return out;
        } catch (QualityRejectedException | StageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StageException(stage, e);
        }
    }

    private void fail(Job job, Stage stage, Throwable error) {
        job.transitionTo(JobStatus.FAILED, Instant.now(clock));
        job.putMetadata("failedStage", stage.name());
        job.putMetadata("error", error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        if (error instanceof Error) {
            LOGGER.error("PipelineOrchestrator FAILED jobId={} stage={} temp={}", job.getId(), stage, job.getTempDir(), error);
        } else {
            LOGGER.error("PipelineOrchestrator FAILED jobId={} stage={} cause={} temp={}",
                    job.getId(), stage, error.getMessage(), job.getTempDir());
        }
    }

    private void removeTemp(String jobId) {
        try {
            storage.deleteTemp(jobId);
        } catch (RuntimeException e) {
            LOGGER.warn("Temp cleanup failed jobId={} error={}", jobId, e.getMessage());
        }
    }
}

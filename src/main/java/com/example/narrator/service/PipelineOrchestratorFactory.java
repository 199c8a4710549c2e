package com.example.narrator.service;

import com.example.narrator.config.PipelineProperties;
import com.example.narrator.dto.AlignmentInput;
import com.example.narrator.dto.CaptionResult;
import com.example.narrator.dto.ContentAnalysis;
import com.example.narrator.dto.IntakeResult;
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
import com.example.narrator.model.OverlayCue;
import com.example.narrator.model.QualityVerdict;
import com.example.narrator.model.Script;
import com.example.narrator.service.Interfaces.JobStorageService;
import com.example.narrator.service.Interfaces.StageAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Builds orchestrators over the shared stage set for a given output root, so one run can target a
 * directory other than the configured one.
 */
public class PipelineOrchestratorFactory {
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
    private final ObjectMapper om;
    private final PipelineProperties props;
    private final Clock clock;

    public PipelineOrchestratorFactory(StageAdapter<PipelineRequest, IntakeResult> intake,
                                       StageAdapter<IntakeResult, ContentAnalysis> analysis,
                                       StageAdapter<PlanningInput, VideoPlan> planning,
                                       StageAdapter<ScriptInput, Script> scriptWriter,
                                       StageAdapter<QualityReviewInput, QualityVerdict> qualityReview,
                                       StageAdapter<SynthesisInput, SynthesisResult> speech,
                                       StageAdapter<SynthesisResult, CaptionResult> captions,
                                       StageAdapter<AlignmentInput, List<OverlayCue>> alignment,
                                       StageAdapter<RenderInput, RenderResult> render,
                                       StageAdapter<ThumbnailInput, ThumbnailResult> thumbnail,
                                       ObjectMapper om,
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
        this.om = om;
        this.props = props;
        this.clock = clock;
    }

    public PipelineOrchestrator create(Path outputRoot) {
        return create(new LocalJobStorageService(outputRoot));
    }

    public PipelineOrchestrator create(JobStorageService storage) {
        ArtifactPackager packager = new ArtifactPackager(storage, om, clock);
        return new PipelineOrchestrator(intake, analysis, planning, scriptWriter, qualityReview, speech,
                captions, alignment, render, thumbnail, packager, storage, props, clock);
    }
}

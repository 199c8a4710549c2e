package com.example.narrator.config;

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
import com.example.narrator.engine.Interfaces.ContentResolver;
import com.example.narrator.engine.Interfaces.RenderEngine;
import com.example.narrator.engine.Interfaces.SpeechSynthesisEngine;
import com.example.narrator.engine.Interfaces.TextGenerationEngine;
import com.example.narrator.engine.Interfaces.TranscriptionEngine;
import com.example.narrator.model.OverlayCue;
import com.example.narrator.model.QualityVerdict;
import com.example.narrator.model.Script;
import com.example.narrator.service.AlignmentEngine;
import com.example.narrator.service.Interfaces.JobStorageService;
import com.example.narrator.service.Interfaces.StageAdapter;
import com.example.narrator.service.LocalJobStorageService;
import com.example.narrator.service.PipelineOrchestrator;
import com.example.narrator.service.PipelineOrchestratorFactory;
import com.example.narrator.service.quality.DurationDeviationCheck;
import com.example.narrator.service.quality.EmptyLineCheck;
import com.example.narrator.service.quality.KeywordCoverageCheck;
import com.example.narrator.service.quality.LanguageModelReviewCheck;
import com.example.narrator.service.quality.QualityGate;
import com.example.narrator.service.stage.AlignmentStage;
import com.example.narrator.service.stage.CaptionStage;
import com.example.narrator.service.stage.ContentAnalysisStage;
import com.example.narrator.service.stage.ContentIntakeStage;
import com.example.narrator.service.stage.PlanningStage;
import com.example.narrator.service.stage.QualityReviewStage;
import com.example.narrator.service.stage.RenderStage;
import com.example.narrator.service.stage.ScriptGenerationStage;
import com.example.narrator.service.stage.SpeechSynthesisStage;
import com.example.narrator.service.stage.ThumbnailStage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Wires the stage chain and the orchestrator.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public JobStorageService jobStorageService(PipelineProperties props) {
        return new LocalJobStorageService(Path.of(props.getOutputDir()));
    }

    @Bean
    public StageAdapter<PipelineRequest, IntakeResult> contentIntakeStage(List<ContentResolver> resolvers, Clock clock) {
        return new ContentIntakeStage(resolvers, clock);
    }

    @Bean
    public StageAdapter<IntakeResult, ContentAnalysis> contentAnalysisStage(TextGenerationEngine textEngine,
                                                                            ObjectMapper om,
                                                                            PipelineProperties props) {
        return new ContentAnalysisStage(textEngine, om, props.getMinTextLength());
    }

    @Bean
    public StageAdapter<PlanningInput, VideoPlan> planningStage() {
        return new PlanningStage();
    }

    @Bean
    public StageAdapter<ScriptInput, Script> scriptGenerationStage(TextGenerationEngine textEngine, PipelineProperties props) {
        return new ScriptGenerationStage(textEngine, props.getWordsPerMinute());
    }

    @Bean
    public QualityGate qualityGate(TextGenerationEngine textEngine, ObjectMapper om, PipelineProperties props) {
        return new QualityGate(List.of(
                new KeywordCoverageCheck(),
                new EmptyLineCheck(),
                new DurationDeviationCheck(),
                new LanguageModelReviewCheck(textEngine, om)), props.getQualityMinScore());
    }

    @Bean
    public StageAdapter<QualityReviewInput, QualityVerdict> qualityReviewStage(QualityGate gate) {
        return new QualityReviewStage(gate);
    }

    @Bean
    public StageAdapter<SynthesisInput, SynthesisResult> speechSynthesisStage(
            SpeechSynthesisEngine speechEngine,
            TranscriptionEngine transcriptionEngine,
            RenderEngine renderEngine,
            @Qualifier("synthesisTaskExecutor") ThreadPoolTaskExecutor executor,
            AiServicesProperties ai,
            SynthesisProperties props) {
        SpeechSynthesisEngine.VoiceOptions voice =
                new SpeechSynthesisEngine.VoiceOptions(ai.getTts().getVoice(), ai.getTts().getSpeed());
        return new SpeechSynthesisStage(speechEngine, transcriptionEngine, renderEngine, executor, voice, props);
    }

    @Bean
    public StageAdapter<SynthesisResult, CaptionResult> captionStage(PipelineProperties props) {
        return new CaptionStage(props.getSubtitleFormat());
    }

    @Bean
    public AlignmentEngine alignmentEngine(VideoProperties video) {
        return new AlignmentEngine(video.getWidth(), video.getHeight());
    }

    @Bean
    public StageAdapter<AlignmentInput, List<OverlayCue>> alignmentStage(AlignmentEngine engine) {
        return new AlignmentStage(engine);
    }

    @Bean
    public StageAdapter<RenderInput, RenderResult> renderStage(RenderEngine renderEngine, VideoProperties video) {
        return new RenderStage(renderEngine, video.toRenderSpec(), video.isBurnSubtitles());
    }

    @Bean
    public StageAdapter<ThumbnailInput, ThumbnailResult> thumbnailStage(RenderEngine renderEngine, VideoProperties video) {
        return new ThumbnailStage(renderEngine, video.toRenderSpec());
    }

    @Bean
    public PipelineOrchestratorFactory pipelineOrchestratorFactory(
            StageAdapter<PipelineRequest, IntakeResult> intake,
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
        return new PipelineOrchestratorFactory(intake, analysis, planning, scriptWriter, qualityReview, speech,
                captions, alignment, render, thumbnail, om, props, clock);
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(PipelineOrchestratorFactory factory, JobStorageService storage) {
        return factory.create(storage);
    }
}

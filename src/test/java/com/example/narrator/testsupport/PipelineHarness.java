package com.example.narrator.testsupport;

import com.example.narrator.config.PipelineProperties;
import com.example.narrator.config.SynthesisProperties;
import com.example.narrator.config.VideoProperties;
import com.example.narrator.engine.DocumentContentResolver;
import com.example.narrator.engine.EvenSplitTranscriptionEngine;
import com.example.narrator.engine.Interfaces.DocumentParser;
import com.example.narrator.engine.Interfaces.SpeechSynthesisEngine;
import com.example.narrator.engine.Interfaces.TextGenerationEngine;
import com.example.narrator.service.AlignmentEngine;
import com.example.narrator.service.PipelineOrchestrator;
import com.example.narrator.service.PipelineOrchestratorFactory;
import com.example.narrator.service.quality.DurationDeviationCheck;
import com.example.narrator.service.quality.EmptyLineCheck;
import com.example.narrator.service.quality.KeywordCoverageCheck;
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

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires the real stage chain the way the application context does, over fake engines.
 */
public final class PipelineHarness {
    public final PipelineProperties props = new PipelineProperties();
    public final SynthesisProperties synthesis = new SynthesisProperties();
    public final VideoProperties video = new VideoProperties();
    public final ObjectMapper om = new ObjectMapper().findAndRegisterModules();

    private final TextGenerationEngine textEngine;
    private final SpeechSynthesisEngine speechEngine;
    private final FakeRenderEngine renderEngine;
    private final DocumentParser documentParser;
    private final Executor executor;
    private final Clock clock;

    public PipelineHarness(TextGenerationEngine textEngine,
                           SpeechSynthesisEngine speechEngine,
                           FakeRenderEngine renderEngine,
                           DocumentParser documentParser,
                           Executor executor,
                           Clock clock) {
        this.textEngine = textEngine;
        this.speechEngine = speechEngine;
        this.renderEngine = renderEngine;
        this.documentParser = documentParser;
        this.executor = executor;
        this.clock = clock;
        props.setMinTextLength(20);
        props.setKeepTemp(false);
        synthesis.setLineTimeoutSeconds(30);
    }

    public PipelineOrchestratorFactory factory() {
        QualityGate gate = new QualityGate(List.of(new KeywordCoverageCheck(), new EmptyLineCheck(),
                new DurationDeviationCheck()), props.getQualityMinScore());
        return new PipelineOrchestratorFactory(
                new ContentIntakeStage(List.of(new DocumentContentResolver(documentParser, video, clock)), clock),
                new ContentAnalysisStage(textEngine, om, props.getMinTextLength()),
                new PlanningStage(),
                new ScriptGenerationStage(textEngine, props.getWordsPerMinute()),
                new QualityReviewStage(gate),
                new SpeechSynthesisStage(speechEngine, new EvenSplitTranscriptionEngine(), renderEngine, executor,
                        new SpeechSynthesisEngine.VoiceOptions("alloy", 1.0), synthesis),
                new CaptionStage(props.getSubtitleFormat()),
                new AlignmentStage(new AlignmentEngine(video.getWidth(), video.getHeight())),
                new RenderStage(renderEngine, video.toRenderSpec(), video.isBurnSubtitles()),
                new ThumbnailStage(renderEngine, video.toRenderSpec()),
                om, props, clock);
    }

    public PipelineOrchestrator orchestrator(Path outputRoot) {
        return factory().create(outputRoot);
    }
}

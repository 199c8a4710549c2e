package com.example.narrator.service;

import com.example.narrator.dto.OutputPackage;
import com.example.narrator.dto.PipelineRequest;
import com.example.narrator.engine.Interfaces.DocumentParser;
import com.example.narrator.exception.PipelineCancelledException;
import com.example.narrator.exception.StageException;
import com.example.narrator.model.BoundingBox;
import com.example.narrator.model.CueConfidence;
import com.example.narrator.model.ElementRole;
import com.example.narrator.model.Job;
import com.example.narrator.model.JobStatus;
import com.example.narrator.model.OverlayCue;
import com.example.narrator.model.Recommendation;
import com.example.narrator.model.Slide;
import com.example.narrator.model.SlideElement;
import com.example.narrator.testsupport.FakeRenderEngine;
import com.example.narrator.testsupport.FakeSpeechEngine;
import com.example.narrator.testsupport.OfflineTextEngine;
import com.example.narrator.testsupport.PipelineHarness;
import com.example.narrator.util.SourceType;
import com.example.narrator.util.Stage;
import com.example.narrator.util.TextUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineEndToEndTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private static final String ARTICLE = """
            Plasma is the fourth state of matter after solids, liquids and gases. It forms when a gas is heated until electrons leave their atoms.

            Stars like our Sun are giant balls of glowing plasma. Lightning creates plasma for a brief moment in the sky. Neon signs glow because electricity turns their gas into plasma.

            Scientists study plasma to build fusion reactors on Earth. Fusion reactors must hold plasma hotter than the core of the Sun. Strong magnetic fields keep the hot plasma away from the walls. If fusion succeeds, it could provide clean energy for centuries. Plasma research therefore matters for the future of energy.
            """;

    private static final String LONG_ARTICLE = """
            Plasma is a very hot gas made of charged particles. Plasma forms when heat strips electrons from the atoms. Stars glow because the stars hold hot dense plasma. Lightning turns air into plasma for a brief bright moment. Neon signs glow when electric current turns gas into plasma.

            Scientists study plasma because plasma can feed clean fusion reactors. Fusion joins atoms and releases energy as strong heat. Fusion heats the stars and fusion can heat cities too. Fusion reactors must hold plasma hotter than the solar core. Strong magnetic fields keep hot plasma away from reactor walls. Magnetic fields guide charged particles along closed curved paths. Reactor walls would melt if hot plasma touched them directly. Scientists heat plasma with radio waves and fast particle beams. Fusion research needs careful control of plasma heat and density. Plasma density and heat decide how much energy fusion releases. Fusion reactors measure plasma heat with lasers and magnetic probes. Scientists improve magnetic fields so plasma stays stable for longer. Stable plasma helps fusion reactors release more energy than used. Clean fusion energy would leave no smoke and little waste. Fusion reactors burn fuel found in water across the planet. Fusion research matters for clean energy and for the planet.

            Plasma also helps industry with hot charged gas every day. Plasma beams etch tiny circuits for chips in electric devices. Plasma cleans tools and walls with hot charged gas particles. Plasma torches cut metal with strong focused electric heat. Plasma lamps and screens once turned electric current into light.

            In short, plasma is hot charged gas found across the universe. Stars, lightning and fusion reactors all depend on hot plasma. Magnetic fields and careful control make clean fusion energy possible. Plasma research may one day bring clean fusion energy to everyone on the planet.
            """;

    @TempDir
    Path outputRoot;

    @Mock
    private DocumentParser documentParser;

    private ExecutorService executor;
    private FakeSpeechEngine speech;
    private FakeRenderEngine render;
    private PipelineHarness harness;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        speech = new FakeSpeechEngine();
        render = new FakeRenderEngine();
        harness = new PipelineHarness(new OfflineTextEngine(), speech, render, documentParser, executor, CLOCK);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void textSourceProducesCompletePackage() throws Exception {
        PipelineOrchestrator orchestrator = harness.orchestrator(outputRoot);

        OutputPackage output = orchestrator.execute(new PipelineRequest(ARTICLE, SourceType.TEXT, 60, null, null));

        OutputPackage.Paths paths = output.paths();
        assertThat(paths.directory()).isEqualTo(outputRoot.resolve(output.jobId()));
        assertThat(paths.video()).hasFileName("final_video.mp4").exists();
        assertThat(paths.videoClean()).hasFileName("final_video_clean.mp4").exists();
        assertThat(paths.subtitles()).hasFileName("video_subtitles.srt").exists();
        assertThat(paths.audio()).hasFileName("audio_master.wav").exists();
        assertThat(paths.script()).hasFileName("script.json").exists();
        assertThat(paths.thumbnail()).hasFileName("thumbnail_base.png").exists();
        assertThat(paths.metadata()).hasFileName("metadata.json").exists();
        assertThat(paths.directory().resolve("temp")).doesNotExist();

        Job job = orchestrator.findJob(output.jobId()).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);

        JsonNode script = harness.om.readTree(paths.script().toFile());
        JsonNode firstLine = script.path("sections").get(0).path("lines").get(0);
        assertThat(firstLine.path("id").asText()).isEqualTo("s1-l1");
        assertThat(firstLine.path("startTime").asDouble()).isZero();

        JsonNode metadata = harness.om.readTree(paths.metadata().toFile());
        assertThat(metadata.path("jobId").asText()).isEqualTo(output.jobId());
        assertThat(metadata.path("title").asText()).startsWith("Plasma is the fourth state of matter");
        assertThat(metadata.path("resolution").asText()).isEqualTo("1920x1080");
        assertThat(metadata.path("keywords")).isNotEmpty();
        assertThat(metadata.path("duration").asDouble()).isCloseTo(output.metadata().duration(), within(1e-9));

        String srt = Files.readString(paths.subtitles());
        assertThat(srt).startsWith("1\n00:00:00,000 --> ");
        assertThat(render.lastFrameAt()).isCloseTo(output.metadata().duration() / 2, within(1e-9));
        assertThat(output.metadata().duration()).isPositive();
        assertThat(render.renders()).singleElement().satisfies(r -> assertThat(r.cues()).isEmpty());
    }

    @Test
    void threeHundredWordArticleFitsOneMinuteWithAGaplessTimeline() throws Exception {
        assertThat(TextUtil.wordCount(LONG_ARTICLE)).isEqualTo(300);
        PipelineOrchestrator orchestrator = harness.orchestrator(outputRoot);

        OutputPackage output = orchestrator.execute(new PipelineRequest(LONG_ARTICLE, SourceType.TEXT, 60, true, null));

        Job job = orchestrator.findJob(output.jobId()).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getMetadata())
                .containsEntry("qualityScore", 100)
                .containsEntry("qualityRecommendation", Recommendation.APPROVE.name());

        JsonNode script = harness.om.readTree(output.paths().script().toFile());
        assertThat(script.path("totalEstimatedDuration").asDouble()).isCloseTo(60.0, within(6.0));
        double previousEnd = 0;
        int lineCount = 0;
        for (JsonNode section : script.path("sections")) {
            for (JsonNode line : section.path("lines")) {
                assertThat(line.path("startTime").asDouble()).isCloseTo(previousEnd, within(1e-9));
                assertThat(line.path("endTime").asDouble()).isGreaterThan(line.path("startTime").asDouble());
                previousEnd = line.path("endTime").asDouble();
                lineCount++;
            }
        }
        assertThat(lineCount).isEqualTo(script.path("sentenceCount").asInt());
        assertThat(previousEnd).isCloseTo(60.0, within(6.0));
        assertThat(output.metadata().duration()).isCloseTo(previousEnd, within(1e-6));
    }

    @Test
    void slideDocumentGetsExactHighlightCues() {
        Slide plasma = new Slide(0, "Plasma", "Plasma is ionised gas\nPlasma conducts electricity", List.of(
                new SlideElement(0, ElementRole.TITLE, "Plasma", new BoundingBox(100, 50, 800, 150)),
                new SlideElement(0, ElementRole.BODY, "Plasma is ionised gas", new BoundingBox(100, 300, 1200, 80))));
        Slide fusion = new Slide(1, "Fusion", "Fusion powers stars\nFusion needs hot plasma", List.of(
                new SlideElement(1, ElementRole.TITLE, "Fusion", new BoundingBox(100, 50, 600, 150))));
        when(documentParser.supports(any())).thenReturn(true);
        when(documentParser.parse(any(), anyInt(), anyInt())).thenReturn(List.of(plasma, fusion));
        PipelineOrchestrator orchestrator = harness.orchestrator(outputRoot);

        OutputPackage output = orchestrator.execute(new PipelineRequest("deck.pdf", SourceType.DOCUMENT, 60, null, null));

        List<OverlayCue> cues = render.renders().get(0).cues();
        assertThat(cues).isNotEmpty();
        assertThat(cues).allMatch(c -> c.confidence() == CueConfidence.EXACT);
        assertThat(cues).allMatch(c -> c.start() >= 0 && c.end() <= output.metadata().duration() + 1e-9);
        assertThat(cues).filteredOn(c -> c.text().equals("fusion"))
                .extracting(OverlayCue::box)
                .containsOnly(new BoundingBox(100, 50, 600, 150));
        assertThat(output.metadata().title()).isEqualTo("Plasma");
    }

    @Test
    void cancellingDuringSpeechFailsJobAndKeepsPartialAudio() throws Exception {
        harness.synthesis.setMaxConcurrency(1);
        PipelineOrchestrator orchestrator = harness.orchestrator(outputRoot);
        speech.onCall(n -> {
            if (n == 3) {
                orchestrator.activeJobs().forEach(orchestrator::cancel);
            }
        });

        assertThatThrownBy(() -> orchestrator.execute(new PipelineRequest(ARTICLE, SourceType.TEXT, 60, null, false)))
                .isInstanceOf(StageException.class)
                .hasCauseInstanceOf(PipelineCancelledException.class)
                .satisfies(e -> assertThat(((StageException) e).getStage()).isEqualTo(Stage.SPEECH_SYNTHESIS));

        Job job = orchestrator.jobs().get(0);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(orchestrator.activeJobs()).isEmpty();
        assertThat(job.getOutputDir().resolve("final_video.mp4")).doesNotExist();
        try (Stream<Path> voiced = Files.list(job.getTempDir().resolve("audio"))) {
            assertThat(voiced.count()).isEqualTo(3);
        }
        assertThat(speech.calls()).isEqualTo(3);
        assertThat(render.renders()).isEmpty();
    }

    @Test
    void renderFailureNamesRenderStage() {
        FakeRenderEngine broken = new FakeRenderEngine().failingRender();
        PipelineHarness failing = new PipelineHarness(new OfflineTextEngine(), speech, broken, documentParser, executor, CLOCK);
        PipelineOrchestrator orchestrator = failing.orchestrator(outputRoot);

        assertThatThrownBy(() -> orchestrator.execute(new PipelineRequest(ARTICLE, SourceType.TEXT, 60, null, false)))
                .isInstanceOf(StageException.class)
                .hasMessageContaining("RENDER")
                .hasMessageContaining("ffmpeg exited with code 1");
        Job job = orchestrator.jobs().get(0);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getTempDir().resolve("audio_master.wav")).exists();
    }

    @Test
    void separateRunsGetSeparateDirectories() {
        PipelineOrchestrator orchestrator = harness.orchestrator(outputRoot);

        OutputPackage first = orchestrator.execute(new PipelineRequest(ARTICLE, SourceType.TEXT, 30, null, null));
        OutputPackage second = orchestrator.execute(new PipelineRequest(ARTICLE, SourceType.TEXT, 30, null, null));

        assertThat(first.jobId()).isNotEqualTo(second.jobId());
        assertThat(first.paths().directory()).isNotEqualTo(second.paths().directory());
        assertThat(orchestrator.jobs()).hasSize(2).allMatch(j -> j.getStatus() == JobStatus.COMPLETED);
    }
}

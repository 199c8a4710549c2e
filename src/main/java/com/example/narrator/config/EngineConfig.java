package com.example.narrator.config;

import com.example.narrator.engine.DocumentContentResolver;
import com.example.narrator.engine.EvenSplitTranscriptionEngine;
import com.example.narrator.engine.FallbackTranscriptionEngine;
import com.example.narrator.engine.FfmpegRenderEngine;
import com.example.narrator.engine.Interfaces.ContentResolver;
import com.example.narrator.engine.Interfaces.DocumentParser;
import com.example.narrator.engine.Interfaces.RenderEngine;
import com.example.narrator.engine.Interfaces.SpeechSynthesisEngine;
import com.example.narrator.engine.Interfaces.TextGenerationEngine;
import com.example.narrator.engine.Interfaces.TranscriptionEngine;
import com.example.narrator.engine.OpenAISpeechSynthesisEngine;
import com.example.narrator.engine.OpenAITextGenerationEngine;
import com.example.narrator.engine.OpenAIWordTranscriptionEngine;
import com.example.narrator.engine.PdfBoxDocumentParser;
import com.example.narrator.engine.WebArticleContentResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class EngineConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public TextGenerationEngine textGenerationEngine(@Qualifier("llmWebClient") WebClient client,
                                                     AiServicesProperties props,
                                                     ObjectMapper om) {
        OpenAITextGenerationEngine engine = new OpenAITextGenerationEngine(client, props, om);
        if (!engine.isAvailable()) {
            LOGGER.info("Language model disabled or no API key - rule-based analysis and script writing");
        }
        return engine;
    }

    @Bean
    public SpeechSynthesisEngine speechSynthesisEngine(@Qualifier("ttsWebClient") WebClient client,
                                                       AiServicesProperties props,
                                                       ObjectMapper om) {
        return new OpenAISpeechSynthesisEngine(client, props, om);
    }

    @Bean
    public TranscriptionEngine transcriptionEngine(@Qualifier("asrWebClient") WebClient client,
                                                   AiServicesProperties props,
                                                   ObjectMapper om) {
        EvenSplitTranscriptionEngine evenSplit = new EvenSplitTranscriptionEngine();
        if (!props.getAsr().isEnabled() || !props.getAsr().hasApiKey()) {
            LOGGER.info("Word transcription disabled - word timings split evenly per line");
            return evenSplit;
        }
        return new FallbackTranscriptionEngine(new OpenAIWordTranscriptionEngine(client, props, om), evenSplit);
    }

    @Bean
    public RenderEngine renderEngine(
            @Value("${narrator.ffmpeg.binary:ffmpeg}") String ffmpegBin,
            @Value("${narrator.ffmpeg.timeout-seconds:900}") long timeoutSeconds,
            @Value("${narrator.ffmpeg.fonts-dir:}") String fontsDir
    ) {
        Path fonts = fontsDir == null || fontsDir.isBlank() ? null : Path.of(fontsDir);
        return new FfmpegRenderEngine(ffmpegBin, Duration.ofSeconds(Math.max(1, timeoutSeconds)), fonts);
    }

    @Bean
    public DocumentParser documentParser() {
        return new PdfBoxDocumentParser();
    }

    @Bean
    public ContentResolver webArticleContentResolver(@Qualifier("articleWebClient") WebClient client,
                                                     IntakeProperties props,
                                                     Clock clock) {
        return new WebArticleContentResolver(client, props, clock);
    }

    @Bean
    public ContentResolver documentContentResolver(DocumentParser parser, VideoProperties video, Clock clock) {
        return new DocumentContentResolver(parser, video, clock);
    }
}

package com.example.narrator.engine;

import com.example.narrator.config.AiServicesProperties;
import com.example.narrator.engine.Interfaces.SpeechSynthesisEngine;
import com.example.narrator.exception.StorageException;
import com.example.narrator.exception.TransientServiceException;
import com.example.narrator.exception.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Text-to-speech over the OpenAI audio API. Audio is requested as WAV so the duration can be read
 * from the file without an extra probe.
 */
public class OpenAISpeechSynthesisEngine implements SpeechSynthesisEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAISpeechSynthesisEngine.class);
    private static final String SERVICE = "OpenAI speech";
    private static final int MAX_INPUT_CHARS = 4096;

    private final WebClient client;
    private final AiServicesProperties.Speech props;
    private final ObjectMapper om;

    public OpenAISpeechSynthesisEngine(WebClient client, AiServicesProperties properties, ObjectMapper om) {
        this.client = client;
        this.props = properties.getTts();
        this.om = om;
    }

    @Override
    public Result synthesize(Request request) {
        if (request.text() == null || request.text().isBlank()) {
            throw new ValidationException("Nothing to synthesise for line " + request.lineId());
        }
        if (request.text().length() > MAX_INPUT_CHARS) {
            throw new ValidationException("Line " + request.lineId() + " exceeds " + MAX_INPUT_CHARS + " characters");
        }
        VoiceOptions voice = request.voice() != null ? request.voice() : new VoiceOptions(props.getVoice(), props.getSpeed());

        ObjectNode body = om.createObjectNode();
        body.put("model", props.getModel());
        body.put("voice", voice.voice());
        body.put("input", request.text());
        body.put("speed", voice.speed());
        body.put("response_format", "wav");

        byte[] audio = client.post()
                .uri("/v1/audio/speech")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(text -> RetrySupport.statusError(SERVICE, resp.statusCode(), text)))
                .bodyToMono(byte[].class)
                .timeout(Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())))
                .retryWhen(RetrySupport.transientBackoff(SERVICE, request.lineId(), props, LOGGER))
                .block();

        if (audio == null || audio.length == 0) {
            throw new TransientServiceException(SERVICE, "Empty audio for line " + request.lineId());
        }
        try {
            Files.createDirectories(request.target().toAbsolutePath().getParent());
            Files.write(request.target(), audio);
            double duration = WavDurations.durationSeconds(request.target());
            LOGGER.debug("OpenAI speech lineId={} bytes={} durationSec={}", request.lineId(), audio.length, duration);
            return new Result(request.target(), duration);
        } catch (IOException e) {
            throw new StorageException("Cannot store audio for line " + request.lineId() + " at " + request.target(), e);
        }
    }
}

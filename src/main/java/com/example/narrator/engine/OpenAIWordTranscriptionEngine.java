package com.example.narrator.engine;

import com.example.narrator.config.AiServicesProperties;
import com.example.narrator.config.OpenAIServiceProperties;
import com.example.narrator.engine.Interfaces.TranscriptionEngine;
import com.example.narrator.exception.TransientServiceException;
import com.example.narrator.exception.ValidationException;
import com.example.narrator.model.WordTimestamp;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpStatusCode;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Word timestamps through the OpenAI transcription endpoint ({@code verbose_json}, word granularity).
 */
public class OpenAIWordTranscriptionEngine implements TranscriptionEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAIWordTranscriptionEngine.class);
    private static final String SERVICE = "OpenAI transcription";

    private final WebClient client;
    private final OpenAIServiceProperties props;
    private final ObjectMapper om;

    public OpenAIWordTranscriptionEngine(WebClient client, AiServicesProperties properties, ObjectMapper om) {
        this.client = client;
        this.props = properties.getAsr();
        this.om = om;
    }

    @Override
    public List<WordTimestamp> transcribe(Request request) {
        if (request.audio() == null || !Files.exists(request.audio())) {
            throw new ValidationException("audio not found: " + request.audio());
        }
        var form = new LinkedMultiValueMap<String, Object>();
        form.add("file", new FileSystemResource(request.audio()));
        form.add("model", props.getModel());
        form.add("response_format", "verbose_json");
        form.add("timestamp_granularities[]", "word");

        JsonNode root = client.post()
                .uri("/v1/audio/transcriptions")
                .body(BodyInserters.fromMultipartData(form))
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(body -> RetrySupport.statusError(SERVICE, resp.statusCode(), body)))
                .bodyToMono(String.class)
                .map(this::parseJson)
                .timeout(Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())))
                .retryWhen(RetrySupport.transientBackoff(SERVICE, request.lineId(), props, LOGGER))
                .block();

        if (root == null) throw new TransientServiceException(SERVICE, "Empty transcription for line " + request.lineId());

        List<WordTimestamp> words = new ArrayList<>();
        if (root.has("words") && root.get("words").isArray()) {
            for (JsonNode w : root.get("words")) words.add(parseWordSafe(w));
        } else if (root.has("segments") && root.get("segments").isArray()) {
            for (JsonNode seg : root.get("segments")) {
                if (seg.has("words")) {
                    for (JsonNode w : seg.get("words")) words.add(parseWordSafe(w));
                }
            }
        }

        // clamp + sort
        List<WordTimestamp> cleaned = words.stream()
                .filter(w -> w.word() != null && !w.word().isBlank())
                .map(w -> new WordTimestamp(w.word().trim(), Math.max(0.0, w.start()), Math.max(Math.max(0.0, w.start()), w.end())))
                .sorted(Comparator.comparingDouble(WordTimestamp::start))
                .toList();
        LOGGER.debug("OpenAI transcription lineId={} words={}", request.lineId(), cleaned.size());
        return cleaned;
    }

    private WordTimestamp parseWordSafe(JsonNode w) {
        double s = w.path("start").asDouble(Double.NaN);
        double e = w.path("end").asDouble(Double.NaN);
        double start = Double.isFinite(s) ? s : 0.0;
        double end = Double.isFinite(e) ? e : start;
        String text = w.path("word").asText(w.path("text").asText(""));
        return new WordTimestamp(text, start, end);
    }

    private JsonNode parseJson(String body) {
        try {
            return om.readTree(body);
        } catch (JsonProcessingException e) {
            int length = body == null ? 0 : body.length();
            throw new TransientServiceException(SERVICE, "Truncated transcription body length=" + length, e);
        }
    }
}

package com.example.narrator.engine;

import com.example.narrator.config.AiServicesProperties;
import com.example.narrator.config.OpenAIServiceProperties;
import com.example.narrator.engine.Interfaces.TextGenerationEngine;
import com.example.narrator.exception.TransientServiceException;
import com.example.narrator.util.TextUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Chat-completions client. Responses that cannot be parsed count as transient and are retried.
 */
public class OpenAITextGenerationEngine implements TextGenerationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAITextGenerationEngine.class);
    private static final String SERVICE = "OpenAI chat";

    private final WebClient client;
    private final OpenAIServiceProperties props;
    private final double temperature;
    private final ObjectMapper om;

    public OpenAITextGenerationEngine(WebClient client, AiServicesProperties properties, ObjectMapper om) {
        this.client = client;
        this.props = properties.getLlm();
        this.temperature = properties.getTemperature();
        this.om = om;
    }

    @Override
    public boolean isAvailable() {
        return props.isEnabled() && props.hasApiKey();
    }

    @Override
    public String generate(Request request) {
        ObjectNode body = om.createObjectNode();
        body.put("model", props.getModel());
        body.put("temperature", temperature);
        ArrayNode messages = body.putArray("messages");
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.addObject().put("role", "system").put("content", request.systemPrompt());
        }
        messages.addObject().put("role", "user").put("content", request.prompt());
        if (request.jsonResponse()) {
            body.putObject("response_format").put("type", "json_object");
        }

        LOGGER.debug("OpenAI chat request purpose={} model={} promptChars={}",
                request.purpose(), props.getModel(), request.prompt().length());

        String content = client.post()
                .uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(text -> RetrySupport.statusError(SERVICE, resp.statusCode(), text)))
                .bodyToMono(String.class)
                .map(this::extractContent)
                .timeout(Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())))
                .retryWhen(RetrySupport.transientBackoff(SERVICE, request.purpose(), props, LOGGER))
                .block();

        if (content == null || content.isBlank()) {
            throw new TransientServiceException(SERVICE, "Empty completion for purpose=" + request.purpose());
        }
        LOGGER.debug("OpenAI chat response purpose={} chars={}", request.purpose(), content.length());
        return content.trim();
    }

    private String extractContent(String raw) {
        try {
            JsonNode root = om.readTree(raw);
            JsonNode content = root.path("choices").path(0).path("message").path("content");
            if (content.isMissingNode() || content.isNull()) {
                throw new TransientServiceException(SERVICE, "Completion without content: " + TextUtil.truncate(raw, 300));
            }
            return content.asText();
        } catch (JsonProcessingException e) {
            throw new TransientServiceException(SERVICE, "Truncated completion body length="
                    + (raw == null ? 0 : raw.length()), e);
        }
    }
}

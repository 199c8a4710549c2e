package com.example.narrator.engine;

import com.example.narrator.config.AiServicesProperties;
import com.example.narrator.engine.Interfaces.TranscriptionEngine;
import com.example.narrator.exception.ValidationException;
import com.example.narrator.model.WordTimestamp;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OpenAIWordTranscriptionEngineTest {

    @TempDir
    Path tmp;

    @Test
    void parsesWordsSortedAndClamped() throws Exception {
        String json = """
                {"text":"plasma glows bright","words":[
                  {"word":" glows ","start":0.5,"end":0.9},
                  {"word":"plasma","start":-0.1,"end":0.4},
                  {"word":"","start":0.9,"end":1.0},
                  {"word":"bright","start":1.0,"end":0.8}
                ]}
                """;
        ExchangeFunction exchangeFunction = request -> Mono.just(jsonResponse(json));

        List<WordTimestamp> words = engine(exchangeFunction).transcribe(request());

        assertThat(words).containsExactly(
                new WordTimestamp("plasma", 0.0, 0.4),
                new WordTimestamp("glows", 0.5, 0.9),
                new WordTimestamp("bright", 1.0, 1.0));
    }

    @Test
    void readsWordsNestedInSegments() throws Exception {
        String json = """
                {"segments":[{"words":[{"word":"one","start":0.0,"end":0.3}]},
                             {"words":[{"text":"two","start":0.3,"end":0.6}]}]}
                """;

        List<WordTimestamp> words = engine(request -> Mono.just(jsonResponse(json))).transcribe(request());

        assertThat(words).extracting(WordTimestamp::word).containsExactly("one", "two");
    }

    @Test
    void retriesDroppedConnections() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        ExchangeFunction exchangeFunction = request -> {
            if (attempts.incrementAndGet() < 3) {
                return Mono.error(PrematureCloseException.TEST_EXCEPTION);
            }
            return Mono.just(jsonResponse("{\"words\":[{\"word\":\"ok\",\"start\":0.0,\"end\":0.2}]}"));
        };

        List<WordTimestamp> words = engine(exchangeFunction).transcribe(request());

        assertThat(attempts.get()).isEqualTo(3);
        assertThat(words).hasSize(1);
    }

    @Test
    void missingAudioIsRejectedWithoutCallingTheService() {
        AtomicInteger attempts = new AtomicInteger();
        TranscriptionEngine engine = engine(request -> {
            attempts.incrementAndGet();
            return Mono.just(jsonResponse("{}"));
        });

        assertThrows(ValidationException.class, () -> engine.transcribe(
                new TranscriptionEngine.Request("l1", tmp.resolve("missing.wav"), "text", 1.0)));
        assertThat(attempts.get()).isZero();
    }

    private TranscriptionEngine engine(ExchangeFunction exchangeFunction) {
        AiServicesProperties props = new AiServicesProperties();
        props.getAsr().setApiKey("test-key");
        props.getAsr().setBackoffMillis(1);
        props.getAsr().setMaxAttempts(3);
        WebClient client = WebClient.builder().exchangeFunction(exchangeFunction).build();
        return new OpenAIWordTranscriptionEngine(client, props, new ObjectMapper());
    }

    private TranscriptionEngine.Request request() throws Exception {
        Path audio = Files.write(tmp.resolve("line.wav"), new byte[]{1, 2, 3});
        return new TranscriptionEngine.Request("s1-l1", audio, "plasma glows bright", 1.2);
    }

    private static ClientResponse jsonResponse(String body) {
        return ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}

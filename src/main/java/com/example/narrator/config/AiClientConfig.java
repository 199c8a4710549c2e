package com.example.narrator.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * HTTP clients for the language model, speech, transcription and article fetching.
 */
@Configuration
public class AiClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(AiClientConfig.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;
    private static final int MAX_CONNECTIONS = 10;
    private static final Duration PENDING_ACQUIRE_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration MAX_IDLE_TIME = Duration.ofSeconds(20);

    @Bean("llmWebClient")
    WebClient llmWebClient(AiServicesProperties props) {
        return openAiClient("llm", props.getLlm(), 4 * 1024 * 1024);
    }

    @Bean("ttsWebClient")
    WebClient ttsWebClient(AiServicesProperties props) {
        return openAiClient("tts", props.getTts(), 64 * 1024 * 1024);
    }

    @Bean("asrWebClient")
    WebClient asrWebClient(AiServicesProperties props) {
        return openAiClient("asr", props.getAsr(), 8 * 1024 * 1024);
    }

    @Bean("articleWebClient")
    WebClient articleWebClient(WebClient.Builder builder, IntakeProperties props) {
        HttpClient http = HttpClient.create()
                .followRedirect(true)
                .compress(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Duration.ofSeconds(5).toMillis())
                .responseTimeout(Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())));

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(props.getMaxBodyBytes()))
                .build();

        return builder
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(strategies)
                .defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9,ko;q=0.8")
                .defaultHeader(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .build();
    }

    private static WebClient openAiClient(String name, OpenAIServiceProperties props, int maxInMemory) {
        Duration timeout = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
        ConnectionProvider provider = ConnectionProvider.builder("openai-" + name)
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(PENDING_ACQUIRE_TIMEOUT)
                .maxIdleTime(MAX_IDLE_TIME)
                .build();

        HttpClient httpClient = HttpClient.create(provider)
                .protocol(HttpProtocol.HTTP11)
                .compress(false)
                .responseTimeout(timeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeout.toSeconds(), TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeout.toSeconds(), TimeUnit.SECONDS)));

        LOGGER.info("Configuring OpenAI WebClient name={} baseUrl={} model={} timeout={}s apiKey={}",
                name, props.getBaseUrl(), props.getModel(), timeout.toSeconds(), props.hasApiKey() ? "set" : "missing");

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, "application/json")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(maxInMemory));
        if (props.hasApiKey()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiKey().trim());
        }
        return builder.build();
    }
}

package com.commerceforecast.analysis.backend;

import com.commerceforecast.common.exception.BackendException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link GenerationBackend} backed by the Anthropic Messages API.
 *
 * <p>Fully non-blocking: the HTTP call is a {@code Mono} chain, so several units can
 * wait on the backend at once without holding threads. Timeouts are applied by the
 * caller ({@link com.commerceforecast.analysis.runner.UnitRunner}), not here.
 */
@Component
public class AnthropicGenerationBackend implements GenerationBackend {

    private static final Logger log = LoggerFactory.getLogger(AnthropicGenerationBackend.class);

    static final String SOURCE = "GenerationBackend";
    static final String STRUCTURED_SUFFIX =
        "\n\nRespond ONLY with valid JSON. No markdown, no explanations.";

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final GenerationProperties properties;

    public AnthropicGenerationBackend(WebClient.Builder builder, ObjectMapper objectMapper,
                                      GenerationProperties properties) {
        this.anthropicClient = builder
            .baseUrl(properties.getBaseUrl())
            .defaultHeader("anthropic-version", properties.getAnthropicVersion())
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .clientConnector(new ReactorClientHttpConnector(httpClient(properties)))
            .filter(loggingFilter())
            .build();
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public Mono<GenerationResponse> generate(GenerationRequest request) {
        String apiKey = properties.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new BackendException(SOURCE, "No Anthropic API key configured"));
        }

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody(request)))
            .flatMap(bodyJson ->
                anthropicClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
            )
            .map(this::toResponse)
            .doOnNext(r -> log.debug("[GenerationBackend] model={} promptTokens={} completionTokens={}",
                r.model(), r.promptTokens(), r.completionTokens()))
            .onErrorMap(e -> !(e instanceof BackendException), this::toBackendException);
    }

    private static HttpClient httpClient(GenerationProperties properties) {
        return HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.getConnectTimeout().toMillis())
            .responseTimeout(properties.getReadTimeout())
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(properties.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS))
            );
    }

    // x-api-key travels as a header, so only method and URL are logged.
    private static ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("[GenerationBackend] Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    Map<String, Object> requestBody(GenerationRequest request) {
        String userPrompt = request.wantStructured()
            ? request.userPrompt() + STRUCTURED_SUFFIX
            : request.userPrompt();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", properties.getModel());
        body.put("max_tokens", request.maxTokens());
        body.put("temperature", request.temperature());
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            body.put("system", request.systemPrompt());
        }
        body.put("messages", List.of(Map.of("role", "user", "content", userPrompt)));
        return body;
    }

    GenerationResponse toResponse(String response) {
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode content = root.path("content");
            if (!content.isArray() || content.isEmpty()) {
                throw new BackendException(SOURCE, "Response carried no content blocks");
            }
            JsonNode usage = root.path("usage");
            return new GenerationResponse(
                content.get(0).path("text").asText(""),
                usage.path("input_tokens").asInt(0),
                usage.path("output_tokens").asInt(0),
                root.path("model").asText(properties.getModel())
            );
        } catch (BackendException e) {
            throw e;
        } catch (Exception e) {
            throw new BackendException(SOURCE, "Failed to read Anthropic response", e);
        }
    }

    private BackendException toBackendException(Throwable e) {
        if (e instanceof WebClientResponseException wcre) {
            log.warn("[GenerationBackend] HTTP error status={} body={}",
                wcre.getStatusCode().value(), wcre.getResponseBodyAsString());
            return new BackendException(SOURCE,
                "Anthropic API returned HTTP " + wcre.getStatusCode().value(), e);
        }
        return new BackendException(SOURCE, "Anthropic API call failed: " + e.getMessage(), e);
    }
}

package com.knowledge.extraction.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * LLM provider backed by a local or remote Ollama server.
 *
 * <p>Ollama must be running (default: http://localhost:11434) with the ranked models pulled.</p>
 *
 * Usage:
 * <pre>
 * LLMProvider provider = OllamaLLMProvider.builder()
 *     .baseUrl("http://localhost:11434")
 *     .build();
 *
 * ModelInvoker invoker = new ModelInvoker(provider);
 * </pre>
 */
public class OllamaLLMProvider implements LLMProvider {
    private static final Logger log = LoggerFactory.getLogger(OllamaLLMProvider.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OllamaLLMProvider(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
                .connectTimeout(builder.connectTimeout != null ? builder.connectTimeout : DEFAULT_CONNECT_TIMEOUT)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public LLMResponse generate(String modelId, String prompt, GenerationOptions options) throws LLMException {
        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(new OllamaRequest(modelId, prompt, false,
                    new OllamaOptions(options.temperature(), options.maxTokens())));
        } catch (JsonProcessingException e) {
            throw new LLMTransportException("Could not serialize Ollama request", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/generate"))
                .timeout(options.timeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        log.debug("Calling Ollama with model: {}", modelId);
        long start = System.nanoTime();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new LLMTimeoutException("Ollama model " + modelId + " timed out after " + options.timeout(), e);
        } catch (IOException e) {
            throw new LLMTransportException("Error calling Ollama: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LLMTransportException("Interrupted while calling Ollama model " + modelId, e);
        }
        long latencyMs = (System.nanoTime() - start) / 1_000_000;

        if (response.statusCode() != 200) {
            throw new LLMTransportException("Ollama returned status " + response.statusCode() + ": " + response.body());
        }

        OllamaResponse ollamaResponse;
        try {
            ollamaResponse = objectMapper.readValue(response.body(), OllamaResponse.class);
        } catch (JsonProcessingException e) {
            throw new LLMTransportException("Unreadable Ollama response body", e);
        }
        String text = ollamaResponse.response() != null ? ollamaResponse.response() : "";
        log.debug("Ollama response received, model={}, length={}, latencyMs={}", modelId, text.length(), latencyMs);

        return new LLMResponse(text, ollamaResponse.promptEvalCount(), ollamaResponse.evalCount(), latencyMs);
    }

    @Override
    public String getProviderName() {
        return "Ollama";
    }

    @Override
    public boolean isAvailable() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/tags"))
                    .timeout(Duration.ofSeconds(5))
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200;
        } catch (IOException e) {
            log.debug("Ollama not available: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a provider for the default local Ollama endpoint.
     */
    public static OllamaLLMProvider createDefault() {
        return builder().build();
    }

    public static class Builder {
        private String baseUrl;
        private Duration connectTimeout;
        private HttpClient httpClient;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public OllamaLLMProvider build() {
            return new OllamaLLMProvider(this);
        }
    }

    // Request/Response DTOs for Ollama API
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record OllamaRequest(
            String model,
            String prompt,
            boolean stream,
            OllamaOptions options
    ) {}

    private record OllamaOptions(
            double temperature,
            @JsonProperty("num_predict") int numPredict
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OllamaResponse(
            String model,
            String response,
            boolean done,
            @JsonProperty("prompt_eval_count") int promptEvalCount,
            @JsonProperty("eval_count") int evalCount
    ) {}
}

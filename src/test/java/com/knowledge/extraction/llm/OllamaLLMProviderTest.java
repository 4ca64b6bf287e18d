package com.knowledge.extraction.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for OllamaLLMProvider.
 *
 * Note: Integration tests require Ollama to be running locally with llama3.2 model.
 */
class OllamaLLMProviderTest {

    private static final GenerationOptions OPTIONS = new GenerationOptions(0.1, 256, Duration.ofSeconds(5));

    @Nested
    @DisplayName("Unit Tests (no Ollama required)")
    class UnitTests {

        private HttpClient httpClient;
        private HttpResponse<String> response;
        private OllamaLLMProvider provider;

        @BeforeEach
        @SuppressWarnings("unchecked")
        void setUp() {
            httpClient = mock(HttpClient.class);
            response = mock(HttpResponse.class);
            provider = OllamaLLMProvider.builder()
                    .baseUrl("http://ollama:11434")
                    .httpClient(httpClient)
                    .build();
        }

        @Test
        @DisplayName("Provider name is Ollama")
        void providerName() {
            assertEquals("Ollama", provider.getProviderName());
        }

        @Test
        @DisplayName("Successful generation returns text and token counts")
        void generate() throws Exception {
            when(response.statusCode()).thenReturn(200);
            when(response.body()).thenReturn("""
                    {"model": "llama3.2", "response": "[]", "done": true,
                     "prompt_eval_count": 12, "eval_count": 3, "total_duration": 1000}
                    """);
            doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

            LLMResponse result = provider.generate("llama3.2", "prompt", OPTIONS);

            assertEquals("[]", result.text());
            assertEquals(12, result.inputTokens());
            assertEquals(3, result.outputTokens());
        }

        @Test
        @DisplayName("Request goes to the generate endpoint with the call timeout")
        void requestShape() throws Exception {
            when(response.statusCode()).thenReturn(200);
            when(response.body()).thenReturn("{\"response\": \"ok\"}");
            doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

            provider.generate("llama3.2", "prompt", OPTIONS);

            verify(httpClient).send(argThat(request ->
                    request.uri().toString().equals("http://ollama:11434/api/generate")
                            && request.timeout().orElseThrow().equals(Duration.ofSeconds(5))), any());
        }

        @Test
        @DisplayName("HTTP timeout becomes LLMTimeoutException")
        void timeout() throws Exception {
            doThrow(new HttpTimeoutException("request timed out")).when(httpClient).send(any(HttpRequest.class), any());

            assertThrows(LLMTimeoutException.class, () -> provider.generate("llama3.2", "prompt", OPTIONS));
        }

        @Test
        @DisplayName("I/O errors and non-200 status become LLMTransportException")
        void transportErrors() throws Exception {
            doThrow(new IOException("connection refused")).when(httpClient).send(any(HttpRequest.class), any());
            assertThrows(LLMTransportException.class, () -> provider.generate("llama3.2", "prompt", OPTIONS));

            reset(httpClient);
            when(response.statusCode()).thenReturn(500);
            when(response.body()).thenReturn("model not found");
            doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
            assertThrows(LLMTransportException.class, () -> provider.generate("llama3.2", "prompt", OPTIONS));
        }

        @Test
        @DisplayName("Unavailable server is reported as unavailable")
        void unavailable() throws Exception {
            doThrow(new IOException("connection refused")).when(httpClient).send(any(HttpRequest.class), any());

            assertFalse(provider.isAvailable());
        }
    }

    @Nested
    @DisplayName("Integration Tests (requires Ollama)")
    @EnabledIf("com.knowledge.extraction.llm.OllamaLLMProviderTest#isOllamaAvailable")
    class IntegrationTests {

        @Test
        @DisplayName("Local model answers an entity prompt")
        void answersPrompt() throws LLMException {
            LLMResponse response = OllamaLLMProvider.createDefault().generate("llama3.2",
                    "Return ONLY a JSON array with one object {\"name\": \"Paris\"}.",
                    new GenerationOptions(0.0, 128, Duration.ofSeconds(60)));

            assertFalse(response.text().isBlank());
        }
    }

    static boolean isOllamaAvailable() {
        return OllamaLLMProvider.createDefault().isAvailable();
    }
}

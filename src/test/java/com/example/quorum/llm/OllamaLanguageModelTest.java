package com.example.quorum.llm;

import com.example.quorum.agent.AgentTimeoutException;
import com.example.quorum.agent.AgentUnavailableException;
import com.example.quorum.model.JsonCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OllamaLanguageModel functionality.
 */
@ExtendWith(MockitoExtension.class)
class OllamaLanguageModelTest {

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private OllamaLanguageModel model;

    @BeforeEach
    void setUp() {
        model = new OllamaLanguageModel(httpClient, "http://ollama:11434/", "llama3:8b", "nomic-embed-text",
            Duration.ofSeconds(5));
    }

    private void respond(int status, String body) throws Exception {
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
            .thenReturn(response);
        when(response.statusCode()).thenReturn(status);
        lenient().when(response.body()).thenReturn(body);
    }

    @Nested
    @DisplayName("Chat completion")
    class ChatCompletion {

        @Test
        @DisplayName("Should post to the chat endpoint and return the message content")
        void shouldGenerate() throws Exception {
            respond(200, "{\"model\":\"llama3:8b\",\"message\":{\"role\":\"assistant\",\"content\":\"Paris\"},\"done\":true}");

            String answer = model.generate("You are terse.", "Capital of France?");

            assertEquals("Paris", answer);
            ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
            verify(httpClient).send(request.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
            assertEquals(URI.create("http://ollama:11434/api/chat"), request.getValue().uri());
            assertEquals("POST", request.getValue().method());
            assertEquals(Optional.of(Duration.ofSeconds(5)), request.getValue().timeout());
        }

        @Test
        @DisplayName("Should map non-2xx responses to unavailable")
        void shouldRejectErrorStatus() throws Exception {
            respond(500, "model not loaded");

            AgentUnavailableException exception = assertThrows(AgentUnavailableException.class,
                () -> model.generate(null, "hi"));
            assertTrue(exception.getMessage().contains("HTTP 500"));
            assertEquals("ollama:llama3:8b", exception.getAgentId());
        }

        @Test
        @DisplayName("Should map request timeouts to agent timeouts")
        void shouldMapTimeout() throws Exception {
            when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenThrow(new HttpTimeoutException("request timed out"));

            AgentTimeoutException exception = assertThrows(AgentTimeoutException.class,
                () -> model.generate(null, "hi"));
            assertEquals(Duration.ofSeconds(5), exception.getTimeout());
        }

        @Test
        @DisplayName("Should map transport failures to unavailable")
        void shouldMapTransportFailure() throws Exception {
            when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenThrow(new IOException("connection refused"));

            AgentUnavailableException exception = assertThrows(AgentUnavailableException.class,
                () -> model.generate(null, "hi"));
            assertTrue(exception.getMessage().contains("connection refused"));
        }

        @Test
        @DisplayName("Should reject malformed bodies")
        void shouldRejectMalformedBody() throws Exception {
            respond(200, "<html>");

            assertThrows(AgentUnavailableException.class, () -> model.generate(null, "hi"));
        }
    }

    @Nested
    @DisplayName("Embeddings")
    class Embeddings {

        @Test
        @DisplayName("Should return the embedding vector")
        void shouldEmbed() throws Exception {
            respond(200, "{\"embedding\":[0.25,-0.5,1]}");

            assertArrayEquals(new double[]{0.25, -0.5, 1.0}, model.embed("hello"));
        }

        @Test
        @DisplayName("Should reject responses without a vector")
        void shouldRejectEmptyVector() throws Exception {
            assertThrows(AgentUnavailableException.class, () -> OllamaLanguageModel.parseEmbedding(
                JsonCodec.getObjectMapper().readTree("{\"embedding\":[]}"), "ollama:test"));
            assertThrows(AgentUnavailableException.class, () -> OllamaLanguageModel.parseChatContent(
                JsonCodec.getObjectMapper().readTree("{\"message\":{}}"), "ollama:test"));
        }
    }
}

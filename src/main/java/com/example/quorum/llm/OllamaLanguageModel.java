package com.example.quorum.llm;

import com.example.quorum.agent.AgentTimeoutException;
import com.example.quorum.agent.AgentUnavailableException;
import com.example.quorum.agent.Embedder;
import com.example.quorum.agent.LanguageModel;
import com.example.quorum.model.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
 * {@link LanguageModel} and {@link Embedder} backed by an Ollama-compatible HTTP API.
 */
public class OllamaLanguageModel implements LanguageModel, Embedder {

    private static final Logger logger = LoggerFactory.getLogger(OllamaLanguageModel.class);

    public static final String DEFAULT_BASE_URL = "http://localhost:11434";
    public static final String DEFAULT_MODEL = "llama3:8b";
    public static final String DEFAULT_EMBEDDING_MODEL = "nomic-embed-text";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private static final String CHAT_PATH = "/api/chat";
    private static final String EMBEDDINGS_PATH = "/api/embeddings";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = JsonCodec.getObjectMapper();
    private final String baseUrl;
    private final String model;
    private final String embeddingModel;
    private final Duration timeout;

    public OllamaLanguageModel() {
        this(DEFAULT_BASE_URL, DEFAULT_MODEL, DEFAULT_EMBEDDING_MODEL, DEFAULT_TIMEOUT);
    }

    public OllamaLanguageModel(String baseUrl, String model, String embeddingModel, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
             baseUrl, model, embeddingModel, timeout);
    }

    public OllamaLanguageModel(HttpClient httpClient, String baseUrl, String model, String embeddingModel,
                               Duration timeout) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.embeddingModel = embeddingModel;
        this.timeout = timeout;
    }

    @Override
    public String generate(String systemPrompt, String prompt) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("stream", false);
        ArrayNode messages = body.putArray("messages");
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.addObject().put("role", "system").put("content", systemPrompt);
        }
        messages.addObject().put("role", "user").put("content", prompt);

        JsonNode response = post(CHAT_PATH, body, model);
        return parseChatContent(response, sourceId(model));
    }

    @Override
    public double[] embed(String text) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", embeddingModel);
        body.put("prompt", text);

        JsonNode response = post(EMBEDDINGS_PATH, body, embeddingModel);
        return parseEmbedding(response, sourceId(embeddingModel));
    }

    public String getModel() {
        return model;
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    private JsonNode post(String path, ObjectNode body, String modelName) {
        String source = sourceId(modelName);
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();
        } catch (JsonProcessingException e) {
            throw new AgentUnavailableException(source, "Failed to encode request for " + path, e);
        }

        long start = System.nanoTime();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new AgentTimeoutException(source, timeout, e);
        } catch (IOException e) {
            throw new AgentUnavailableException(source, "Request to " + baseUrl + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentUnavailableException(source, "Interrupted while calling " + baseUrl + path, e);
        }
        logger.debug("{} {} answered {} in {} ms", modelName, path, response.statusCode(),
                     (System.nanoTime() - start) / 1_000_000);

        if (response.statusCode() / 100 != 2) {
            throw new AgentUnavailableException(source,
                "HTTP " + response.statusCode() + " from " + baseUrl + path + ": " + abbreviate(response.body()));
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new AgentUnavailableException(source, "Malformed response from " + baseUrl + path, e);
        }
    }

    static String parseChatContent(JsonNode response, String source) {
        JsonNode content = response.path("message").path("content");
        if (!content.isTextual()) {
            throw new AgentUnavailableException(source, "Chat response carries no message content");
        }
        return content.asText();
    }

    static double[] parseEmbedding(JsonNode response, String source) {
        JsonNode embedding = response.path("embedding");
        if (!embedding.isArray() || embedding.isEmpty()) {
            throw new AgentUnavailableException(source, "Embedding response carries no vector");
        }
        double[] vector = new double[embedding.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = embedding.get(i).asDouble();
        }
        return vector;
    }

    private static String sourceId(String modelName) {
        return "ollama:" + modelName;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}

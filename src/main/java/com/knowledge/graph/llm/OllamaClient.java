package com.knowledge.graph.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Minimal HTTP client for a local Ollama server ({@code /api/generate},
 * {@code /api/embeddings}, {@code /api/tags}).
 */
public class OllamaClient {
    private static final Logger log = LoggerFactory.getLogger(OllamaClient.class);

    public static final String DEFAULT_BASE_URL = "http://localhost:11434";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OllamaClient(String baseUrl, Duration timeout) {
        this.baseUrl = baseUrl != null ? baseUrl : DEFAULT_BASE_URL;
        this.timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(this.timeout)
                .build();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Runs a non-streaming completion and returns the generated text.
     */
    public String generate(String model, String prompt) throws IOException, InterruptedException {
        String body = objectMapper.writeValueAsString(new GenerateRequest(model, prompt, false));
        String response = post("/api/generate", body);
        return objectMapper.readValue(response, GenerateResponse.class).response();
    }

    public float[] embed(String model, String text) throws IOException, InterruptedException {
        String body = objectMapper.writeValueAsString(new EmbeddingRequest(model, text));
        String response = post("/api/embeddings", body);
        List<Double> values = objectMapper.readValue(response, EmbeddingResponse.class).embedding();
        if (values == null) {
            return new float[0];
        }
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i).floatValue();
        }
        return vector;
    }

    public boolean isAvailable() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/tags"))
                    .timeout(Duration.ofSeconds(5))
                    .GET()
                    .build();
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString()).statusCode() == 200;
        } catch (IOException e) {
            log.debug("Ollama not available: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String post(String path, String body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("Ollama returned status " + response.statusCode() + " for " + path
                    + ": " + response.body());
        }
        return response.body();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record GenerateRequest(String model, String prompt, boolean stream) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record GenerateResponse(
            String model,
            @JsonProperty("created_at") String createdAt,
            String response,
            boolean done
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbeddingRequest(String model, String prompt) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbeddingResponse(List<Double> embedding) {
    }
}

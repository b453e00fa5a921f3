package com.survey.codeframe.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.survey.codeframe.config.OpenAIProperties;
import com.survey.codeframe.exception.EmbeddingServiceException;
import com.survey.codeframe.exception.RateLimitExceededException;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * OpenAI /embeddings client. Each call is one provider request; transport errors and
 * rate-limit denials are retried with backoff.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OpenAIEmbeddingClient implements EmbeddingClient {

    private static final String PROVIDER = "openai";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final OpenAIProperties properties;
    private final RateLimiterService rateLimiter;
    private final Retry openAIRetry;

    @Override
    public int maxBatchSize() {
        return Math.max(1, properties.getEmbeddingBatchSize());
    }

    @Override
    public EmbeddingBatch embed(List<String> texts, String model) {
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            throw new EmbeddingServiceException("OpenAI API key not configured");
        }

        String body;
        try {
            body = openAIRetry.executeSupplier(() -> {
                if (!rateLimiter.allowRequest(PROVIDER)) {
                    throw new RateLimitExceededException(PROVIDER);
                }
                return post(texts, model);
            });
        } catch (RateLimitExceededException e) {
            throw new EmbeddingServiceException("OpenAI rate limit reached while embedding answers", e);
        } catch (RestClientException e) {
            throw new EmbeddingServiceException("Embedding service unavailable: " + e.getMessage(), e);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new EmbeddingServiceException("Unreadable embedding response", e);
        }
        int tokens = root.path("usage").path("prompt_tokens").asInt(0);
        List<float[]> vectors = parseVectors(root, texts.size());

        log.debug("Embedded {} texts with {} ({} tokens)", texts.size(), model, tokens);
        return new EmbeddingBatch(vectors, tokens);
    }

    private String post(List<String> input, String model) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(properties.getApiKey());

        Map<String, Object> body = Map.of("model", model, "input", input);

        ResponseEntity<String> response = restTemplate.postForEntity(
                properties.getBaseUrl() + "/embeddings", new HttpEntity<>(body, headers), String.class);
        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new EmbeddingServiceException("Embedding request failed: " + response.getStatusCode());
        }
        return response.getBody();
    }

    private List<float[]> parseVectors(JsonNode root, int expected) {
        JsonNode data = root.path("data");
        if (!data.isArray() || data.size() != expected) {
            throw new EmbeddingServiceException("Expected " + expected + " embeddings, got " + data.size());
        }

        float[][] ordered = new float[expected][];
        for (JsonNode item : data) {
            int index = item.path("index").asInt(-1);
            JsonNode values = item.path("embedding");
            if (index < 0 || index >= expected || !values.isArray()) {
                throw new EmbeddingServiceException("Malformed embedding item at index " + index);
            }
            float[] vector = new float[values.size()];
            for (int i = 0; i < values.size(); i++) {
                vector[i] = (float) values.get(i).asDouble();
            }
            ordered[index] = vector;
        }
        for (int i = 0; i < expected; i++) {
            if (ordered[i] == null) {
                throw new EmbeddingServiceException("Missing embedding for input " + i);
            }
        }
        return List.of(ordered);
    }
}

package com.survey.codeframe.service;

import java.util.List;

/**
 * Text embedding provider.
 */
public interface EmbeddingClient {

    /**
     * Embeds the texts in one provider request. Vectors are returned in input order.
     * Callers keep each request within {@link #maxBatchSize()} texts.
     *
     * @throws com.survey.codeframe.exception.EmbeddingServiceException if the provider is unavailable
     */
    EmbeddingBatch embed(List<String> texts, String model);

    /**
     * Most texts one request may carry; zero or less means no limit.
     */
    int maxBatchSize();

    record EmbeddingBatch(List<float[]> vectors, int promptTokens) {}
}

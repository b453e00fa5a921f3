package com.survey.codeframe.service;

import java.util.UUID;

/**
 * Attribution attached to every ledger entry.
 */
public record UsageContext(UUID generationId, Long categoryId, Long answerId) {

    public static UsageContext forGeneration(UUID generationId, Long categoryId) {
        return new UsageContext(generationId, categoryId, null);
    }

    public UsageContext withAnswer(Long answerId) {
        return new UsageContext(generationId, categoryId, answerId);
    }
}

package com.survey.codeframe.brand;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of running one tier, persisted per tier inside validation_evidence.
 */
public record TierResult(
        @JsonIgnore EvidenceTier tier,
        TierStatus status,
        TierEvidence evidence,
        String error,
        @JsonProperty("elapsed_ms") long elapsedMs,
        int attempts
) {

    public static TierResult ok(TierEvidence evidence, long elapsedMs, int attempts) {
        return new TierResult(evidence.tier(), TierStatus.OK, evidence, null, elapsedMs, attempts);
    }

    public static TierResult insufficientData(EvidenceTier tier, String error, long elapsedMs, int attempts) {
        return new TierResult(tier, TierStatus.INSUFFICIENT_DATA, null, error, elapsedMs, attempts);
    }

    public static TierResult skipped(EvidenceTier tier, String reason) {
        return new TierResult(tier, TierStatus.SKIPPED, null, reason, 0L, 0);
    }

    public boolean attempted() {
        return status != TierStatus.SKIPPED;
    }
}

package com.survey.codeframe.brand;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Search results for the candidate and how many of them mention it (or one of its variants).
 */
public record WebSearchEvidence(
        String query,
        @JsonProperty("total_results") int totalResults,
        @JsonProperty("matching_results") int matchingResults,
        List<WebSearchHit> hits
) implements TierEvidence {

    @Override
    public EvidenceTier tier() {
        return EvidenceTier.WEB_SEARCH;
    }

    public double mentionRate() {
        return totalResults == 0 ? 0.0 : (double) matchingResults / totalResults;
    }

    @Override
    public double positive() {
        return mentionRate();
    }

    @Override
    public double negative() {
        return 0.0;
    }

    @Override
    public String summary() {
        return String.format("%d/%d web results mention the name", matchingResults, totalResults);
    }
}

package com.survey.codeframe.brand;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cross-language check: a brand name survives translation unchanged, a common word does not.
 */
public record TranslationEvidence(
        @JsonProperty("source_language") String sourceLanguage,
        @JsonProperty("target_language") String targetLanguage,
        String original,
        String translated
) implements TierEvidence {

    @Override
    public EvidenceTier tier() {
        return EvidenceTier.TRANSLATION;
    }

    public boolean nameStable() {
        return normalize(original).equals(normalize(translated));
    }

    @Override
    public double positive() {
        return nameStable() ? 1.0 : 0.0;
    }

    @Override
    public double negative() {
        return nameStable() ? 0.0 : 0.5;
    }

    @Override
    public String summary() {
        return nameStable()
                ? "name is unchanged by translation"
                : String.format("name translates to '%s', may be a common word", translated);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase();
    }
}

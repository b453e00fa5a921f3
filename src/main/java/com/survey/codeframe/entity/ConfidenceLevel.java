package com.survey.codeframe.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Three-valued scale used for both label confidence and frequency estimates.
 */
public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    /**
     * Strict parse: only "high", "medium" or "low" (case and surrounding whitespace ignored).
     */
    public static Optional<ConfidenceLevel> fromLabel(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase()) {
            case "high" -> Optional.of(HIGH);
            case "medium" -> Optional.of(MEDIUM);
            case "low" -> Optional.of(LOW);
            default -> Optional.empty();
        };
    }
}

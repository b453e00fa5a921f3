package com.survey.codeframe.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Generation lifecycle: processing → {completed, failed}, completed → applied.
 */
public enum GenerationStatus {
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    APPLIED("applied");

    private final String value;

    GenerationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Set<GenerationStatus> allowedNext() {
        return switch (this) {
            case PROCESSING -> EnumSet.of(COMPLETED, FAILED);
            case COMPLETED -> EnumSet.of(APPLIED);
            case FAILED, APPLIED -> EnumSet.noneOf(GenerationStatus.class);
        };
    }

    public boolean canTransitionTo(GenerationStatus next) {
        return allowedNext().contains(next);
    }
}

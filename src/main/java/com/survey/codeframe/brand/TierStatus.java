package com.survey.codeframe.brand;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TierStatus {
    OK,
    // attempted but failed or timed out after retries; counts towards the confidence denominator
    INSUFFICIENT_DATA,
    // not attempted (optional tier disabled or not applicable); excluded from fusion
    SKIPPED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}

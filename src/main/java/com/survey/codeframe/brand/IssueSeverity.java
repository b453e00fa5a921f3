package com.survey.codeframe.brand;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueSeverity {
    ERROR,
    WARNING,
    OK;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}

package com.survey.codeframe.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}

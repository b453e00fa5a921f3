package com.survey.codeframe.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CodingType {
    OPEN_ENDED("open-ended"),
    BRAND("brand"),
    SENTIMENT("sentiment");

    private final String value;

    CodingType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static CodingType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return OPEN_ENDED;
        }
        for (CodingType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim()) || type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown coding type: " + value);
    }
}

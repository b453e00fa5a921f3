package com.survey.codeframe.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

public record GenerationStartResponse(
        @JsonProperty("generation_id") UUID generationId,
        String status
) {}

package com.survey.codeframe.brand;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record KnowledgeGraphEntity(
        String name,
        List<String> types,
        String description,
        @JsonProperty("detailed_description") String detailedDescription,
        @JsonProperty("result_score") double resultScore
) {
}

package com.survey.codeframe.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationRequest {

    @NotNull
    @JsonProperty("category_id")
    private Long categoryId;

    // "open-ended", "brand" or "sentiment"; defaults to open-ended
    @JsonProperty("coding_type")
    private String codingType;

    // Optional subset of the category's answers
    @JsonProperty("answer_ids")
    private List<Long> answerIds;

    @JsonProperty("algorithm_config")
    private Map<String, Object> algorithmConfig;

    // google_cse_api_key / google_cse_cx_id; never persisted
    @JsonProperty("api_keys")
    private Map<String, String> apiKeys;

    @JsonProperty("created_by")
    private String createdBy;
}

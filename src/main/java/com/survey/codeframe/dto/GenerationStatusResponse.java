package com.survey.codeframe.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Snapshot returned by the status endpoint; {@code result} only once completed, {@code error} only once failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerationStatusResponse {

    @JsonProperty("generation_id")
    private UUID generationId;

    private String status;

    @JsonProperty("progress_percent")
    private int progressPercent;

    @JsonProperty("current_step")
    private String currentStep;

    private Result result;

    private Error error;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Result {
        @JsonProperty("n_clusters")
        private Integer clusterCount;
        @JsonProperty("n_themes")
        private Integer themeCount;
        @JsonProperty("n_codes")
        private Integer codeCount;
        @JsonProperty("n_noise")
        private Integer noiseCount;
        @JsonProperty("mece_score")
        private Double meceScore;
        @JsonRawValue
        @JsonProperty("mece_warnings")
        private String meceWarnings;
        @JsonProperty("ai_model")
        private String aiModel;
        @JsonProperty("ai_input_tokens")
        private Integer aiInputTokens;
        @JsonProperty("ai_output_tokens")
        private Integer aiOutputTokens;
        @JsonProperty("ai_cost_usd")
        private BigDecimal aiCostUsd;
        @JsonProperty("processing_time_ms")
        private Long processingTimeMs;
        private HierarchyNodeView hierarchy;
    }

    public record Error(String kind, String message) {}
}

package com.survey.codeframe.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Outcome of applying a generation to the production codes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplySummary {

    @JsonProperty("generation_id")
    private UUID generationId;

    @JsonProperty("codes_created")
    private int codesCreated;

    @JsonProperty("codes_linked")
    private int codesLinked;

    // rejected brand nodes
    @JsonProperty("nodes_skipped")
    private int nodesSkipped;

    @JsonProperty("answer_codes_created")
    private int answerCodesCreated;

    @JsonProperty("applied_by")
    private String appliedBy;
}

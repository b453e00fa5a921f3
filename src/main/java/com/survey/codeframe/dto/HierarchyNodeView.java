package com.survey.codeframe.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.survey.codeframe.entity.HierarchyNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Tree view of a hierarchy node for the status endpoint. Embeddings and member lists are left out.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HierarchyNodeView {

    private UUID id;
    private String name;
    private String description;
    private int level;

    @JsonProperty("node_type")
    private String nodeType;

    @JsonProperty("cluster_size")
    private Integer clusterSize;

    private String confidence;

    @JsonProperty("frequency_estimate")
    private String frequencyEstimate;

    @JsonProperty("display_order")
    private Integer displayOrder;

    @JsonProperty("is_edited")
    private Boolean edited;

    @JsonProperty("code_id")
    private Long codeId;

    @JsonRawValue
    @JsonProperty("example_texts")
    private String exampleTexts;

    // brand validation
    @JsonProperty("brand_confidence")
    private Integer brandConfidence;

    @JsonRawValue
    @JsonProperty("validation_issues")
    private String validationIssues;

    @JsonRawValue
    @JsonProperty("validation_evidence")
    private String validationEvidence;

    @JsonProperty("validation_reasoning")
    private String validationReasoning;

    private String recommendation;

    @JsonProperty("suggested_codes")
    private List<String> suggestedCodes;

    private List<String> variants;

    @JsonProperty("approval_status")
    private String approvalStatus;

    @Builder.Default
    private List<HierarchyNodeView> children = new ArrayList<>();

    public static HierarchyNodeView from(HierarchyNode node) {
        return HierarchyNodeView.builder()
                .id(node.getId())
                .name(node.getName())
                .description(node.getDescription())
                .level(node.getLevel())
                .nodeType(node.getNodeType().getValue())
                .clusterSize(node.getClusterSize())
                .confidence(node.getConfidence() != null ? node.getConfidence().getValue() : null)
                .frequencyEstimate(node.getFrequencyEstimate() != null ? node.getFrequencyEstimate().getValue() : null)
                .displayOrder(node.getDisplayOrder())
                .edited(node.getEdited())
                .codeId(node.getCodeId())
                .exampleTexts(node.getExampleTexts())
                .brandConfidence(node.getBrandConfidence())
                .validationIssues(node.getValidationIssues())
                .validationEvidence(node.getValidationEvidence())
                .validationReasoning(node.getValidationReasoning())
                .recommendation(node.getRecommendation())
                .suggestedCodes(node.getApprovalStatus() != null ? node.getSuggestedCodes() : null)
                .variants(node.getVariants() != null && !node.getVariants().isEmpty() ? node.getVariants() : null)
                .approvalStatus(node.getApprovalStatus() != null ? node.getApprovalStatus().getValue() : null)
                .build();
    }
}

package com.survey.codeframe.entity;

import io.hypersistence.utils.hibernate.type.array.FloatArrayType;
import io.hypersistence.utils.hibernate.type.json.JsonBinaryType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Type;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One node of a generated codeframe, stored as a flat row (parent_id + level).
 * Brand nodes additionally carry the validation evidence and the review outcome.
 */
@Entity
@Table(name = "codeframe_hierarchy")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HierarchyNode {

    @Id
    private UUID id;

    @Column(name = "generation_id", nullable = false)
    private UUID generationId;

    @Column(name = "parent_id")
    private UUID parentId;

    @Column(nullable = false)
    private Integer level;

    @Enumerated(EnumType.STRING)
    @Column(name = "node_type", nullable = false, length = 20)
    private NodeType nodeType;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    // Production code, set when the generation is applied
    @Column(name = "code_id")
    private Long codeId;

    @Column(name = "cluster_id")
    private Integer clusterId;

    @Column(name = "cluster_size")
    private Integer clusterSize;

    @Type(JsonBinaryType.class)
    @Column(name = "representative_answer_ids", columnDefinition = "jsonb")
    @Builder.Default
    private List<Long> representativeAnswerIds = new ArrayList<>();

    @Type(JsonBinaryType.class)
    @Column(name = "member_answer_ids", columnDefinition = "jsonb")
    @Builder.Default
    private List<Long> memberAnswerIds = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private ConfidenceLevel confidence;

    @Enumerated(EnumType.STRING)
    @Column(name = "frequency_estimate", length = 10)
    private ConfidenceLevel frequencyEstimate;

    @Type(FloatArrayType.class)
    @Column(columnDefinition = "float4[]")
    private float[] embedding;

    @Column(name = "display_order", nullable = false)
    @Builder.Default
    private Integer displayOrder = 0;

    @Column(name = "is_auto_generated", nullable = false)
    @Builder.Default
    private Boolean autoGenerated = true;

    @Column(name = "is_edited", nullable = false)
    @Builder.Default
    private Boolean edited = false;

    @Type(JsonBinaryType.class)
    @Column(name = "edit_history", columnDefinition = "jsonb")
    @Builder.Default
    private String editHistory = "[]";

    // Format: [{"id": "12", "text": "example quote"}, ...]
    @Type(JsonBinaryType.class)
    @Column(name = "example_texts", columnDefinition = "jsonb")
    private String exampleTexts;

    // Brand validation
    @Type(JsonBinaryType.class)
    @Column(name = "validation_evidence", columnDefinition = "jsonb")
    private String validationEvidence;

    @Type(JsonBinaryType.class)
    @Column(name = "validation_issues", columnDefinition = "jsonb")
    private String validationIssues;

    @Column(name = "brand_confidence")
    private Integer brandConfidence;

    @Column(name = "validation_reasoning", columnDefinition = "TEXT")
    private String validationReasoning;

    @Column(length = 20)
    private String recommendation;

    @Type(JsonBinaryType.class)
    @Column(name = "suggested_codes", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> suggestedCodes = new ArrayList<>();

    @Type(JsonBinaryType.class)
    @Column(columnDefinition = "jsonb")
    @Builder.Default
    private List<String> variants = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "approval_status", length = 20)
    private ApprovalStatus approvalStatus;

    @Column(name = "approved_by")
    private String approvedBy;

    @Column(name = "approved_at")
    private LocalDateTime approvedAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isRoot() {
        return parentId == null;
    }

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}

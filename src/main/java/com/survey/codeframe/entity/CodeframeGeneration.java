package com.survey.codeframe.entity;

import com.survey.codeframe.exception.ErrorKind;
import io.hypersistence.utils.hibernate.type.json.JsonBinaryType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Type;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One taxonomy-building job. Mutated only by the generation orchestrator.
 */
@Entity
@Table(name = "codeframe_generations")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CodeframeGeneration {

    @Id
    private UUID id;

    @Column(name = "category_id", nullable = false)
    private Long categoryId;

    @Enumerated(EnumType.STRING)
    @Column(name = "coding_type", nullable = false, length = 20)
    @Builder.Default
    private CodingType codingType = CodingType.OPEN_ENDED;

    @Type(JsonBinaryType.class)
    @Column(name = "answer_ids", columnDefinition = "jsonb", nullable = false)
    @Builder.Default
    private List<Long> answerIds = new ArrayList<>();

    @Column(name = "n_answers")
    private Integer answerCount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private GenerationStatus status = GenerationStatus.PROCESSING;

    @Column(name = "progress_percent", nullable = false)
    @Builder.Default
    private Integer progressPercent = 0;

    @Column(name = "current_step", length = 50)
    private String currentStep;

    @Column(name = "n_clusters")
    private Integer clusterCount;

    @Column(name = "n_themes")
    private Integer themeCount;

    @Column(name = "n_codes")
    private Integer codeCount;

    @Column(name = "n_noise")
    private Integer noiseCount;

    @Column(name = "mece_score")
    private Double meceScore;

    @Type(JsonBinaryType.class)
    @Column(name = "mece_warnings", columnDefinition = "jsonb")
    private String meceWarnings;

    @Type(JsonBinaryType.class)
    @Column(name = "algorithm_config", columnDefinition = "jsonb", nullable = false)
    @Builder.Default
    private String algorithmConfig = "{}";

    // AI usage totals, summed from the usage ledger on completion
    @Column(name = "ai_model", length = 100)
    private String aiModel;

    @Column(name = "ai_input_tokens")
    private Integer aiInputTokens;

    @Column(name = "ai_output_tokens")
    private Integer aiOutputTokens;

    @Column(name = "ai_cost_usd", precision = 10, scale = 6)
    private BigDecimal aiCostUsd;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind", length = 40)
    private ErrorKind errorKind;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "processing_time_ms")
    private Long processingTimeMs;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "applied_at")
    private LocalDateTime appliedAt;

    @Column(name = "applied_by")
    private String appliedBy;

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

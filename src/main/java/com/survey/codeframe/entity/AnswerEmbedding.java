package com.survey.codeframe.entity;

import io.hypersistence.utils.hibernate.type.array.FloatArrayType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Type;

import java.time.LocalDateTime;

/**
 * Cached embedding of one answer text for one model.
 * text_hash is the SHA-256 of the source text; a different hash invalidates the row.
 */
@Entity
@Table(name = "answer_embeddings")
@IdClass(AnswerEmbeddingId.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnswerEmbedding {

    @Id
    @Column(name = "answer_id")
    private Long answerId;

    @Id
    @Column(name = "embedding_model", length = 100)
    private String embeddingModel;

    @Type(FloatArrayType.class)
    @Column(nullable = false, columnDefinition = "float4[]")
    private float[] embedding;

    @Column(name = "text_hash", nullable = false, length = 64)
    private String textHash;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}

package com.survey.codeframe.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "answer_codes",
        uniqueConstraints = @UniqueConstraint(columnNames = {"answer_id", "code_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnswerCode {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "answer_id", nullable = false)
    private Long answerId;

    @Column(name = "code_id", nullable = false)
    private Long codeId;

    @Column(name = "generation_id")
    private UUID generationId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}

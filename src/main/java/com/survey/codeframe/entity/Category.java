package com.survey.codeframe.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Survey category (question) owned by the survey application; read by the engine.
 */
@Entity
@Table(name = "categories")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Category {

    @Id
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    // Vision model used by the brand image tier; falls back to the configured default
    @Column(name = "vision_model", length = 100)
    private String visionModel;

    // Language the answers are written in (ISO 639-1), used by the translation tier
    @Column(name = "language", length = 10)
    private String language;
}

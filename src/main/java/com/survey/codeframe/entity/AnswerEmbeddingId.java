package com.survey.codeframe.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnswerEmbeddingId implements Serializable {
    private Long answerId;
    private String embeddingModel;
}

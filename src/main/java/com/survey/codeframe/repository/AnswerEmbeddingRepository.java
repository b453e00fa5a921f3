package com.survey.codeframe.repository;

import com.survey.codeframe.entity.AnswerEmbedding;
import com.survey.codeframe.entity.AnswerEmbeddingId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface AnswerEmbeddingRepository extends JpaRepository<AnswerEmbedding, AnswerEmbeddingId> {

    List<AnswerEmbedding> findByAnswerIdInAndEmbeddingModel(Collection<Long> answerIds, String embeddingModel);
}

package com.survey.codeframe.repository;

import com.survey.codeframe.entity.Answer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface AnswerRepository extends JpaRepository<Answer, Long> {

    List<Answer> findByCategoryIdOrderByIdAsc(Long categoryId);

    List<Answer> findByCategoryIdAndIdInOrderByIdAsc(Long categoryId, Collection<Long> ids);
}

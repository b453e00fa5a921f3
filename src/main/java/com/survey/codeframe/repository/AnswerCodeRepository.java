package com.survey.codeframe.repository;

import com.survey.codeframe.entity.AnswerCode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AnswerCodeRepository extends JpaRepository<AnswerCode, Long> {

    boolean existsByAnswerIdAndCodeId(Long answerId, Long codeId);
}

package com.survey.codeframe.repository;

import com.survey.codeframe.entity.Code;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CodeRepository extends JpaRepository<Code, Long> {

    Optional<Code> findFirstByCategoryIdAndNameIgnoreCase(Long categoryId, String name);
}

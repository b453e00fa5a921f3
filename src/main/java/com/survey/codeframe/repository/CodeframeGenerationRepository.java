package com.survey.codeframe.repository;

import com.survey.codeframe.entity.CodeframeGeneration;
import com.survey.codeframe.entity.GenerationStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CodeframeGenerationRepository extends JpaRepository<CodeframeGeneration, UUID> {

    boolean existsByCategoryIdAndStatus(Long categoryId, GenerationStatus status);

    List<CodeframeGeneration> findByCategoryIdOrderByCreatedAtDesc(Long categoryId);

    /**
     * Row-locks the generation for the duration of the surrounding transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM CodeframeGeneration g WHERE g.id = :id")
    Optional<CodeframeGeneration> findWithLockById(@Param("id") UUID id);
}

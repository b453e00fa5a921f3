package com.survey.codeframe.repository;

import com.survey.codeframe.entity.ApprovalStatus;
import com.survey.codeframe.entity.HierarchyNode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface HierarchyNodeRepository extends JpaRepository<HierarchyNode, UUID> {

    List<HierarchyNode> findByGenerationIdOrderByLevelAscDisplayOrderAsc(UUID generationId);

    List<HierarchyNode> findByGenerationIdAndLevel(UUID generationId, Integer level);

    List<HierarchyNode> findByGenerationIdAndApprovalStatus(UUID generationId, ApprovalStatus status);
}

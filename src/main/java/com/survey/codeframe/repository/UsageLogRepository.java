package com.survey.codeframe.repository;

import com.survey.codeframe.entity.UsageLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface UsageLogRepository extends JpaRepository<UsageLogEntry, UUID> {

    List<UsageLogEntry> findByGenerationIdOrderByCreatedAtAsc(UUID generationId);

    /**
     * Daily cost rollup grouped by feature and model.
     */
    @Query(value = """
            SELECT feature_type AS featureType,
                   model AS model,
                   CAST(created_at AS DATE) AS day,
                   COUNT(*) AS calls,
                   COALESCE(SUM(input_tokens), 0) AS inputTokens,
                   COALESCE(SUM(output_tokens), 0) AS outputTokens,
                   COALESCE(SUM(cost_usd), 0) AS costUsd
            FROM ai_usage_logs
            WHERE created_at >= :from AND created_at < :to
            GROUP BY feature_type, model, CAST(created_at AS DATE)
            ORDER BY day, feature_type, model
            """, nativeQuery = true)
    List<UsageSummaryRow> summarize(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);

    interface UsageSummaryRow {
        String getFeatureType();
        String getModel();
        LocalDate getDay();
        Long getCalls();
        Long getInputTokens();
        Long getOutputTokens();
        BigDecimal getCostUsd();
    }
}

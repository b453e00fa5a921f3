package com.survey.codeframe.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.survey.codeframe.config.AlgorithmConfig;
import com.survey.codeframe.entity.HierarchyNode;
import com.survey.codeframe.util.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Scores a built hierarchy for exhaustiveness (every answer close to some code) and
 * exclusivity (no two codes nearly identical). Pure computation over embeddings; the
 * result only annotates the generation and never fails it. Pairs above the overlap
 * threshold count against the score; pairs between the warning and overlap thresholds
 * are only reported.
 */
@Service
@Slf4j
public class MeceValidatorService {

    private static final double COVERAGE_WEIGHT = 0.6;
    private static final double EXCLUSIVITY_WEIGHT = 0.4;

    public MeceReport validate(Map<Long, float[]> answerEmbeddings, List<HierarchyNode> codeNodes,
                               AlgorithmConfig config) {
        List<HierarchyNode> codes = codeNodes.stream()
                .filter(n -> n.getEmbedding() != null)
                .sorted(Comparator.comparing(HierarchyNode::getName, String.CASE_INSENSITIVE_ORDER)
                        .thenComparing(n -> n.getId().toString()))
                .collect(Collectors.toList());

        List<MeceWarning> warnings = new ArrayList<>();

        // exhaustiveness
        TreeMap<Long, float[]> answers = new TreeMap<>();
        answerEmbeddings.forEach((id, vector) -> {
            if (vector != null) {
                answers.put(id, vector);
            }
        });
        List<Long> uncovered = new ArrayList<>();
        double similaritySum = 0.0;
        double minSimilarity = answers.isEmpty() ? 0.0 : Double.POSITIVE_INFINITY;
        for (Map.Entry<Long, float[]> answer : answers.entrySet()) {
            double best = 0.0;
            for (HierarchyNode code : codes) {
                best = Math.max(best, VectorMath.cosineSimilarity(answer.getValue(), code.getEmbedding()));
            }
            similaritySum += best;
            minSimilarity = Math.min(minSimilarity, best);
            if (best < config.coverageThreshold()) {
                uncovered.add(answer.getKey());
            }
        }
        int total = answers.size();
        double coverageFraction = total == 0 ? 0.0 : (double) (total - uncovered.size()) / total;
        double uncoveredFraction = total == 0 ? 0.0 : (double) uncovered.size() / total;

        if (!uncovered.isEmpty()) {
            warnings.add(new MeceWarning("UNCOVERED", "info",
                    String.format("%d of %d answers are not close to any code", uncovered.size(), total),
                    List.of(), List.of(), null, uncovered));
        }
        if (uncoveredFraction > config.gapThreshold()) {
            warnings.add(new MeceWarning("GAP", "warning",
                    String.format("%.1f%% of answers are uncovered (threshold %.1f%%); consider adding codes",
                            uncoveredFraction * 100, config.gapThreshold() * 100),
                    List.of(), List.of(), null, List.of()));
        }

        // exclusivity
        int pairs = 0;
        int overlapping = 0;
        for (int i = 0; i < codes.size(); i++) {
            for (int j = i + 1; j < codes.size(); j++) {
                pairs++;
                HierarchyNode a = codes.get(i);
                HierarchyNode b = codes.get(j);
                double similarity = VectorMath.cosineSimilarity(a.getEmbedding(), b.getEmbedding());
                if (similarity > config.overlapThreshold()) {
                    overlapping++;
                    warnings.add(new MeceWarning("OVERLAP", "warning",
                            String.format("'%s' and '%s' overlap (similarity %.2f); consider merging",
                                    a.getName(), b.getName(), similarity),
                            List.of(a.getId().toString(), b.getId().toString()),
                            List.of(a.getName(), b.getName()),
                            round(similarity, 4),
                            List.of()));
                } else if (similarity > config.overlapWarningThreshold()) {
                    warnings.add(new MeceWarning("NEAR_OVERLAP", "info",
                            String.format("'%s' and '%s' are close (similarity %.2f); check that they stay distinct",
                                    a.getName(), b.getName(), similarity),
                            List.of(a.getId().toString(), b.getId().toString()),
                            List.of(a.getName(), b.getName()),
                            round(similarity, 4),
                            List.of()));
                }
            }
        }
        double overlapFraction = pairs == 0 ? 0.0 : (double) overlapping / pairs;

        double raw = 100.0 * (coverageFraction * COVERAGE_WEIGHT + (1.0 - overlapFraction) * EXCLUSIVITY_WEIGHT);
        double score = round(Math.max(0.0, Math.min(100.0, raw)), 2);

        log.info("MECE: score={}, coverage={}/{}, overlapping pairs={}/{}",
                score, total - uncovered.size(), total, overlapping, pairs);

        return new MeceReport(
                score,
                round(coverageFraction, 4),
                round(overlapFraction, 4),
                total == 0 ? 0.0 : round(similaritySum / total, 4),
                round(minSimilarity, 4),
                uncovered,
                warnings);
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    public record MeceReport(
            double score,
            double coverageFraction,
            double overlapFraction,
            double averageCoverageSimilarity,
            double minCoverageSimilarity,
            List<Long> uncoveredAnswerIds,
            List<MeceWarning> warnings
    ) {}

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record MeceWarning(
            String type,
            String severity,
            String message,
            @JsonProperty("node_ids") List<String> nodeIds,
            @JsonProperty("node_names") List<String> nodeNames,
            Double similarity,
            @JsonProperty("answer_ids") List<Long> answerIds
    ) {}
}

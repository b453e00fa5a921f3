package com.survey.codeframe.service;

import com.survey.codeframe.clustering.AnswerCluster;
import com.survey.codeframe.clustering.ClusteringResult;
import com.survey.codeframe.clustering.HdbscanClusterer;
import com.survey.codeframe.config.AlgorithmConfig;
import com.survey.codeframe.exception.ClusteringException;
import com.survey.codeframe.util.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Groups answer embeddings into density clusters and picks representative answers.
 */
@Service
@Slf4j
public class ClusteringService {

    public ClusteringResult cluster(Map<Long, float[]> embeddings, AlgorithmConfig config) {
        // ascending answer ids keep the run deterministic regardless of input map order
        TreeMap<Long, float[]> eligible = new TreeMap<>();
        embeddings.forEach((answerId, vector) -> {
            if (vector != null) {
                eligible.put(answerId, vector);
            }
        });

        if (eligible.size() < config.minClusterSize()) {
            throw new ClusteringException(String.format(
                    "Insufficient data: %d answers with embeddings, at least %d required",
                    eligible.size(), config.minClusterSize()));
        }

        List<Long> ids = new ArrayList<>(eligible.keySet());
        List<float[]> vectors = new ArrayList<>(eligible.values());

        long start = System.currentTimeMillis();
        int[] labels = new HdbscanClusterer(config.minClusterSize(), config.minSamples()).fit(vectors);
        int clusterCount = HdbscanClusterer.clusterCount(labels);
        log.info("HDBSCAN on {} answers: {} clusters in {}ms", ids.size(), clusterCount,
                System.currentTimeMillis() - start);

        if (clusterCount == 0) {
            throw new ClusteringException(String.format(
                    "No clusters found among %d answers (min_cluster_size=%d, min_samples=%d)",
                    ids.size(), config.minClusterSize(), config.minSamples()));
        }

        List<List<Integer>> members = new ArrayList<>();
        for (int c = 0; c < clusterCount; c++) {
            members.add(new ArrayList<>());
        }
        List<Long> noise = new ArrayList<>();
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == HdbscanClusterer.NOISE) {
                noise.add(ids.get(i));
            } else {
                members.get(labels[i]).add(i);
            }
        }

        List<AnswerCluster> clusters = new ArrayList<>(clusterCount);
        for (int c = 0; c < clusterCount; c++) {
            clusters.add(buildCluster(c, members.get(c), ids, vectors, config.representativeCount()));
        }

        log.info("Clustering done: {} clusters, {} noise answers", clusters.size(), noise.size());
        return new ClusteringResult(clusters, noise);
    }

    private AnswerCluster buildCluster(int clusterId, List<Integer> indices, List<Long> ids,
                                       List<float[]> vectors, int representativeCount) {
        List<float[]> memberVectors = indices.stream().map(vectors::get).collect(Collectors.toList());
        float[] centroid = VectorMath.centroid(memberVectors);

        List<Long> memberIds = indices.stream().map(ids::get).sorted().collect(Collectors.toList());

        // closest to the centroid first; equal distances fall back to the lower answer id
        List<Long> representatives = indices.stream()
                .sorted(Comparator.<Integer>comparingDouble(
                                i -> VectorMath.euclideanDistance(vectors.get(i), centroid))
                        .thenComparing(ids::get))
                .limit(representativeCount)
                .map(ids::get)
                .collect(Collectors.toList());

        log.debug("Cluster {}: {} members, representatives {}", clusterId, memberIds.size(), representatives);
        return new AnswerCluster(clusterId, memberIds, representatives, centroid);
    }
}

package com.survey.codeframe.clustering;

import java.util.List;

public record ClusteringResult(List<AnswerCluster> clusters, List<Long> noiseAnswerIds) {

    public int clusterCount() {
        return clusters.size();
    }
}

package com.survey.codeframe.clustering;

import java.util.List;

/**
 * One density cluster of answers. Member ids are ascending; representatives are ordered
 * by distance to the centroid.
 */
public record AnswerCluster(
        int clusterId,
        List<Long> memberAnswerIds,
        List<Long> representativeAnswerIds,
        float[] centroid
) {

    public int size() {
        return memberAnswerIds.size();
    }
}

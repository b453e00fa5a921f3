package com.survey.codeframe.hierarchy;

import com.survey.codeframe.service.UsageContext;

/**
 * Names clusters of answers (codes) and groups of codes (themes).
 */
public interface ClusterLabeler {

    /**
     * @throws com.survey.codeframe.exception.LabelingException if the provider fails or answers
     *         with something that is not a label
     */
    ClusterLabel label(LabelingRequest request, UsageContext context);
}

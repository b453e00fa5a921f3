package com.survey.codeframe.hierarchy;

import java.util.List;

/**
 * Raw labeler output. Confidence values are kept as returned and validated by the builder.
 */
public record ClusterLabel(
        String name,
        String description,
        String confidence,
        String frequencyEstimate,
        List<SubcodeLabel> subcodes
) {

    public record SubcodeLabel(String name, String description, String confidence) {}
}

package com.survey.codeframe.hierarchy;

import com.survey.codeframe.entity.CodingType;

import java.util.List;

/**
 * Input for one labeling call. For a code the examples are answer texts of the cluster;
 * for a theme they are the names of the codes it groups.
 */
public record LabelingRequest(
        Target target,
        String categoryName,
        String categoryDescription,
        CodingType codingType,
        List<String> examples,
        int size,
        String model
) {

    public enum Target {
        CODE,
        THEME
    }
}

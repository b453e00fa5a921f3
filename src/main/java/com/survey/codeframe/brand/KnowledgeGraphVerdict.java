package com.survey.codeframe.brand;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of checking knowledge-graph entities against the candidate and the expected category.
 */
public record KnowledgeGraphVerdict(
        IssueSeverity severity,
        String code,
        String message,
        @JsonProperty("matched_entity") String matchedEntity,
        @JsonProperty("entity_type") String entityType,
        @JsonProperty("found_category") String foundCategory
) {

    public static final String WRONG_ENTITY = "WRONG_ENTITY";
    public static final String CATEGORY_MISMATCH = "CATEGORY_MISMATCH";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String CATEGORY_UNCONFIRMED = "CATEGORY_UNCONFIRMED";
    public static final String VERIFIED = "VERIFIED";

    @JsonIgnore
    public boolean isError() {
        return severity == IssueSeverity.ERROR;
    }
}

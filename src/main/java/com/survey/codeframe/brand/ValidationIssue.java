package com.survey.codeframe.brand;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One finding about a brand candidate, tagged with the tier that raised it.
 */
public record ValidationIssue(EvidenceTier tier, IssueSeverity severity, String code, String message) {

    public static final String INSUFFICIENT_DATA = "INSUFFICIENT_DATA";

    @JsonIgnore
    public boolean isRisk() {
        return severity != IssueSeverity.OK;
    }
}

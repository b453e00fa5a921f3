package com.survey.codeframe.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Feature attribution for ledger entries.
 */
public enum UsageFeature {
    EMBEDDING("embedding"),
    CLUSTER_LABELING("cluster_labeling"),
    THEME_LABELING("theme_labeling"),
    BRAND_WEB_SEARCH("brand_web_search"),
    BRAND_KNOWLEDGE_GRAPH("brand_knowledge_graph"),
    BRAND_VISION("brand_vision"),
    BRAND_TRANSLATION("brand_translation");

    private final String value;

    UsageFeature(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

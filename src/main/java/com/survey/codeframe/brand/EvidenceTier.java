package com.survey.codeframe.brand;

import com.fasterxml.jackson.annotation.JsonValue;
import com.survey.codeframe.entity.UsageFeature;

/**
 * Independent evidence sources consulted for a brand candidate.
 */
public enum EvidenceTier {
    WEB_SEARCH("web_search", false, "google-search", UsageFeature.BRAND_WEB_SEARCH),
    KNOWLEDGE_GRAPH("knowledge_graph", false, "google-kg", UsageFeature.BRAND_KNOWLEDGE_GRAPH),
    VISION("vision", true, "openai", UsageFeature.BRAND_VISION),
    TRANSLATION("translation", true, "google-translate", UsageFeature.BRAND_TRANSLATION);

    private final String value;
    private final boolean optional;
    private final String provider;
    private final UsageFeature usageFeature;

    EvidenceTier(String value, boolean optional, String provider, UsageFeature usageFeature) {
        this.value = value;
        this.optional = optional;
        this.provider = provider;
        this.usageFeature = usageFeature;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isOptional() {
        return optional;
    }

    /** Rate-limiter bucket for outgoing calls of this tier. */
    public String getProvider() {
        return provider;
    }

    public UsageFeature getUsageFeature() {
        return usageFeature;
    }
}

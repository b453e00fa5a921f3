package com.survey.codeframe.brand;

import com.survey.codeframe.config.GoogleProperties;

import java.util.Map;

/**
 * Google API credentials for one validation run, taken from the request or from configuration.
 */
public record SearchCredentials(String apiKey, String searchEngineId) {

    public static final String API_KEY = "google_cse_api_key";
    public static final String ENGINE_ID = "google_cse_cx_id";

    /**
     * Request keys win; anything missing falls back to the configured values.
     */
    public static SearchCredentials resolve(Map<String, String> requestKeys, GoogleProperties properties) {
        Map<String, String> keys = requestKeys != null ? requestKeys : Map.of();
        return new SearchCredentials(
                firstNonBlank(keys.get(API_KEY), properties.getApiKey()),
                firstNonBlank(keys.get(ENGINE_ID), properties.getSearchEngineId()));
    }

    public boolean isComplete() {
        return apiKey != null && !apiKey.isBlank() && searchEngineId != null && !searchEngineId.isBlank();
    }

    @Override
    public String toString() {
        return "SearchCredentials[engine=" + searchEngineId + "]";
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}

package com.survey.codeframe.brand;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.survey.codeframe.config.GoogleProperties;
import com.survey.codeframe.service.UsageLedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Google Custom Search JSON API (web and image search).
 */
@Component
@Slf4j
public class GoogleSearchClient extends GoogleApiClient implements WebSearchClient {

    private static final String API_NAME = "google-custom-search";
    private static final int MAX_PAGE_SIZE = 10;

    private final GoogleProperties properties;

    public GoogleSearchClient(RestTemplate restTemplate, ObjectMapper objectMapper,
                              UsageLedgerService usageLedger, GoogleProperties properties) {
        super(restTemplate, objectMapper, usageLedger);
        this.properties = properties;
    }

    @Override
    public List<WebSearchHit> search(String query, int count, BrandProbe probe) {
        JsonNode root = getJson(buildUri(query, count, probe, false), EvidenceTier.WEB_SEARCH, API_NAME, probe);

        List<WebSearchHit> hits = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            hits.add(new WebSearchHit(
                    item.path("title").asText(""),
                    item.path("snippet").asText(""),
                    item.path("link").asText("")));
        }
        log.debug("Web search '{}': {} results", query, hits.size());
        return hits;
    }

    @Override
    public List<String> searchImages(String query, int count, BrandProbe probe) {
        JsonNode root = getJson(buildUri(query, count, probe, true), EvidenceTier.VISION, API_NAME, probe);

        List<String> links = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            String link = item.path("link").asText("");
            if (!link.isBlank()) {
                links.add(link);
            }
        }
        return links;
    }

    private URI buildUri(String query, int count, BrandProbe probe, boolean images) {
        SearchCredentials credentials = probe.credentials();
        if (credentials == null || !credentials.isComplete()) {
            throw new IllegalStateException("Google search credentials not configured");
        }
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(properties.getCustomSearchUrl())
                .queryParam("key", credentials.apiKey())
                .queryParam("cx", credentials.searchEngineId())
                .queryParam("q", query)
                .queryParam("num", Math.max(1, Math.min(MAX_PAGE_SIZE, count)));
        if (images) {
            builder.queryParam("searchType", "image");
        }
        return builder.encode().build().toUri();
    }
}

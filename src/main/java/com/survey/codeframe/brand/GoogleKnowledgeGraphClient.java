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
 * Google Knowledge Graph Search API.
 */
@Component
@Slf4j
public class GoogleKnowledgeGraphClient extends GoogleApiClient implements KnowledgeGraphClient {

    private static final String API_NAME = "google-knowledge-graph";

    private final GoogleProperties properties;

    public GoogleKnowledgeGraphClient(RestTemplate restTemplate, ObjectMapper objectMapper,
                                      UsageLedgerService usageLedger, GoogleProperties properties) {
        super(restTemplate, objectMapper, usageLedger);
        this.properties = properties;
    }

    @Override
    public List<KnowledgeGraphEntity> lookup(String query, int limit, BrandProbe probe) {
        String apiKey = requireKey(probe.credentials() != null ? probe.credentials().apiKey() : null, API_NAME);
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getKnowledgeGraphUrl())
                .queryParam("query", query)
                .queryParam("key", apiKey)
                .queryParam("limit", limit)
                .queryParam("indent", true)
                .encode()
                .build()
                .toUri();

        JsonNode root = getJson(uri, EvidenceTier.KNOWLEDGE_GRAPH, API_NAME, probe);

        List<KnowledgeGraphEntity> entities = new ArrayList<>();
        for (JsonNode element : root.path("itemListElement")) {
            JsonNode result = element.path("result");
            List<String> types = new ArrayList<>();
            for (JsonNode type : result.path("@type")) {
                types.add(type.asText());
            }
            entities.add(new KnowledgeGraphEntity(
                    result.path("name").asText(""),
                    types,
                    result.path("description").asText(""),
                    result.path("detailedDescription").path("articleBody").asText(""),
                    element.path("resultScore").asDouble(0.0)));
        }
        log.debug("Knowledge graph '{}': {} entities", query, entities.size());
        return entities;
    }
}

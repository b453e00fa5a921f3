package com.survey.codeframe.brand;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.survey.codeframe.exception.EvidenceTierException;
import com.survey.codeframe.service.UsageLedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * Shared GET + JSON handling for the Google evidence clients. Every call is written to the
 * usage ledger under the tier's feature.
 */
@Slf4j
abstract class GoogleApiClient {

    protected final RestTemplate restTemplate;
    protected final ObjectMapper objectMapper;
    protected final UsageLedgerService usageLedger;

    protected GoogleApiClient(RestTemplate restTemplate, ObjectMapper objectMapper, UsageLedgerService usageLedger) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.usageLedger = usageLedger;
    }

    protected JsonNode getJson(URI uri, EvidenceTier tier, String apiName, BrandProbe probe) {
        String body;
        try {
            body = restTemplate.getForObject(uri, String.class);
        } catch (HttpClientErrorException.Forbidden | HttpClientErrorException.Unauthorized e) {
            // bad key: retrying will not help
            throw new IllegalStateException(apiName + " rejected the API key: " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            throw new EvidenceTierException(tier, apiName + " call failed: " + e.getMessage(), e);
        }

        usageLedger.record(tier.getUsageFeature(), apiName, 0, 0,
                probe.usageContext(), Map.of("query", probe.candidate()));

        if (body == null || body.isBlank()) {
            throw new EvidenceTierException(tier, apiName + " returned an empty response");
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new EvidenceTierException(tier, apiName + " returned unreadable JSON", e);
        }
    }

    protected static String requireKey(String apiKey, String apiName) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException(apiName + " API key not configured");
        }
        return apiKey;
    }
}

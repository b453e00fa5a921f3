package com.survey.codeframe.brand;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.survey.codeframe.config.GoogleProperties;
import com.survey.codeframe.exception.EvidenceTierException;
import com.survey.codeframe.service.UsageLedgerService;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Google Cloud Translation v2.
 */
@Component
public class GoogleTranslationClient extends GoogleApiClient implements TranslationClient {

    private static final String API_NAME = "google-translate";

    private final GoogleProperties properties;

    public GoogleTranslationClient(RestTemplate restTemplate, ObjectMapper objectMapper,
                                   UsageLedgerService usageLedger, GoogleProperties properties) {
        super(restTemplate, objectMapper, usageLedger);
        this.properties = properties;
    }

    @Override
    public TranslationEvidence translate(String text, String sourceLanguage, String targetLanguage, BrandProbe probe) {
        String apiKey = requireKey(probe.credentials() != null ? probe.credentials().apiKey() : null, API_NAME);
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(properties.getTranslateUrl())
                .queryParam("key", apiKey)
                .queryParam("q", text)
                .queryParam("target", targetLanguage)
                .queryParam("format", "text");
        if (sourceLanguage != null && !sourceLanguage.isBlank()) {
            builder.queryParam("source", sourceLanguage);
        }
        URI uri = builder.encode().build().toUri();

        JsonNode translation = getJson(uri, EvidenceTier.TRANSLATION, API_NAME, probe)
                .path("data").path("translations").path(0);
        if (translation.isMissingNode()) {
            throw new EvidenceTierException(EvidenceTier.TRANSLATION, "No translation returned for '" + text + "'");
        }

        String detected = translation.path("detectedSourceLanguage").asText(sourceLanguage);
        return new TranslationEvidence(detected, targetLanguage, text, translation.path("translatedText").asText(text));
    }
}

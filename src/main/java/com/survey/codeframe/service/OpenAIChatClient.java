package com.survey.codeframe.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.survey.codeframe.config.OpenAIProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Thin OpenAI chat-completions wrapper returning the message content together with token usage.
 * Callers translate failures into their own error kinds.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OpenAIChatClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final OpenAIProperties properties;

    public boolean isConfigured() {
        return properties.getApiKey() != null && !properties.getApiKey().isBlank();
    }

    /**
     * @param messages chat messages; content may be a string or a multi-part array (vision)
     * @throws IllegalStateException if the key is missing or the response has no content
     * @throws org.springframework.web.client.RestClientException on transport or HTTP errors
     */
    public ChatResult complete(String model, List<Map<String, Object>> messages, boolean jsonOutput) throws IOException {
        if (!isConfigured()) {
            throw new IllegalStateException("OpenAI API key not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(properties.getApiKey());

        Map<String, Object> requestBody = jsonOutput
                ? Map.of(
                        "model", model,
                        "messages", messages,
                        "temperature", properties.getTemperature(),
                        "max_tokens", properties.getMaxTokens(),
                        "response_format", Map.of("type", "json_object"))
                : Map.of(
                        "model", model,
                        "messages", messages,
                        "temperature", properties.getTemperature(),
                        "max_tokens", properties.getMaxTokens());

        log.debug("Calling OpenAI: model={}, messages={}", model, messages.size());

        ResponseEntity<String> response = restTemplate.postForEntity(
                properties.getBaseUrl() + "/chat/completions", new HttpEntity<>(requestBody, headers), String.class);

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new IllegalStateException("OpenAI API returned status: " + response.getStatusCode());
        }

        JsonNode root = objectMapper.readTree(response.getBody());
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new IllegalStateException("No choices in OpenAI response");
        }
        JsonNode content = choices.get(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw new IllegalStateException("No content in OpenAI response");
        }

        JsonNode usage = root.path("usage");
        return new ChatResult(
                content.asText(),
                usage.path("prompt_tokens").asInt(0),
                usage.path("completion_tokens").asInt(0));
    }

    public record ChatResult(String content, int promptTokens, int completionTokens) {}
}

package com.survey.codeframe.brand;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.survey.codeframe.exception.EvidenceTierException;
import com.survey.codeframe.service.OpenAIChatClient;
import com.survey.codeframe.service.UsageLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Sends product image URLs to an OpenAI vision model and asks how many show the candidate brand.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OpenAIVisionClient implements VisionClient {

    private static final String DEFAULT_MODEL = "gpt-4o-mini";
    private static final int MAX_IMAGES = 5;

    private final OpenAIChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final UsageLedgerService usageLedger;

    @Override
    public VisionEvidence analyze(List<String> imageUrls, BrandProbe probe) {
        String model = probe.visionModel() != null && !probe.visionModel().isBlank()
                ? probe.visionModel()
                : DEFAULT_MODEL;
        List<String> images = imageUrls.size() > MAX_IMAGES ? imageUrls.subList(0, MAX_IMAGES) : imageUrls;
        if (images.isEmpty()) {
            return new VisionEvidence(model, List.of(), 0, 0, null, "No product images found");
        }

        List<Map<String, Object>> content = new ArrayList<>();
        content.add(Map.of("type", "text", "text", prompt(probe, images.size())));
        for (String url : images) {
            content.add(Map.of("type", "image_url", "image_url", Map.of("url", url)));
        }
        List<Map<String, Object>> messages = List.of(Map.of("role", "user", "content", content));

        OpenAIChatClient.ChatResult result;
        try {
            result = chatClient.complete(model, messages, true);
        } catch (RestClientException | IOException e) {
            throw new EvidenceTierException(EvidenceTier.VISION, "Vision call failed: " + e.getMessage(), e);
        }

        usageLedger.record(EvidenceTier.VISION.getUsageFeature(), model, result.promptTokens(),
                result.completionTokens(), probe.usageContext(),
                Map.of("query", probe.candidate(), "images", images.size()));

        JsonNode root;
        try {
            root = objectMapper.readTree(result.content());
        } catch (IOException e) {
            throw new EvidenceTierException(EvidenceTier.VISION, "Vision model returned invalid JSON", e);
        }

        int matching = Math.max(0, Math.min(images.size(), root.path("matching_images").asInt(0)));
        JsonNode detected = root.get("detected_brand");
        log.debug("Vision '{}': {}/{} matching images", probe.candidate(), matching, images.size());
        return new VisionEvidence(model, new ArrayList<>(images), images.size(), matching,
                detected == null || detected.isNull() ? null : detected.asText(),
                root.path("notes").asText(null));
    }

    private String prompt(BrandProbe probe, int count) {
        return String.format("""
                You are checking survey brand codes. Look at the %d images below.
                Count how many clearly show a %s product of the brand "%s".

                Return a JSON object:
                {"matching_images": <number>, "detected_brand": "brand most visible, or null", "notes": "one sentence"}
                """, count, probe.categoryName(), probe.candidate());
    }
}

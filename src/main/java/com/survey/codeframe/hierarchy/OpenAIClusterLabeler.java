package com.survey.codeframe.hierarchy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.survey.codeframe.entity.CodingType;
import com.survey.codeframe.entity.UsageFeature;
import com.survey.codeframe.exception.LabelingException;
import com.survey.codeframe.exception.RateLimitExceededException;
import com.survey.codeframe.service.OpenAIChatClient;
import com.survey.codeframe.service.RateLimiterService;
import com.survey.codeframe.service.UsageContext;
import com.survey.codeframe.service.UsageLedgerService;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Labels clusters with an OpenAI chat model in JSON mode. Transport errors and rate-limit
 * denials are retried with backoff before the cluster fails.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OpenAIClusterLabeler implements ClusterLabeler {

    private static final String PROVIDER = "openai";
    private static final int MAX_EXAMPLE_CHARS = 300;

    private final OpenAIChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final RateLimiterService rateLimiter;
    private final UsageLedgerService usageLedger;
    private final Retry openAIRetry;

    @Override
    public ClusterLabel label(LabelingRequest request, UsageContext context) {
        List<Map<String, Object>> messages = List.of(
                Map.of("role", "system", "content", systemPrompt(request.codingType())),
                Map.of("role", "user", "content", userPrompt(request)));

        OpenAIChatClient.ChatResult result;
        try {
            result = openAIRetry.executeCallable(() -> {
                if (!rateLimiter.allowRequest(PROVIDER)) {
                    throw new RateLimitExceededException(PROVIDER);
                }
                return chatClient.complete(request.model(), messages, true);
            });
        } catch (RateLimitExceededException e) {
            throw new LabelingException("OpenAI rate limit reached while labeling clusters", e);
        } catch (Exception e) {
            throw new LabelingException("Labeling call failed: " + e.getMessage(), e);
        }

        UsageFeature feature = request.target() == LabelingRequest.Target.THEME
                ? UsageFeature.THEME_LABELING
                : UsageFeature.CLUSTER_LABELING;
        usageLedger.record(feature, request.model(), result.promptTokens(), result.completionTokens(),
                context, Map.of("examples", request.examples().size(), "size", request.size()));

        return parse(result.content());
    }

    private ClusterLabel parse(String content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (IOException e) {
            throw new LabelingException("Labeler returned invalid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new LabelingException("Labeler returned no JSON object");
        }

        List<ClusterLabel.SubcodeLabel> subcodes = new ArrayList<>();
        for (JsonNode sub : root.path("subcodes")) {
            subcodes.add(new ClusterLabel.SubcodeLabel(
                    textOrNull(sub, "name"),
                    textOrNull(sub, "description"),
                    textOrNull(sub, "confidence")));
        }

        return new ClusterLabel(
                textOrNull(root, "name"),
                textOrNull(root, "description"),
                textOrNull(root, "confidence"),
                textOrNull(root, "frequency_estimate"),
                subcodes);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private String systemPrompt(CodingType codingType) {
        return switch (codingType) {
            case BRAND -> "You build coding frames for survey answers that mention brands. "
                    + "Name each group after the single brand it refers to, using the brand's official spelling.";
            case SENTIMENT -> "You build coding frames for survey answers expressing opinions. "
                    + "Name each group after the attitude and the subject it is about.";
            default -> "You build coding frames (codeframes) for open-ended survey answers. "
                    + "Names are short, mutually exclusive and understandable without the answers.";
        };
    }

    private String userPrompt(LabelingRequest request) {
        StringBuilder examples = new StringBuilder();
        for (String example : request.examples()) {
            String text = example.length() > MAX_EXAMPLE_CHARS ? example.substring(0, MAX_EXAMPLE_CHARS) + "..." : example;
            examples.append("- ").append(text.replace('\n', ' ')).append('\n');
        }

        String what = request.target() == LabelingRequest.Target.THEME
                ? "The following codes were grouped together. Name the theme that covers them."
                : "The following answers were grouped together (" + request.size() + " answers in total). "
                        + "Name the code that describes them. Add subcodes only if the answers clearly split "
                        + "into distinct sub-groups.";

        return String.format("""
                Survey question: %s
                %s

                %s

                %s

                Return a JSON object:
                {
                  "name": "short label (max 6 words)",
                  "description": "one sentence",
                  "confidence": "high" | "medium" | "low",
                  "frequency_estimate": "high" | "medium" | "low",
                  "subcodes": [{"name": "...", "description": "...", "confidence": "high" | "medium" | "low"}]
                }
                """,
                request.categoryName(),
                request.categoryDescription() != null ? "Context: " + request.categoryDescription() : "",
                what,
                examples);
    }
}

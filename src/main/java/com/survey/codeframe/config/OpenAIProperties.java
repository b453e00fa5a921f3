package com.survey.codeframe.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "codeframe.openai")
public class OpenAIProperties {
    private String apiKey;
    private String baseUrl = "https://api.openai.com/v1";
    private String chatModel = "gpt-4o-mini";
    private String visionModel = "gpt-4o-mini";
    private double temperature = 0.2;
    private int maxTokens = 1500;
    private int embeddingBatchSize = 100;
    private int retryAttempts = 3;
    private long retryBackoffMs = 1000;
    private double retryBackoffMultiplier = 2.0;
}

package com.survey.codeframe.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * Outgoing call budgets per provider (openai, google-search, google-kg, google-translate).
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "codeframe.ratelimit")
public class RateLimitProperties {
    private int defaultPerMinute = 60;
    private Map<String, Integer> perMinute = new HashMap<>();

    public int limitFor(String provider) {
        return perMinute.getOrDefault(provider, defaultPerMinute);
    }
}

package com.survey.codeframe.config;

import com.survey.codeframe.exception.EvidenceTierException;
import com.survey.codeframe.exception.RateLimitExceededException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import java.time.Duration;

/**
 * Retry and timeout policies for outgoing calls: one for brand evidence tiers,
 * one for the OpenAI labeling and embedding calls of the generation pipeline.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public RetryRegistry tierRetryRegistry(BrandValidationProperties properties) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, properties.getRetryAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Duration.ofMillis(properties.getRetryBackoffMs()),
                        properties.getRetryBackoffMultiplier()))
                .retryExceptions(EvidenceTierException.class, RestClientException.class)
                .build();
        return RetryRegistry.of(config);
    }

    @Bean
    public TimeLimiter tierTimeLimiter(BrandValidationProperties properties) {
        return TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(properties.getTierTimeoutMs()))
                .cancelRunningFuture(true)
                .build());
    }

    @Bean
    public Retry openAIRetry(OpenAIProperties properties) {
        return Retry.of("openai", openAIRetryConfig(
                properties.getRetryAttempts(), properties.getRetryBackoffMs(), properties.getRetryBackoffMultiplier()));
    }

    /**
     * Transport errors, 5xx and 429 responses and local rate-limit denials are retried.
     * Other client errors, missing keys and unreadable bodies fail on the first attempt.
     */
    public static RetryConfig openAIRetryConfig(int attempts, long backoffMs, double multiplier) {
        return RetryConfig.custom()
                .maxAttempts(Math.max(1, attempts))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(backoffMs), multiplier))
                .retryExceptions(ResourceAccessException.class, HttpServerErrorException.class,
                        HttpClientErrorException.TooManyRequests.class, RateLimitExceededException.class)
                .build();
    }
}

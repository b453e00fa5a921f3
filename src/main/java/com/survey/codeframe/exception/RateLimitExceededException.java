package com.survey.codeframe.exception;

/**
 * No call slot was left for a provider in the current minute. Retried by the OpenAI call policy.
 */
public class RateLimitExceededException extends RuntimeException {

    private final String provider;

    public RateLimitExceededException(String provider) {
        super("Rate limit reached for " + provider);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}

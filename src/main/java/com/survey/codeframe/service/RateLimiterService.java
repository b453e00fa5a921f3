package com.survey.codeframe.service;

import com.survey.codeframe.config.RateLimitProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Redis-based per-provider rate limiter for outgoing AI and search calls.
 * Counters are fixed one-minute windows shared by every instance of the service.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RateLimiterService {

    private final RedisTemplate<String, String> redisTemplate;
    private final RateLimitProperties properties;

    /**
     * @return true if a call slot was granted for this provider in the current minute
     */
    public boolean allowRequest(String provider) {
        String minuteKey = minuteKey(provider);
        int limit = properties.limitFor(provider);

        Long minuteCount;
        try {
            minuteCount = redisTemplate.opsForValue().increment(minuteKey);
        } catch (DataAccessException e) {
            log.warn("Rate limiter unavailable for {}, allowing call: {}", provider, e.getMessage());
            return true;
        }
        if (minuteCount == null) {
            minuteCount = 0L;
        }

        if (minuteCount == 1) {
            redisTemplate.expire(minuteKey, Duration.ofMinutes(1));
        }

        if (minuteCount > limit) {
            log.warn("Rate limit exceeded for provider {}: {} calls in current minute (limit: {})",
                    provider, minuteCount, limit);
            return false;
        }

        log.debug("Call allowed for provider {}: {}/{} this minute", provider, minuteCount, limit);
        return true;
    }

    public RateLimitStatus getStatus(String provider) {
        String countStr = redisTemplate.opsForValue().get(minuteKey(provider));
        int count = countStr != null ? Integer.parseInt(countStr) : 0;
        return new RateLimitStatus(provider, count, properties.limitFor(provider));
    }

    private String minuteKey(String provider) {
        return "codeframe:ratelimit:minute:" + provider;
    }

    public record RateLimitStatus(
            String provider,
            int currentMinuteRequests,
            int maxMinuteRequests
    ) {}
}

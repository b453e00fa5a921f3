package com.survey.codeframe.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.survey.codeframe.config.CodeframeProperties;
import com.survey.codeframe.entity.UsageFeature;
import com.survey.codeframe.entity.UsageLogEntry;
import com.survey.codeframe.repository.UsageLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Append-only ledger of AI calls. Each call is priced from the configured per-model rates,
 * inserted as an immutable row, and added to a Redis running total for the day so the
 * daily budget can be checked without scanning the table.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UsageLedgerService {

    private static final BigDecimal ONE_MILLION = BigDecimal.valueOf(1_000_000);

    private final UsageLogRepository usageLogRepository;
    private final RedisTemplate<String, String> redisTemplate;
    private final CodeframeProperties properties;
    private final ObjectMapper objectMapper;

    public UsageLogEntry record(UsageFeature feature, String model, int inputTokens, int outputTokens,
                                UsageContext context, Map<String, Object> metadata) {
        BigDecimal cost = priceOf(model, inputTokens, outputTokens);
        UsageContext ctx = context != null ? context : new UsageContext(null, null, null);

        UsageLogEntry entry = UsageLogEntry.builder()
                .id(UUID.randomUUID())
                .featureType(feature)
                .model(model)
                .inputTokens(Math.max(0, inputTokens))
                .outputTokens(Math.max(0, outputTokens))
                .costUsd(cost)
                .generationId(ctx.generationId())
                .categoryId(ctx.categoryId())
                .answerId(ctx.answerId())
                .metadata(toJson(metadata))
                .createdAt(LocalDateTime.now())
                .build();

        entry = usageLogRepository.save(entry);
        log.debug("Usage recorded: {} {} in={} out={} cost=${}", feature.getValue(), model,
                inputTokens, outputTokens, cost);

        addToDailyTotal(cost);
        return entry;
    }

    public BigDecimal priceOf(String model, int inputTokens, int outputTokens) {
        CodeframeProperties.ModelPrice price = model != null ? properties.getPricing().get(model) : null;
        if (price == null) {
            log.warn("No pricing configured for model {}, recording zero cost", model);
            return BigDecimal.ZERO.setScale(6, RoundingMode.HALF_UP);
        }
        BigDecimal input = BigDecimal.valueOf(price.getInputPerMillion())
                .multiply(BigDecimal.valueOf(Math.max(0, inputTokens)));
        BigDecimal output = BigDecimal.valueOf(price.getOutputPerMillion())
                .multiply(BigDecimal.valueOf(Math.max(0, outputTokens)));
        return input.add(output).divide(ONE_MILLION, 6, RoundingMode.HALF_UP);
    }

    /**
     * Sums the ledger rows of one generation. The model reported is the one that
     * accounted for the most cost.
     */
    public UsageTotals totalsForGeneration(UUID generationId) {
        List<UsageLogEntry> entries = usageLogRepository.findByGenerationIdOrderByCreatedAtAsc(generationId);

        int input = 0;
        int output = 0;
        BigDecimal cost = BigDecimal.ZERO;
        Map<String, BigDecimal> costByModel = new HashMap<>();
        for (UsageLogEntry entry : entries) {
            input += entry.getInputTokens();
            output += entry.getOutputTokens();
            cost = cost.add(entry.getCostUsd());
            costByModel.merge(entry.getModel(), entry.getCostUsd(), BigDecimal::add);
        }

        String primaryModel = costByModel.entrySet().stream()
                .max(Map.Entry.<String, BigDecimal>comparingByValue()
                        .thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse(null);

        return new UsageTotals(primaryModel, input, output, cost.setScale(6, RoundingMode.HALF_UP), entries.size());
    }

    public List<UsageSummary> summarize(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        return usageLogRepository.summarize(from.atStartOfDay(), to.plusDays(1).atStartOfDay()).stream()
                .map(row -> new UsageSummary(
                        row.getFeatureType(),
                        row.getModel(),
                        row.getDay(),
                        row.getCalls() != null ? row.getCalls() : 0L,
                        row.getInputTokens() != null ? row.getInputTokens() : 0L,
                        row.getOutputTokens() != null ? row.getOutputTokens() : 0L,
                        row.getCostUsd() != null ? row.getCostUsd() : BigDecimal.ZERO))
                .collect(Collectors.toList());
    }

    public boolean isOverBudget() {
        return getTodayCost() >= properties.getCost().getDailyLimit();
    }

    public double getTodayCost() {
        String costStr;
        try {
            costStr = redisTemplate.opsForValue().get(getCostKey());
        } catch (DataAccessException e) {
            log.warn("Daily cost unavailable from Redis: {}", e.getMessage());
            return 0.0;
        }

        if (costStr == null) {
            return 0.0;
        }

        try {
            return Double.parseDouble(costStr);
        } catch (NumberFormatException e) {
            log.error("Invalid cost value in Redis: {}", costStr);
            return 0.0;
        }
    }

    private void addToDailyTotal(BigDecimal cost) {
        if (cost.signum() == 0) {
            return;
        }
        String key = getCostKey();
        try {
            Double current = redisTemplate.opsForValue().increment(key, cost.doubleValue());
            Long ttl = redisTemplate.getExpire(key);
            if (ttl == null || ttl < 0) {
                redisTemplate.expire(key, Duration.ofDays(2));
            }

            double dailyLimit = properties.getCost().getDailyLimit();
            if (current != null && current >= dailyLimit * properties.getCost().getAlertRatio()) {
                log.warn("COST ALERT: Daily AI cost at ${} ({}% of ${} limit)",
                        String.format("%.4f", current),
                        Math.round(properties.getCost().getAlertRatio() * 100), dailyLimit);
            }
        } catch (DataAccessException e) {
            // the ledger row is the source of truth; the Redis total is only an accelerator
            log.warn("Failed to update daily cost total in Redis: {}", e.getMessage());
        }
    }

    private String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize usage metadata: {}", e.getMessage());
            return null;
        }
    }

    private String getCostKey() {
        return "codeframe:cost:daily:" + LocalDate.now();
    }

    public record UsageTotals(
            String primaryModel,
            int inputTokens,
            int outputTokens,
            BigDecimal costUsd,
            int calls
    ) {}

    public record UsageSummary(
            String featureType,
            String model,
            LocalDate day,
            long calls,
            long inputTokens,
            long outputTokens,
            BigDecimal costUsd
    ) {}
}

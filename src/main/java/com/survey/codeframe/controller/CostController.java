package com.survey.codeframe.controller;

import com.survey.codeframe.config.CodeframeProperties;
import com.survey.codeframe.service.RateLimiterService;
import com.survey.codeframe.service.UsageLedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AI cost reporting from the usage ledger
 */
@RestController
@RequestMapping("/api/costs")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Costs", description = "AI usage and cost reporting")
public class CostController {

    private final UsageLedgerService usageLedger;
    private final RateLimiterService rateLimiter;
    private final CodeframeProperties properties;

    @GetMapping("/summary")
    @Operation(summary = "Cost summary",
            description = "Ledger totals grouped by feature, model and day. Defaults to the last 30 days.")
    public ResponseEntity<Object> summary(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        LocalDate end = to != null ? to : LocalDate.now();
        LocalDate start = from != null ? from : end.minusDays(29);
        try {
            List<UsageLedgerService.UsageSummary> rows = usageLedger.summarize(start, end);
            return ResponseEntity.ok(rows);
        } catch (IllegalArgumentException e) {
            return ErrorBodies.badRequest(e.getMessage());
        }
    }

    @GetMapping("/today")
    @Operation(summary = "Today's AI cost", description = "Running total against the daily budget")
    public Map<String, Object> today() {
        double cost = usageLedger.getTodayCost();
        double limit = properties.getCost().getDailyLimit();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("cost_usd", cost);
        stats.put("daily_limit_usd", limit);
        stats.put("remaining_usd", Math.max(0.0, limit - cost));
        stats.put("over_budget", cost >= limit);
        return stats;
    }

    @GetMapping("/ratelimit/{provider}")
    @Operation(summary = "Rate limit status", description = "Calls made to a provider in the current minute")
    public RateLimiterService.RateLimitStatus rateLimit(@PathVariable String provider) {
        return rateLimiter.getStatus(provider);
    }
}

package io.ration.cost;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ration.client.ClientInfo;
import io.ration.client.ClientRegistry;
import io.ration.core.ClientTier;
import io.ration.core.QueueItem;
import io.ration.error.ClientRegistryUnavailableException;
import io.ration.store.KeyValueStore;
import io.ration.store.SchedulerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Prices consumption, gates requests on client budgets, and reports where a client could save.
 *
 * <p>Client cost counters only move here, from provider-reported usage after execution, so a request is charged
 * once no matter how many times it was reserved or retried.
 */
public class CostTracker {
    private static final Logger log = LoggerFactory.getLogger(CostTracker.class);

    public static final double ESTIMATE_MARGIN = 1.2;
    public static final double ESTIMATE_CONFIDENCE = 0.8;
    static final Duration TEMPLATE_CACHE_TTL = Duration.ofHours(1);
    static final Duration ESTIMATE_CACHE_TTL = Duration.ofMinutes(5);

    static final double DOWNGRADE_THRESHOLD_USD = 10;
    static final long BATCHING_THRESHOLD_REQUESTS = 100;
    static final double CACHE_HIT_RATE_THRESHOLD = 0.3;

    private final SchedulerStore store;
    private final KeyValueStore cache;
    private final ObjectMapper json;
    private final ClientRegistry registry;
    private final PriceTable prices;
    private final Clock clock;

    public CostTracker(SchedulerStore store, KeyValueStore cache, ObjectMapper json, ClientRegistry registry,
                       PriceTable prices, Clock clock) {
        this.store = Objects.requireNonNull(store);
        this.cache = Objects.requireNonNull(cache);
        this.json = Objects.requireNonNull(json);
        this.registry = registry == null ? ClientRegistry.defaults() : registry;
        this.prices = prices == null ? PriceTable.defaults() : prices;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public PriceTable prices() { return prices; }

    /**
     * Prices reported usage line by line, persists every line and adds the total to the client's day and month
     * counters in one transaction.
     */
    public CostBreakdown calculateRequestCost(QueueItem request, UsageReport usage) {
        List<CostLine> lines = new ArrayList<>();

        usage.api().forEach((provider, models) -> models.forEach((model, tokens) -> {
            Optional<ModelPrice> price = prices.model(provider, model);
            if (price.isEmpty()) {
                log.warn("Unknown model {}/{}, usage for {} not priced", provider, model, request.requestId());
                return;
            }
            lines.add(new CostLine(provider, model, tokens.total(), price.get().cost(tokens)));
        }));

        if (usage.emails() > 0) {
            lines.add(new CostLine("communications", "emails", usage.emails(), usage.emails() * prices.emailRate()));
        }
        if (usage.sms() > 0) {
            lines.add(new CostLine("communications", "sms", usage.sms(), usage.sms() * prices.smsRate()));
        }

        usage.storage().forEach((type, ops) -> {
            Optional<StoragePrice> price = prices.storage(type);
            if (price.isEmpty()) {
                log.warn("Unknown storage class {}, usage for {} not priced", type, request.requestId());
                return;
            }
            lines.add(new CostLine("storage", type, ops.reads() + ops.writes(), price.get().cost(ops)));
        });

        if (usage.invocations() > 0) {
            lines.add(new CostLine("compute", "invocations", usage.invocations(), usage.invocations() * prices.perInvocation()));
        }
        if (usage.cpuMillis() > 0) {
            lines.add(new CostLine("compute", "cpu_ms", usage.cpuMillis(), usage.cpuMillis() * prices.perCpuMillisecond()));
        }

        double total = 0;
        for (CostLine line : lines) total += line.costUsd();
        long now = clock.millis();
        store.recordCosts(request.requestId(), request.clientId(), lines, total, today(), now);
        return new CostBreakdown(request.requestId(), request.clientId(), total, lines, now);
    }

    /**
     * Pre-flight cost of one run of {@code templateName} for a tier: tokens priced on the tier's model with a 60/40
     * input/output split, plus messages, inflated by a 20% margin.
     */
    public CostEstimate estimateCost(String templateName, ClientTier tier) {
        String key = "cost-estimate-" + templateName + "-" + tier.wireName();
        Optional<String> cached = cache.get(key);
        if (cached.isPresent()) {
            try {
                return json.readValue(cached.get(), CostEstimate.class);
            } catch (JsonProcessingException e) {
                log.warn("Discarding unreadable cached estimate {}", key);
                cache.delete(key);
            }
        }

        TemplateRequirements req = templateRequirements(templateName);
        double estimated = 0;
        for (String provider : req.apiTokens().keySet()) {
            Optional<ModelPrice> price = prices.modelForTier(provider, tier).flatMap(m -> prices.model(provider, m));
            if (price.isEmpty()) {
                log.warn("No priced model for provider {} in template {}", provider, templateName);
                continue;
            }
            estimated += price.get().cost(TokenUsage.estimated(req.tokensFor(provider)));
        }
        estimated += req.emails() * prices.emailRate();
        estimated += req.sms() * prices.smsRate();
        estimated *= ESTIMATE_MARGIN;

        CostEstimate estimate = new CostEstimate(templateName, tier, estimated, ESTIMATE_CONFIDENCE, req);
        try {
            cache.put(key, json.writeValueAsString(estimate), ESTIMATE_CACHE_TTL);
        } catch (JsonProcessingException e) {
            log.warn("Could not cache estimate {}: {}", key, e.getMessage());
        }
        return estimate;
    }

    /** Cached requirements, then the template table, then the default template. */
    public TemplateRequirements templateRequirements(String templateName) {
        if (templateName == null) return TemplateRequirements.defaults();
        String key = "template-req-" + templateName;
        Optional<String> raw = cache.get(key);
        if (raw.isEmpty()) {
            raw = store.templateRequirements(templateName);
            raw.ifPresent(r -> cache.put(key, r, TEMPLATE_CACHE_TTL));
        }
        if (raw.isEmpty()) return TemplateRequirements.defaults();
        try {
            return json.readValue(raw.get(), TemplateRequirements.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable requirements for template {}, using defaults", templateName);
            cache.delete(key);
            return TemplateRequirements.defaults();
        }
    }

    /**
     * Admits the request only if the month's accumulated cost plus {@code estimatedCost} stays within the client's
     * monthly budget.
     */
    public BudgetDecision checkBudget(String clientId, double estimatedCost) {
        ClientBudget usage = store.clientBudget(clientId, today());
        ClientInfo info = clientInfo(clientId);
        return BudgetDecision.of(info.monthlyBudgetUsd(), usage.costMonth(), estimatedCost);
    }

    public ClientBudget clientBudget(String clientId) {
        return store.clientBudget(clientId, today()).withMonthlyBudget(clientInfo(clientId).monthlyBudgetUsd());
    }

    /** Registry lookup; falls back to the standard tier with a $100 budget when the registry is unavailable. */
    public ClientInfo clientInfo(String clientId) {
        try {
            ClientInfo info = registry.getClientInfo(clientId);
            return info == null ? ClientInfo.defaults(clientId) : info;
        } catch (ClientRegistryUnavailableException e) {
            log.warn("Client registry unavailable for {}, using defaults: {}", clientId, e.getMessage());
            return ClientInfo.defaults(clientId);
        }
    }

    public CostReport getClientCostReport(String clientId, ReportPeriod period) {
        Instant now = clock.instant();
        Instant start = period.start(now);
        List<CostSummary> rows = store.costSummary(clientId, start.toEpochMilli());
        double total = 0;
        for (CostSummary row : rows) total += row.totalCost();
        return new CostReport(clientId, period, start, now, total, rows);
    }

    public CacheStats getCacheStats(String clientId) {
        return store.cacheStats(clientId, ReportPeriod.WEEK.start(clock.instant()).toEpochMilli());
    }

    /** Looks at the trailing week for premium-model spend, unbatched volume and a low cache-hit rate. */
    public OptimizationReport generateOptimizations(String clientId) {
        CostReport week = getClientCostReport(clientId, ReportPeriod.WEEK);
        List<Recommendation> recs = new ArrayList<>();

        for (CostSummary row : week.breakdown()) {
            if ("openai".equals(row.provider()) && "gpt-4".equals(row.resourceType()) && row.totalCost() > DOWNGRADE_THRESHOLD_USD) {
                recs.add(new Recommendation("model_downgrade", "high", row.totalCost() * 0.7,
                        "Consider using GPT-3.5-turbo for non-critical tasks",
                        "Set priority=normal for routine requests"));
            }
        }
        if (week.requestCount() > BATCHING_THRESHOLD_REQUESTS) {
            recs.add(new Recommendation("batching", "medium", week.totalCost() * 0.15,
                    "Batch similar requests to reduce API calls",
                    "Enable batch mode for bulk operations"));
        }
        CacheStats stats = getCacheStats(clientId);
        if (stats.totalRequests() > 0 && stats.hitRate() < CACHE_HIT_RATE_THRESHOLD) {
            recs.add(new Recommendation("caching", "medium", week.totalCost() * 0.2,
                    "Improve cache utilization for repeated queries",
                    "Enable aggressive caching for stable data"));
        }
        recs.sort(Comparator.comparingDouble(Recommendation::savings).reversed());

        double potential = 0;
        for (Recommendation r : recs) potential += r.savings();
        return new OptimizationReport(clientId, week.totalCost(), potential, recs);
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}

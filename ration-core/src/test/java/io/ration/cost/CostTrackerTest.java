package io.ration.cost;

import io.ration.MutableClock;
import io.ration.TestStores;
import io.ration.client.ClientInfo;
import io.ration.client.ClientRegistry;
import io.ration.core.ClientTier;
import io.ration.core.QueueItem;
import io.ration.error.ClientRegistryUnavailableException;
import io.ration.scheduler.ExecutionRecord;
import io.ration.store.InMemoryKeyValueStore;
import io.ration.store.JdbcSchedulerStore;
import io.ration.store.Json;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CostTrackerTest {
    private static final double EPS = 1e-9;

    private MutableClock clock;
    private JdbcSchedulerStore store;
    private InMemoryKeyValueStore kv;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-14T10:00:00Z");
        store = TestStores.h2();
        kv = new InMemoryKeyValueStore(clock);
    }

    private CostTracker tracker(ClientRegistry registry) {
        return new CostTracker(store, kv, Json.mapper(), registry, PriceTable.defaults(), clock);
    }

    private static QueueItem request(String id, String client) {
        return QueueItem.builder(id, client).template("digest").build();
    }

    @Test
    void actual_usage_is_priced_per_line_and_added_to_client_counters() {
        CostTracker costs = tracker(ClientRegistry.defaults());
        UsageReport usage = UsageReport.builder()
                .tokens("openai", "gpt-4", new TokenUsage(1000, 500))
                .emails(10)
                .build();

        CostBreakdown breakdown = costs.calculateRequestCost(request("r1", "acme"), usage);

        // 1000 * 0.03/1k + 500 * 0.06/1k + 10 * 0.0001
        assertEquals(0.061, breakdown.total(), EPS);
        assertEquals(2, breakdown.lines().size());

        ClientBudget budget = costs.clientBudget("acme");
        assertEquals(0.061, budget.costToday(), EPS);
        assertEquals(0.061, budget.costMonth(), EPS);
        assertEquals(1, budget.requestsToday());
        assertEquals(ClientInfo.DEFAULT_MONTHLY_BUDGET, budget.monthlyBudgetUsd(), EPS);
    }

    @Test
    void unknown_model_is_skipped_not_charged() {
        CostTracker costs = tracker(ClientRegistry.defaults());
        UsageReport usage = UsageReport.builder()
                .tokens("openai", "gpt-9", new TokenUsage(1000, 1000))
                .emails(1)
                .build();

        CostBreakdown breakdown = costs.calculateRequestCost(request("r1", "acme"), usage);

        assertEquals(1, breakdown.lines().size());
        assertEquals(0.0001, breakdown.total(), EPS);
    }

    @Test
    void estimate_uses_the_tier_model_with_split_and_margin() {
        CostTracker costs = tracker(ClientRegistry.defaults());

        // default template: 1000 openai tokens, 600 in / 400 out on gpt-4
        CostEstimate enterprise = costs.estimateCost("anything", ClientTier.ENTERPRISE);
        assertEquals((0.018 + 0.024) * 1.2, enterprise.estimated(), EPS);
        assertEquals(CostTracker.ESTIMATE_CONFIDENCE, enterprise.confidence(), EPS);

        // gpt-3.5-turbo for standard
        CostEstimate standard = costs.estimateCost("anything", ClientTier.STANDARD);
        assertEquals((600 * 0.0015 / 1000 + 400 * 0.002 / 1000) * 1.2, standard.estimated(), EPS);
    }

    @Test
    void estimate_reads_stored_template_requirements_and_is_cached() {
        store.saveTemplateRequirements("digest", "{\"apiTokens\":{\"anthropic\":2000},\"emails\":100}");
        CostTracker costs = tracker(ClientRegistry.defaults());

        CostEstimate first = costs.estimateCost("digest", ClientTier.PREMIUM);
        // claude-3-sonnet: 1200 in, 800 out, plus 100 emails
        double expected = (1200 * 0.003 / 1000 + 800 * 0.015 / 1000 + 100 * 0.0001) * 1.2;
        assertEquals(expected, first.estimated(), EPS);
        assertTrue(kv.get("cost-estimate-digest-premium").isPresent(), "estimate should be cached");

        store.saveTemplateRequirements("digest", "{\"apiTokens\":{\"anthropic\":1},\"emails\":0}");
        assertEquals(expected, costs.estimateCost("digest", ClientTier.PREMIUM).estimated(), EPS);

        kv.delete("cost-estimate-digest-premium");
        kv.delete("template-req-digest");
        assertTrue(costs.estimateCost("digest", ClientTier.PREMIUM).estimated() < expected);
    }

    @Test
    void unreadable_template_falls_back_to_defaults() {
        store.saveTemplateRequirements("broken", "not json");
        CostTracker costs = tracker(ClientRegistry.defaults());

        assertEquals(TemplateRequirements.defaults(), costs.templateRequirements("broken"));
    }

    @Test
    void budget_check_denies_when_month_spend_plus_estimate_exceeds_budget() {
        CostTracker costs = tracker(id -> new ClientInfo(id, ClientTier.PREMIUM, 1.0));
        costs.calculateRequestCost(request("r1", "acme"),
                UsageReport.builder().tokens("openai", "gpt-4", new TokenUsage(10_000, 10_000)).build());

        BudgetDecision ok = costs.checkBudget("acme", 0.05);
        assertTrue(ok.available());
        assertEquals(0.9, ok.used(), EPS);

        BudgetDecision denied = costs.checkBudget("acme", 0.2);
        assertFalse(denied.available());
        assertEquals(BudgetDecision.INSUFFICIENT_BUDGET, denied.reason());
        assertEquals(0.1, denied.remaining(), EPS);
    }

    @Test
    void unavailable_registry_falls_back_to_default_budget() {
        CostTracker costs = tracker(id -> {
            throw new ClientRegistryUnavailableException("connection refused");
        });

        ClientInfo info = costs.clientInfo("acme");
        assertEquals(ClientTier.STANDARD, info.tier());
        assertEquals(100.0, info.monthlyBudgetUsd(), EPS);
        assertTrue(costs.checkBudget("acme", 99).available());
        assertFalse(costs.checkBudget("acme", 101).available());
    }

    @Test
    void month_counters_reset_at_the_month_boundary() {
        clock = MutableClock.at("2024-01-31T23:00:00Z");
        kv = new InMemoryKeyValueStore(clock);
        CostTracker costs = tracker(ClientRegistry.defaults());
        costs.calculateRequestCost(request("r1", "acme"), UsageReport.builder().sms(100).build());
        assertEquals(0.75, costs.clientBudget("acme").costMonth(), EPS);

        clock.advanceMinutes(120);
        ClientBudget feb = costs.clientBudget("acme");
        assertEquals(0, feb.costMonth(), EPS);
        assertEquals(0, feb.costToday(), EPS);
    }

    @Test
    void cost_report_groups_by_provider_and_resource() {
        CostTracker costs = tracker(ClientRegistry.defaults());
        costs.calculateRequestCost(request("r1", "acme"),
                UsageReport.builder().tokens("openai", "gpt-4", new TokenUsage(1000, 0)).emails(1).build());
        costs.calculateRequestCost(request("r2", "acme"),
                UsageReport.builder().tokens("openai", "gpt-4", new TokenUsage(1000, 0)).build());
        costs.calculateRequestCost(request("r3", "other"), UsageReport.builder().emails(5).build());

        CostReport report = costs.getClientCostReport("acme", ReportPeriod.MONTH);

        assertEquals(0.0601, report.totalCost(), EPS);
        assertEquals(2, report.breakdown().size());
        CostSummary top = report.breakdown().get(0);
        assertEquals("gpt-4", top.resourceType());
        assertEquals(2, top.requestCount());
        assertEquals(2000, top.totalAmount(), EPS);
    }

    @Test
    void optimizations_flag_premium_spend_volume_and_cache_misses() {
        CostTracker costs = tracker(ClientRegistry.defaults());
        // $12 of gpt-4 output
        costs.calculateRequestCost(request("big", "acme"),
                UsageReport.builder().tokens("openai", "gpt-4", new TokenUsage(0, 200_000)).build());
        for (int i = 0; i < 101; i++) {
            costs.calculateRequestCost(request("m" + i, "acme"), UsageReport.builder().emails(1).build());
        }
        for (int i = 0; i < 4; i++) {
            String id = "e" + i;
            store.createExecution(ExecutionRecord.pending(id, 0, "acme", "digest", clock.millis()));
            store.completeExecution(id, 0, clock.millis(), 10, 0, null, i == 0);
        }

        OptimizationReport report = costs.generateOptimizations("acme");

        List<Recommendation> recs = report.recommendations();
        assertEquals(3, recs.size());
        assertEquals("model_downgrade", recs.get(0).type());
        assertEquals(12 * 0.7, recs.get(0).savings(), 1e-6);
        assertTrue(recs.stream().anyMatch(r -> r.type().equals("batching")), "expected batching advice");
        assertTrue(recs.stream().anyMatch(r -> r.type().equals("caching")), "expected caching advice");
        for (int i = 1; i < recs.size(); i++) {
            assertTrue(recs.get(i - 1).savings() >= recs.get(i).savings(), "sorted by savings");
        }
        double sum = recs.stream().mapToDouble(Recommendation::savings).sum();
        assertEquals(sum, report.potentialSavings(), EPS);
    }

    @Test
    void no_cache_advice_without_completed_executions() {
        CostTracker costs = tracker(ClientRegistry.defaults());
        costs.calculateRequestCost(request("r1", "acme"), UsageReport.builder().emails(1).build());

        assertTrue(costs.generateOptimizations("acme").recommendations().isEmpty());
    }
}

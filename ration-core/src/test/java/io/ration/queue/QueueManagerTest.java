package io.ration.queue;

import io.ration.MutableClock;
import io.ration.TestStores;
import io.ration.core.ClientTier;
import io.ration.core.QueueItem;
import io.ration.core.ResourceRequirements;
import io.ration.core.Urgency;
import io.ration.metrics.Metrics;
import io.ration.pool.AllocationRequest;
import io.ration.pool.QuotaDefinition;
import io.ration.pool.ResourceDescriptor;
import io.ration.pool.ResourcePool;
import io.ration.pool.UnitPrice;
import io.ration.store.InMemoryKeyValueStore;
import io.ration.store.JdbcSchedulerStore;
import io.ration.store.Json;
import io.ration.store.KeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class QueueManagerTest {
    private static final long TEN_MINUTES = 600_000L;

    private MutableClock clock;
    private JdbcSchedulerStore store;
    private KeyValueStore kv;
    private ResourcePool pool;
    private QueueManager queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        store = TestStores.h2();
        kv = new InMemoryKeyValueStore(clock);
        pool = new ResourcePool(
                List.of(ResourceDescriptor.of("tokens", "Tokens", "llm", 1000, 10, UnitPrice.perThousand(0.001, 0.002))),
                List.<QuotaDefinition>of(), store, kv, Json.mapper(), Metrics.noop(), clock, clock.sleeper(), 300_000);
        queue = newQueue();
    }

    private QueueManager newQueue() {
        return new QueueManager(pool, store, kv, Json.mapper(), Metrics.noop(), clock, TEN_MINUTES, 10);
    }

    private static QueueItem item(String id, String client, ClientTier tier, Urgency urgency) {
        return QueueItem.builder(id, client).tier(tier).urgency(urgency).template("research").build();
    }

    @Test
    void first_request_lands_in_immediate_queue_and_later_ones_pay_depth_penalty() {
        EnqueueResult first = queue.enqueue(item("r1", "a", ClientTier.STANDARD, Urgency.NORMAL));
        assertEquals(WaitClass.IMMEDIATE, first.queue());
        assertEquals(0, first.estimatedWaitMillis());

        EnqueueResult second = queue.enqueue(item("r2", "a", ClientTier.STANDARD, Urgency.NORMAL));
        assertEquals(WaitClass.FAST, second.queue());
        assertEquals(1_000, second.estimatedWaitMillis());
        assertEquals(clock.millis() + 1_000, second.estimatedStart());
    }

    @Test
    void resource_wait_selects_the_queue() {
        QueueItem big = QueueItem.builder("big", "a").template("research")
                .requirements(ResourceRequirements.builder().put("tokens", 1500).build()).build();
        // 1500 against 1000 shared + 100 reserved: wait for 500 shared tokens at 10/s
        EnqueueResult r = queue.enqueue(big);
        assertEquals(50_000, r.estimatedWaitMillis());
        assertEquals(WaitClass.NORMAL, r.queue());
    }

    @Test
    void same_urgency_requests_leave_in_tier_order() {
        queue.enqueue(item("basic", "a", ClientTier.BASIC, Urgency.NORMAL));
        queue.enqueue(item("premium", "b", ClientTier.PREMIUM, Urgency.NORMAL));
        queue.enqueue(item("enterprise", "c", ClientTier.ENTERPRISE, Urgency.NORMAL));

        assertEquals("enterprise", queue.getNextExecutable().orElseThrow().requestId());
        assertEquals("premium", queue.getNextExecutable().orElseThrow().requestId());
        assertEquals("basic", queue.getNextExecutable().orElseThrow().requestId());
    }

    @Test
    void depth_penalty_counts_only_work_of_equal_or_higher_priority() {
        queue.enqueue(item("filler", "f", ClientTier.STANDARD, Urgency.NORMAL));
        EnqueueResult basic = queue.enqueue(item("basic", "a", ClientTier.BASIC, Urgency.NORMAL));
        EnqueueResult ent = queue.enqueue(item("ent", "b", ClientTier.ENTERPRISE, Urgency.NORMAL));

        assertEquals(WaitClass.FAST, basic.queue());
        assertEquals(1_000, basic.estimatedWaitMillis());
        assertEquals(WaitClass.IMMEDIATE, ent.queue());
        assertEquals(0, ent.estimatedWaitMillis());
        assertEquals(0, ent.position());
        assertEquals(1, queue.position("filler").orElseThrow().position());
    }

    @Test
    void equal_priority_keeps_arrival_order() {
        queue.enqueue(item("filler", "f", ClientTier.STANDARD, Urgency.NORMAL));
        queue.enqueue(item("b1", "a", ClientTier.BASIC, Urgency.LOW));
        queue.enqueue(item("b2", "b", ClientTier.BASIC, Urgency.LOW));
        assertEquals(0, queue.position("b1").orElseThrow().position());
        assertEquals(1, queue.position("b2").orElseThrow().position());

        assertEquals("filler", queue.getNextExecutable().orElseThrow().requestId());
        assertEquals("b1", queue.getNextExecutable().orElseThrow().requestId());
        assertEquals("b2", queue.getNextExecutable().orElseThrow().requestId());
        assertTrue(queue.getNextExecutable().isEmpty());
    }

    @Test
    void priority_combines_tier_urgency_fairness_sla_and_retry_boost() {
        long now = clock.millis();
        QueueItem premiumHigh = QueueItem.builder("p", "c").tier(ClientTier.PREMIUM).urgency(Urgency.HIGH)
                .slaDeadline(now + 30 * 60_000L).build();
        Priority p = queue.calculatePriority(premiumHigh, now);
        assertEquals(30 + 20 + 10 + 10, p.value());
        assertTrue(p.reason().contains("tier:premium(30)"), p.reason());
        assertTrue(p.reason().contains("sla:10"), p.reason());

        QueueItem maxed = QueueItem.builder("m", "c").tier(ClientTier.ENTERPRISE).urgency(Urgency.URGENT)
                .slaDeadline(now + 60_000L).build().retried(20);
        assertEquals(Priority.MAX, queue.calculatePriority(maxed, now).value());

        QueueItem dayAway = QueueItem.builder("d", "c").tier(ClientTier.BASIC).urgency(Urgency.LOW)
                .slaDeadline(now + 2 * 3_600_000L).build();
        assertEquals(10 + 0 + 10 + 5, queue.calculatePriority(dayAway, now).value());
    }

    @Test
    void fairness_bonus_shrinks_with_recent_volume_and_resets_hourly() {
        for (int i = 0; i < 25; i++) {
            queue.enqueue(item("burst-" + i, "bursty", ClientTier.STANDARD, Urgency.NORMAL));
        }
        assertEquals(8, queue.fairnessScore("bursty", clock.millis()));
        assertEquals(10, queue.fairnessScore("quiet", clock.millis()));

        clock.advanceMillis(QueueManager.FAIRNESS_WINDOW_MILLIS + 1);
        assertEquals(10, queue.fairnessScore("bursty", clock.millis()));
    }

    @Test
    void starved_low_priority_request_runs_before_fresh_enterprise_work() {
        queue.enqueue(item("filler", "f", ClientTier.STANDARD, Urgency.NORMAL));
        assertEquals("filler", queue.getNextExecutable().orElseThrow().requestId());

        queue.enqueue(item("filler2", "f", ClientTier.STANDARD, Urgency.NORMAL));
        queue.enqueue(item("old-basic", "a", ClientTier.BASIC, Urgency.LOW));
        assertEquals("filler2", queue.getNextExecutable().orElseThrow().requestId());

        clock.advanceMinutes(11);
        queue.enqueue(item("fresh-ent", "b", ClientTier.ENTERPRISE, Urgency.URGENT));
        assertEquals(1, queue.getQueueStatus().starved());

        assertEquals("old-basic", queue.getNextExecutable().orElseThrow().requestId());
        assertEquals("fresh-ent", queue.getNextExecutable().orElseThrow().requestId());
    }

    @Test
    void low_priority_request_survives_a_steady_stream_of_urgent_arrivals() {
        queue.enqueue(item("low", "a", ClientTier.BASIC, Urgency.LOW));

        int releasedAt = -1;
        for (int minute = 1; minute <= 20; minute++) {
            clock.advanceMinutes(1);
            queue.enqueue(item("hot-" + minute, "hot", ClientTier.ENTERPRISE, Urgency.URGENT));
            QueueItem next = queue.getNextExecutable().orElseThrow();
            if (next.requestId().equals("low")) {
                releasedAt = minute;
                break;
            }
            assertEquals("hot-" + minute, next.requestId());
        }
        // threshold is ten minutes; the first pass after it elapses must pick the old request
        assertEquals(11, releasedAt);
    }

    @Test
    void requeue_does_not_reset_the_starvation_clock() {
        queue.enqueue(item("r", "a", ClientTier.BASIC, Urgency.LOW));
        QueueItem taken = queue.getNextExecutable().orElseThrow();
        clock.advanceMinutes(6);
        queue.enqueue(taken.requeued(0));
        assertEquals(0, queue.getQueueStatus().starved());

        clock.advanceMinutes(5);
        queue.enqueue(item("fresh", "b", ClientTier.ENTERPRISE, Urgency.URGENT));
        assertEquals(1, queue.getQueueStatus().starved());
        assertEquals("r", queue.getNextExecutable().orElseThrow().requestId());
    }

    @Test
    void request_over_its_family_quota_is_not_executable() throws Exception {
        ResourcePool quoted = new ResourcePool(
                List.of(ResourceDescriptor.of("tokens", "Tokens", "llm", 1000, 10, UnitPrice.perThousand(0.001, 0.002))),
                List.of(new QuotaDefinition("tokens-hourly", "tokens", 3_600_000L, 100)),
                store, kv, Json.mapper(), Metrics.noop(), clock, clock.sleeper(), 300_000);
        QueueManager q = new QueueManager(quoted, store, kv, Json.mapper(), Metrics.noop(), clock, TEN_MINUTES, 10);
        assertTrue(quoted.allocate(new AllocationRequest("tokens", 80, "x", ClientTier.BASIC, Urgency.NORMAL, "used")).success());

        QueueItem need = QueueItem.builder("need", "a").template("research")
                .requirements(ResourceRequirements.builder().put("tokens", 50).build()).build();
        q.enqueue(need);
        assertTrue(q.getNextExecutable().isEmpty(), "bucket has room but the hourly quota does not");

        clock.advanceMillis(3_600_001L);
        assertEquals("need", q.getNextExecutable().orElseThrow().requestId());
    }

    @Test
    void requeued_request_past_the_threshold_gets_the_starvation_boost() {
        queue.enqueue(item("r", "a", ClientTier.BASIC, Urgency.LOW));
        QueueItem taken = queue.getNextExecutable().orElseThrow();
        clock.advanceMinutes(11);

        EnqueueResult again = queue.enqueue(taken.requeued(5_000));
        assertEquals(QueueManager.STARVATION_BOOST, again.priorityReason());
        int unboosted = queue.calculatePriority(taken, clock.millis()).value();
        assertEquals(unboosted + 10, again.priority());
    }

    @Test
    void requests_that_cannot_get_resources_are_skipped() {
        QueueItem big = QueueItem.builder("big", "a").template("research")
                .requirements(ResourceRequirements.builder().put("tokens", 1500).build()).build();
        queue.enqueue(big);
        queue.enqueue(item("small", "b", ClientTier.BASIC, Urgency.LOW));

        assertFalse(queue.canExecute(big));
        assertEquals("small", queue.getNextExecutable().orElseThrow().requestId());
        assertTrue(queue.getNextExecutable().isEmpty());
        assertEquals(1, queue.totalDepth());
    }

    @Test
    void client_concurrency_is_capped_by_tier() {
        for (int i = 0; i < 6; i++) queue.enqueue(item("b" + i, "basic-client", ClientTier.BASIC, Urgency.NORMAL));
        for (int i = 0; i < 5; i++) {
            QueueItem next = queue.getNextExecutable().orElseThrow();
            queue.markExecuting(next);
        }
        assertEquals(5, queue.executingCount("basic-client"));
        assertTrue(queue.getNextExecutable().isEmpty(), "basic tier allows five concurrent requests");

        queue.markCompleted("b0");
        assertEquals("b5", queue.getNextExecutable().orElseThrow().requestId());
    }

    @Test
    void cancel_is_idempotent() {
        queue.enqueue(item("c1", "a", ClientTier.STANDARD, Urgency.NORMAL));
        assertTrue(queue.removeFromQueue("c1"));
        assertFalse(queue.removeFromQueue("c1"));
        assertTrue(queue.position("c1").isEmpty());
        assertEquals(0, queue.totalDepth());
    }

    @Test
    void state_round_trip_restores_queues_and_fairness() {
        queue.enqueue(item("s1", "a", ClientTier.STANDARD, Urgency.NORMAL));
        queue.enqueue(item("s2", "a", ClientTier.PREMIUM, Urgency.HIGH));
        queue.saveState();

        QueueManager restored = newQueue();
        restored.loadState();
        assertEquals(2, restored.totalDepth());
        Optional<QueuePosition> s2 = restored.position("s2");
        assertEquals(WaitClass.IMMEDIATE, s2.orElseThrow().queue());
        assertEquals(0, s2.orElseThrow().position());
        assertEquals(1, restored.position("s1").orElseThrow().position());
        assertEquals(queue.fairnessScore("a", clock.millis()), restored.fairnessScore("a", clock.millis()));
    }

    @Test
    void queue_status_reports_depths_and_executing() {
        queue.enqueue(item("q1", "a", ClientTier.STANDARD, Urgency.NORMAL));
        queue.enqueue(item("q2", "a", ClientTier.STANDARD, Urgency.NORMAL));
        queue.markExecuting(queue.getNextExecutable().orElseThrow());

        QueueStatus status = queue.getQueueStatus();
        assertEquals(1, status.total());
        assertEquals(1, status.executing());
        assertEquals(0, status.queues().get("immediate").depth());
        assertEquals(1, status.queues().get("fast").depth());
        assertEquals(Long.valueOf(clock.millis()), status.queues().get("fast").oldestEnqueuedAt());
        assertNull(status.queues().get("deferred").oldestEnqueuedAt());
    }

    @Test
    void blocked_request_becomes_runnable_once_the_bucket_refills() throws Exception {
        pool.allocate(new AllocationRequest("tokens", 1000, "x", ClientTier.BASIC, Urgency.NORMAL, "drain"));
        QueueItem need = QueueItem.builder("need", "a").template("research")
                .requirements(ResourceRequirements.builder().put("tokens", 150).build()).build();
        queue.enqueue(need);
        // 100 reserved tokens are not enough for 150; the shared bucket needs 15s
        assertTrue(queue.getNextExecutable().isEmpty());

        clock.advanceSeconds(5);
        assertEquals("need", queue.getNextExecutable().orElseThrow().requestId());
    }
}

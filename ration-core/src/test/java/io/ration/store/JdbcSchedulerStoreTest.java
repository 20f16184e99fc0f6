package io.ration.store;

import io.ration.TestStores;
import io.ration.error.FailureReason;
import io.ration.scheduler.Alert;
import io.ration.scheduler.ExecutionRecord;
import io.ration.scheduler.ExecutionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JdbcSchedulerStoreTest {
    private JdbcSchedulerStore store;

    @BeforeEach
    void setUp() {
        store = TestStores.h2();
    }

    @Test
    void schema_init_is_repeatable() {
        assertDoesNotThrow(store::initSchema);
    }

    @Test
    void execution_moves_through_statuses_and_stops_at_terminal() {
        store.createExecution(ExecutionRecord.pending("r1", 0, "acme", "digest", 1_000));

        assertTrue(store.updateExecutionStatus("r1", 0, ExecutionStatus.EXECUTING, 2_000));
        assertTrue(store.completeExecution("r1", 0, 3_000, 1_000, 0.25, "{\"ok\":true}", true));

        ExecutionRecord done = store.latestExecution("r1").orElseThrow();
        assertEquals(ExecutionStatus.COMPLETED, done.status());
        assertEquals(Long.valueOf(2_000), done.startedAt());
        assertEquals(Long.valueOf(1_000), done.durationMillis());
        assertEquals(0.25, done.totalCostUsd(), 1e-9);
        assertTrue(done.cacheHit());

        assertFalse(store.failExecution("r1", 0, FailureReason.CANCELLED, "late", 4_000), "terminal record must not change");
        assertFalse(store.completeExecution("r1", 0, 4_000, 1, 9, null, false));
        assertFalse(store.updateExecutionStatus("r1", 0, ExecutionStatus.EXECUTING, 4_000));
        assertEquals(ExecutionStatus.COMPLETED, store.latestExecution("r1").orElseThrow().status());
    }

    @Test
    void retries_are_separate_attempts() {
        store.createExecution(ExecutionRecord.pending("r1", 0, "acme", "digest", 1_000));
        assertTrue(store.failExecution("r1", 0, FailureReason.EXECUTOR_FAILURE, "boom", 2_000));
        store.createExecution(ExecutionRecord.pending("r1", 1, "acme", "digest", 3_000));

        List<ExecutionRecord> all = store.executions("r1");
        assertEquals(2, all.size());
        assertEquals(FailureReason.EXECUTOR_FAILURE, all.get(0).failureReason());
        assertEquals("boom", all.get(0).errorMessage());
        assertEquals(1, store.latestExecution("r1").orElseThrow().attempt());
        assertTrue(store.latestExecution("missing").isEmpty());
    }

    @Test
    void alerts_are_listed_newest_first() {
        Alert first = store.insertAlert(Alert.of(Alert.Type.QUEUE_BACKUP, Alert.Severity.WARNING, null,
                "Queue backup", Map.of("total", 1200), 1_000));
        store.insertAlert(Alert.of(Alert.Type.BUDGET_EXCEEDED, Alert.Severity.CRITICAL, "acme",
                "Budget exceeded", Map.of("required", 2.5), 2_000));

        assertNotNull(first.id());
        List<Alert> open = store.openAlerts(10);
        assertEquals(2, open.size());
        assertEquals(Alert.Type.BUDGET_EXCEEDED, open.get(0).type());
        assertEquals("acme", open.get(0).clientId());
        assertEquals(1200, ((Number) open.get(1).details().get("total")).intValue());
        assertEquals(1, store.openAlerts(1).size());
    }

    @Test
    void template_requirements_are_upserted() {
        assertTrue(store.templateRequirements("digest").isEmpty());
        store.saveTemplateRequirements("digest", "{\"emails\":1}");
        store.saveTemplateRequirements("digest", "{\"emails\":2}");

        assertEquals("{\"emails\":2}", store.templateRequirements("digest").orElseThrow());
    }

    @Test
    void unreachable_database_raises_store_exception() {
        JdbcSchedulerStore broken = new JdbcSchedulerStore("jdbc:nope:nowhere", null, null);

        assertThrows(StoreException.class, () -> broken.latestExecution("r1"));
    }
}

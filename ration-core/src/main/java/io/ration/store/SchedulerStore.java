package io.ration.store;

import io.ration.core.QueueItem;
import io.ration.cost.CacheStats;
import io.ration.cost.ClientBudget;
import io.ration.cost.CostLine;
import io.ration.cost.CostSummary;
import io.ration.pool.DedicatedPoolConfig;
import io.ration.pool.ResourceAllocation;
import io.ration.scheduler.Alert;
import io.ration.scheduler.ExecutionRecord;
import io.ration.scheduler.ExecutionStatus;
import io.ration.error.FailureReason;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Relational persistence used by the pool, queue, cost tracker and scheduler. Implementations throw
 * {@link StoreException} when the backing store fails.
 */
public interface SchedulerStore {

    // allocations

    void recordAllocation(ResourceAllocation allocation);

    void markAllocationReleased(String allocationId, long releasedAt, boolean rolledBack);

    Optional<DedicatedPoolConfig> findDedicatedPool(String clientId, String resourceType);

    void saveDedicatedPool(DedicatedPoolConfig config);

    // queue rows

    void recordQueued(QueueItem item, String queueName, int position, long estimatedWaitMillis);

    void updateQueueStatus(String requestId, String status, String errorMessage, long at);

    // execution records

    void createExecution(ExecutionRecord record);

    /**
     * Moves a non-terminal record to {@code status}. Returns false if the record is missing or already terminal.
     */
    boolean updateExecutionStatus(String requestId, int attempt, ExecutionStatus status, long at);

    boolean completeExecution(String requestId, int attempt, long completedAt, long durationMillis,
                              double totalCostUsd, String outputData, boolean cacheHit);

    boolean failExecution(String requestId, int attempt, FailureReason reason, String errorMessage, long completedAt);

    Optional<ExecutionRecord> latestExecution(String requestId);

    List<ExecutionRecord> executions(String requestId);

    // cost

    /**
     * Inserts every cost line and adds {@code total} to the client's counters for {@code day} in one transaction.
     */
    void recordCosts(String requestId, String clientId, List<CostLine> lines, double total, LocalDate day, long at);

    /** Counters for {@code day} and the month containing it. The budget ceiling is left at zero. */
    ClientBudget clientBudget(String clientId, LocalDate day);

    List<CostSummary> costSummary(String clientId, long sinceMillis);

    CacheStats cacheStats(String clientId, long sinceMillis);

    Optional<String> templateRequirements(String templateName);

    void saveTemplateRequirements(String templateName, String requirementsJson);

    // alerts

    Alert insertAlert(Alert alert);

    List<Alert> openAlerts(int limit);
}

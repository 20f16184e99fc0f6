package io.ration.admission;

import io.ration.core.ClientTier;
import io.ration.core.QueueItem;
import io.ration.cost.BudgetDecision;
import io.ration.cost.ClientBudget;
import io.ration.cost.CostEstimate;
import io.ration.cost.CostReport;
import io.ration.cost.CostTracker;
import io.ration.cost.OptimizationReport;
import io.ration.cost.ReportPeriod;
import io.ration.error.BudgetExceededException;
import io.ration.error.FailureReason;
import io.ration.pool.Availability;
import io.ration.pool.PoolStatus;
import io.ration.pool.ResourcePool;
import io.ration.queue.EnqueueResult;
import io.ration.queue.QueueManager;
import io.ration.queue.QueuePosition;
import io.ration.queue.QueueStatus;
import io.ration.scheduler.Alert;
import io.ration.scheduler.ExecutionRecord;
import io.ration.scheduler.Scheduler;
import io.ration.store.SchedulerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Operations an outer API layer calls: admit, cancel and inspect requests, and query pools, queues and costs.
 * Admission errors are raised synchronously; execution outcomes are recorded and notified later by the scheduler.
 */
public class AdmissionService {
    private static final Logger log = LoggerFactory.getLogger(AdmissionService.class);

    private final ResourcePool pool;
    private final QueueManager queue;
    private final CostTracker costs;
    private final Scheduler scheduler;
    private final SchedulerStore store;
    private final Clock clock;

    public AdmissionService(ResourcePool pool, QueueManager queue, CostTracker costs, Scheduler scheduler,
                            SchedulerStore store, Clock clock) {
        this.pool = Objects.requireNonNull(pool);
        this.queue = Objects.requireNonNull(queue);
        this.costs = Objects.requireNonNull(costs);
        this.scheduler = Objects.requireNonNull(scheduler);
        this.store = Objects.requireNonNull(store);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Validates the requirements, estimates the cost when the caller did not supply one, checks the client's budget
     * and queues the request.
     *
     * @throws IllegalArgumentException if the template is missing or a resource type is unknown
     * @throws BudgetExceededException if the estimate does not fit the client's remaining monthly budget
     */
    public AdmissionResult enqueue(QueueItem request) {
        if (request.templateName() == null || request.templateName().isBlank()) {
            throw new IllegalArgumentException("templateName is required");
        }
        request.requirements().validate(pool::isKnown);

        double estimated = request.estimatedCost() > 0
                ? request.estimatedCost()
                : costs.estimateCost(request.templateName(), request.clientTier()).estimated();
        BudgetDecision budget = costs.checkBudget(request.clientId(), estimated);
        if (!budget.available()) {
            log.info("Refused {} for client {}: remaining {} < required {}", request.requestId(), request.clientId(),
                    budget.remaining(), budget.required());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("requestId", request.requestId());
            details.put("budget", budget.budget());
            details.put("used", budget.used());
            details.put("required", budget.required());
            store.insertAlert(Alert.of(Alert.Type.BUDGET_EXCEEDED, Alert.Severity.CRITICAL, request.clientId(),
                    "Budget exceeded for client " + request.clientId() + " at admission", details, clock.millis()));
            throw new BudgetExceededException(request.clientId(), budget);
        }

        EnqueueResult placed = scheduler.submit(request.withEstimatedCost(estimated));
        log.info("Admitted {} for client {} into {} at {} (priority {})", placed.requestId(), request.clientId(),
                placed.queueName(), placed.position(), placed.priority());
        return new AdmissionResult(placed, estimated);
    }

    /**
     * Removes a queued request. Returns false when it is not queued, including when it already started or was
     * cancelled before.
     */
    public boolean cancel(String requestId) {
        Optional<ExecutionRecord> latest = store.latestExecution(requestId);
        if (!queue.removeFromQueue(requestId)) return false;
        latest.ifPresent(r -> store.failExecution(requestId, r.attempt(), FailureReason.CANCELLED,
                "Cancelled while queued", clock.millis()));
        log.info("Cancelled {}", requestId);
        return true;
    }

    public Availability checkAvailability(String resourceType, double amount) {
        return pool.checkAvailability(resourceType, amount);
    }

    public CostEstimate estimateCost(String templateName, ClientTier tier) {
        return costs.estimateCost(templateName, tier == null ? ClientTier.STANDARD : tier);
    }

    public Map<String, PoolStatus> getStatus() {
        return pool.getStatus();
    }

    public QueueStatus getQueueStatus() {
        return queue.getQueueStatus();
    }

    public Optional<QueuePosition> getPosition(String requestId) {
        return queue.position(requestId);
    }

    public Optional<ExecutionRecord> getExecutionStatus(String requestId) {
        return scheduler.getExecutionStatus(requestId);
    }

    public List<ExecutionRecord> getExecutionHistory(String requestId) {
        return store.executions(requestId);
    }

    public ClientBudget getClientUsage(String clientId) {
        return costs.clientBudget(clientId);
    }

    public CostReport getCostReport(String clientId, ReportPeriod period) {
        return costs.getClientCostReport(clientId, period);
    }

    public OptimizationReport getOptimizations(String clientId) {
        return costs.generateOptimizations(clientId);
    }

    public List<Alert> getAlerts(int limit) {
        return scheduler.openAlerts(limit);
    }
}

package io.ration.scheduler;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Timer;
import io.ration.config.SchedulerConfig;
import io.ration.core.QueueItem;
import io.ration.cost.BudgetDecision;
import io.ration.cost.CostBreakdown;
import io.ration.cost.CostTracker;
import io.ration.error.FailureReason;
import io.ration.error.MaxRequeueExceededException;
import io.ration.error.SchedulingException;
import io.ration.executor.WorkerExecutor;
import io.ration.executor.WorkerRequest;
import io.ration.executor.WorkerResponse;
import io.ration.metrics.Metrics;
import io.ration.notify.Notifier;
import io.ration.optimize.OptimizationResult;
import io.ration.optimize.RequestOptimizer;
import io.ration.pool.AllocationRequest;
import io.ration.pool.AllocationResult;
import io.ration.pool.PoolStatus;
import io.ration.pool.ResourceAllocation;
import io.ration.pool.ResourcePool;
import io.ration.queue.EnqueueResult;
import io.ration.queue.QueueManager;
import io.ration.queue.QueueStatus;
import io.ration.retry.RetryPolicy;
import io.ration.store.SchedulerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Control loop that takes runnable requests off the queues, gates them on budget, reserves every resource they
 * need and hands them to the worker. Outcomes are recorded per attempt; executor failures are retried, reservation
 * failures are requeued.
 */
public class Scheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    static final long ERROR_BACKOFF_MILLIS = 1_000L;
    static final double RESOURCE_LOW_PERCENT = 10.0;
    static final int QUEUE_BACKUP_DEPTH = 1_000;

    private final QueueManager queue;
    private final ResourcePool pool;
    private final CostTracker costs;
    private final RequestOptimizer optimizer;
    private final WorkerExecutor executor;
    private final Notifier notifier;
    private final SchedulerStore store;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final SchedulerConfig config;

    private final ExecutorService dispatchPool;
    private final ScheduledExecutorService maintenance;
    private final Map<String, CompletableFuture<Void>> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread loopThread;

    private final Counter dispatched;
    private final Counter completed;
    private final Counter failed;
    private final Counter retried;
    private final Counter requeued;
    private final Counter budgetDenied;
    private final Timer executionTimer;

    public Scheduler(QueueManager queue,
                     ResourcePool pool,
                     CostTracker costs,
                     RequestOptimizer optimizer,
                     WorkerExecutor executor,
                     Notifier notifier,
                     SchedulerStore store,
                     RetryPolicy retryPolicy,
                     Metrics metrics,
                     Clock clock,
                     SchedulerConfig config) {
        this.queue = Objects.requireNonNull(queue);
        this.pool = Objects.requireNonNull(pool);
        this.costs = Objects.requireNonNull(costs);
        this.optimizer = optimizer == null ? RequestOptimizer.identity() : optimizer;
        this.executor = Objects.requireNonNull(executor);
        this.notifier = Objects.requireNonNull(notifier);
        this.store = Objects.requireNonNull(store);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.config = Objects.requireNonNull(config);
        this.dispatchPool = Executors.newFixedThreadPool(Math.max(1, config.dispatchThreads()), daemon("scheduler-dispatch"));
        this.maintenance = Executors.newSingleThreadScheduledExecutor(daemon("scheduler-maintenance"));
        this.dispatched = metrics.counter("scheduler.dispatched");
        this.completed = metrics.counter("scheduler.completed");
        this.failed = metrics.counter("scheduler.failed");
        this.retried = metrics.counter("scheduler.retried");
        this.requeued = metrics.counter("scheduler.requeued");
        this.budgetDenied = metrics.counter("scheduler.budget.denied");
        this.executionTimer = metrics.timer("scheduler.execution.time");
        metrics.gauge("scheduler.inflight", inFlight::size);
    }

    public void start() {
        if (!running.compareAndSet(false, true)) return;
        loopThread = new Thread(this::runLoop, "scheduler-loop");
        loopThread.start();
        long every = Math.max(1, config.maintenanceIntervalMillis());
        maintenance.scheduleWithFixedDelay(this::runMaintenance, every, every, TimeUnit.MILLISECONDS);
        log.info("Scheduler started with {} dispatch threads", config.dispatchThreads());
    }

    /** Stops taking new work. Requests already dispatched are left to finish. */
    public void stop() {
        if (!running.compareAndSet(true, false)) return;
        Thread t = loopThread;
        if (t != null) {
            try {
                t.join(5000);
                if (t.isAlive()) {
                    t.interrupt();
                    t.join(1000);
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
        maintenance.shutdown();
        log.info("Scheduler stopped with {} requests in flight", inFlight.size());
    }

    public boolean isRunning() { return running.get(); }

    public int inFlightCount() { return inFlight.size(); }

    @Override
    public void close() {
        stop();
        maintenance.shutdownNow();
        dispatchPool.shutdown();
    }

    /**
     * Creates the pending record for the request's current attempt and queues it. Used for new admissions and for
     * retries.
     */
    public EnqueueResult submit(QueueItem item) {
        store.createExecution(ExecutionRecord.pending(item.requestId(), item.attempt(), item.clientId(),
                item.templateName(), clock.millis()));
        return queue.enqueue(item);
    }

    /**
     * One pass of the control loop. Returns false when nothing was runnable.
     *
     * @throws InterruptedException if interrupted while waiting on a shared bucket; the request is put back first
     */
    public boolean scheduleNext() throws InterruptedException {
        Optional<QueueItem> next = queue.getNextExecutable();
        if (next.isEmpty()) return false;
        QueueItem item = next.get();
        try {
            dispatch(item);
        } catch (InterruptedException ie) {
            queue.enqueue(item);
            throw ie;
        } catch (RuntimeException e) {
            log.error("Could not schedule {}", item.requestId(), e);
            failTerminally(item, FailureReason.EXECUTOR_FAILURE, e.getMessage());
        }
        return true;
    }

    private void dispatch(QueueItem item) throws InterruptedException {
        OptimizationResult optimization = optimizer.optimize(item);
        QueueItem request = optimization.optimized();
        if (optimization.changed()) {
            log.debug("Optimized {}: {} saving ~${}", request.requestId(), optimization.applied(),
                    String.format("%.4f", optimization.estimatedSavings()));
        }
        if (optimization.deferUntil() != null) {
            log.debug("Request {} could defer until {} for off-peak pricing", request.requestId(), optimization.deferUntil());
        }

        double estimate = request.estimatedCost() > 0 ? request.estimatedCost() : config.defaultEstimatedCost();
        BudgetDecision budget = costs.checkBudget(request.clientId(), estimate);
        if (!budget.available()) {
            denyOnBudget(request, budget);
            return;
        }

        Reservation reservation = reserve(request);
        if (!reservation.success()) {
            requeue(request, reservation.failure());
            return;
        }

        long startedAt = clock.millis();
        queue.markExecuting(request);
        try {
            store.updateExecutionStatus(request.requestId(), request.attempt(), ExecutionStatus.EXECUTING, startedAt);
            store.updateQueueStatus(request.requestId(), "executing", null, startedAt);
            WorkerRequest call = WorkerRequest.of(request, config.executorTimeout().toMillis());
            dispatched.inc();
            log.info("Dispatching {} attempt {} for client {}", request.requestId(), request.attempt(), request.clientId());

            Timer.Context timing = executionTimer.time();
            CompletableFuture<Void> done = CompletableFuture
                    .supplyAsync(() -> executor.execute(call), dispatchPool)
                    .thenCompose(f -> f)
                    .orTimeout(call.timeoutMillis(), TimeUnit.MILLISECONDS)
                    .handleAsync((response, error) -> {
                        timing.stop();
                        if (error == null) onSuccess(request, reservation, response, startedAt);
                        else onFailure(request, reservation, error);
                        return null;
                    }, dispatchPool);
            inFlight.put(request.requestId(), done);
            done.whenComplete((v, e) -> inFlight.remove(request.requestId(), done));
        } catch (RuntimeException e) {
            // nothing reached the worker, so the capacity goes back
            rollback(reservation.allocations());
            queue.markCompleted(request.requestId());
            throw e;
        }
    }

    /** Reserves in declaration order. On the first decline everything already held is rolled back. */
    Reservation reserve(QueueItem request) throws InterruptedException {
        List<ResourceAllocation> held = new ArrayList<>();
        try {
            for (String type : request.requirements().types()) {
                AllocationResult result = pool.allocate(new AllocationRequest(type, request.requirements().amount(type),
                        request.clientId(), request.clientTier(), request.urgency(), request.requestId()));
                if (!result.success()) {
                    rollback(held);
                    return Reservation.declined(result);
                }
                held.add(result.allocation());
            }
        } catch (InterruptedException | RuntimeException e) {
            rollback(held);
            throw e;
        }
        return Reservation.reserved(held);
    }

    private void rollback(List<ResourceAllocation> held) {
        for (int i = held.size() - 1; i >= 0; i--) {
            try {
                pool.rollback(held.get(i));
            } catch (RuntimeException e) {
                log.error("Rollback of allocation {} failed", held.get(i).allocationId(), e);
            }
        }
    }

    private void release(Reservation reservation) {
        for (ResourceAllocation a : reservation.allocations()) {
            try {
                pool.release(a);
            } catch (RuntimeException e) {
                log.error("Release of allocation {} failed", a.allocationId(), e);
            }
        }
    }

    private void requeue(QueueItem request, AllocationResult decline) {
        QueueItem next = request.requeued(decline.retryAfterMillis());
        if (next.requeueCount() > config.maxRequeues()) {
            log.warn("Request {} exceeded {} requeues, last decline {} on {}", request.requestId(),
                    config.maxRequeues(), decline.reason().code(), decline.resourceType());
            MaxRequeueExceededException e = new MaxRequeueExceededException(request.requestId(), config.maxRequeues());
            failTerminally(next, e.reason(), e.getMessage() + ": " + decline.toException().getMessage());
            return;
        }
        requeued.inc();
        queue.enqueue(next);
        log.debug("Requeued {} ({} on {}, retry after {}ms)", request.requestId(), decline.reason().code(),
                decline.resourceType(), decline.retryAfterMillis());
    }

    private void denyOnBudget(QueueItem request, BudgetDecision budget) {
        budgetDenied.inc();
        failed.inc();
        long now = clock.millis();
        log.warn("Budget exceeded for client {}: used {} of {}, request {} needs {}", request.clientId(),
                budget.used(), budget.budget(), request.requestId(), budget.required());
        store.failExecution(request.requestId(), request.attempt(), FailureReason.BUDGET_EXCEEDED, budget.reason(), now);
        store.updateQueueStatus(request.requestId(), "failed", budget.reason(), now);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requestId", request.requestId());
        details.put("budget", budget.budget());
        details.put("used", budget.used());
        details.put("required", budget.required());
        store.insertAlert(Alert.of(Alert.Type.BUDGET_EXCEEDED, Alert.Severity.CRITICAL, request.clientId(),
                "Budget exceeded for client " + request.clientId(), details, now));
        notifier.notifyBudgetExceeded(request, budget);
    }

    private void onSuccess(QueueItem request, Reservation reservation, WorkerResponse response, long startedAt) {
        try {
            CostBreakdown cost = costs.calculateRequestCost(request, response.usage());
            long now = clock.millis();
            String output = response.output() == null ? null : response.output().toString();
            store.completeExecution(request.requestId(), request.attempt(), now, now - startedAt, cost.total(),
                    output, response.cached());
            store.updateQueueStatus(request.requestId(), "completed", null, now);
            completed.inc();
            log.info("Completed {} in {}ms costing ${}", request.requestId(), now - startedAt,
                    String.format("%.6f", cost.total()));
            notifier.notifyCompletion(request, response.output(), cost.total());
        } catch (RuntimeException e) {
            log.error("Recording completion of {} failed", request.requestId(), e);
        } finally {
            release(reservation);
            queue.markCompleted(request.requestId());
        }
    }

    private void onFailure(QueueItem request, Reservation reservation, Throwable error) {
        release(reservation);
        queue.markCompleted(request.requestId());

        Throwable cause = unwrap(error);
        FailureReason reason = reasonFor(cause);
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        Exception failure = cause instanceof Exception ? (Exception) cause : new Exception(cause);
        log.warn("Attempt {} of {} failed ({}): {}", request.attempt(), request.requestId(), reason.code(), message);
        try {
            store.failExecution(request.requestId(), request.attempt(), reason, message, clock.millis());
            if (retryPolicy.shouldRetry(request, failure)) {
                retried.inc();
                submit(request.retried(retryPolicy.priorityBoost(request)));
            } else {
                failTerminally(request, reason, message);
            }
        } catch (RuntimeException e) {
            log.error("Handling failure of {} failed", request.requestId(), e);
        }
    }

    private void failTerminally(QueueItem request, FailureReason reason, String message) {
        failed.inc();
        long now = clock.millis();
        store.failExecution(request.requestId(), request.attempt(), reason, message, now);
        store.updateQueueStatus(request.requestId(), "failed", message, now);
        notifier.notifyFailure(request, reason, message);
    }

    static Throwable unwrap(Throwable t) {
        Throwable c = t;
        while ((c instanceof CompletionException || c instanceof ExecutionException) && c.getCause() != null) {
            c = c.getCause();
        }
        return c;
    }

    static FailureReason reasonFor(Throwable cause) {
        if (cause instanceof TimeoutException) return FailureReason.EXECUTOR_TIMEOUT;
        if (cause instanceof SchedulingException se && se.reason() != null) return se.reason();
        return FailureReason.EXECUTOR_FAILURE;
    }

    /**
     * Waits until every dispatched request has finished its completion handling.
     *
     * @return false if requests were still in flight when the timeout elapsed
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            List<CompletableFuture<Void>> pending = new ArrayList<>();
            for (CompletableFuture<Void> f : inFlight.values()) {
                if (!f.isDone()) pending.add(f);
            }
            if (pending.isEmpty()) return true;
            long left = deadline - System.nanoTime();
            if (left <= 0) return false;
            try {
                CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).get(left, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return false;
            } catch (ExecutionException e) {
                log.debug("In-flight request ended exceptionally", e);
            }
        }
    }

    /** Checkpoints pool and queue state, then evaluates alert rules. Each step is isolated from the others. */
    public void runMaintenance() {
        try {
            pool.saveState();
        } catch (RuntimeException e) {
            log.error("Saving pool state failed", e);
        }
        try {
            queue.saveState();
        } catch (RuntimeException e) {
            log.error("Saving queue state failed", e);
        }
        inFlight.values().removeIf(CompletableFuture::isDone);
        try {
            checkAlerts();
        } catch (RuntimeException e) {
            log.error("Alert check failed", e);
        }
    }

    /** Raises an alert for every shared bucket under 10%, a total queue depth over 1000, and any starved request. */
    public List<Alert> checkAlerts() {
        long now = clock.millis();
        List<Alert> raised = new ArrayList<>();
        for (Map.Entry<String, PoolStatus> e : pool.getStatus().entrySet()) {
            PoolStatus.BucketStatus shared = e.getValue().shared();
            if (shared.percentage() < RESOURCE_LOW_PERCENT) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("resourceType", e.getKey());
                details.put("available", shared.available());
                details.put("percentage", shared.percentage());
                raised.add(Alert.of(Alert.Type.RESOURCE_LOW, Alert.Severity.WARNING, null,
                        "Shared pool for " + e.getKey() + " below " + (int) RESOURCE_LOW_PERCENT + "%", details, now));
            }
        }
        QueueStatus status = queue.getQueueStatus();
        if (status.total() > QUEUE_BACKUP_DEPTH) {
            raised.add(Alert.of(Alert.Type.QUEUE_BACKUP, Alert.Severity.WARNING, null,
                    status.total() + " requests queued", Map.of("total", status.total()), now));
        }
        if (status.starved() > 0) {
            raised.add(Alert.of(Alert.Type.REQUEST_STARVATION, Alert.Severity.ERROR, null,
                    status.starved() + " requests waiting past the starvation threshold",
                    Map.of("starved", status.starved()), now));
        }
        List<Alert> stored = new ArrayList<>(raised.size());
        for (Alert a : raised) {
            log.warn("Alert {}/{}: {}", a.type().code(), a.severity().code(), a.message());
            stored.add(store.insertAlert(a));
        }
        return stored;
    }

    public Optional<ExecutionRecord> getExecutionStatus(String requestId) {
        return store.latestExecution(requestId);
    }

    public List<Alert> openAlerts(int limit) {
        return store.openAlerts(limit);
    }

    private void runLoop() {
        while (running.get()) {
            try {
                if (!scheduleNext()) sleepQuiet(config.idlePollMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Scheduler loop error", e);
                sleepQuiet(ERROR_BACKOFF_MILLIS);
            }
        }
    }

    private static void sleepQuiet(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemon(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}

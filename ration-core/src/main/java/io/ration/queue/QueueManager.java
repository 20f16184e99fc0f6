package io.ration.queue;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ration.core.QueueItem;
import io.ration.metrics.Metrics;
import io.ration.pool.Availability;
import io.ration.pool.ResourcePool;
import io.ration.store.KeyValueStore;
import io.ration.store.SchedulerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Five priority queues keyed by expected wait, with fairness tracking, starvation override and per-client
 * concurrency caps. All queue and fairness mutation is serialized on this instance.
 */
public class QueueManager {
    private static final Logger log = LoggerFactory.getLogger(QueueManager.class);

    static final String QUEUE_STATE_KEY = "queue-state";
    static final String FAIRNESS_STATE_KEY = "fairness-tracker";
    static final long FAIRNESS_WINDOW_MILLIS = 3_600_000L;
    /** A resource whose wait is at most this long does not block execution. */
    static final long EXECUTABLE_WAIT_MILLIS = 1_000L;
    static final long QUEUE_DEPTH_PENALTY_MILLIS = 1_000L;
    static final String STARVATION_BOOST = "starvation_boost";

    private final Map<WaitClass, RequestQueue> queues = new EnumMap<>(WaitClass.class);
    private final Map<String, FairnessWindow> fairness = new HashMap<>();
    private final Map<String, QueueItem> executing = new LinkedHashMap<>();

    private final ResourcePool pool;
    private final SchedulerStore store;
    private final KeyValueStore checkpoints;
    private final ObjectMapper json;
    private final Clock clock;
    private final long starvationThresholdMillis;
    private final int starvationBoost;

    public QueueManager(ResourcePool pool,
                        SchedulerStore store,
                        KeyValueStore checkpoints,
                        ObjectMapper json,
                        Metrics metrics,
                        Clock clock,
                        long starvationThresholdMillis,
                        int starvationBoost) {
        this.pool = Objects.requireNonNull(pool);
        this.store = Objects.requireNonNull(store);
        this.checkpoints = Objects.requireNonNull(checkpoints);
        this.json = Objects.requireNonNull(json);
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.starvationThresholdMillis = starvationThresholdMillis;
        this.starvationBoost = starvationBoost;
        for (WaitClass w : WaitClass.values()) {
            queues.put(w, new RequestQueue(w));
            metrics.gauge("queue." + w.queueName() + ".depth", () -> depth(w));
        }
        metrics.gauge("queue.executing", this::executingCount);
    }

    public synchronized EnqueueResult enqueue(QueueItem request) {
        long now = clock.millis();
        Priority priority = calculatePriority(request, now);
        int value = priority.value();
        String reason = priority.reason();
        if (isStarving(request, now)) {
            value = Math.min(Priority.MAX, value + starvationBoost);
            reason = STARVATION_BOOST;
        }

        long estimatedWait = calculateWaitTime(request, value);
        WaitClass target = selectQueue(estimatedWait);

        QueueItem placed = request.placed(value, reason, now);
        RequestQueue queue = queues.get(target);
        int position = queue.insert(placed);
        try {
            store.recordQueued(placed, target.queueName(), position, estimatedWait);
        } catch (RuntimeException e) {
            queue.remove(placed.requestId());
            throw e;
        }
        recordRequest(request.clientId(), now);
        log.debug("Queued {} in {} at {} with priority {} ({})", placed.requestId(), target.queueName(), position, value, reason);
        return new EnqueueResult(placed.requestId(), target, position, estimatedWait,
                saturatedAdd(now, estimatedWait), value, reason);
    }

    /**
     * Tier and urgency weights, an age boost of one point per five minutes waited (at most 20), a fairness bonus
     * that shrinks with the client's requests in the current hour, an SLA bonus and any retry boost, capped at 100.
     */
    public synchronized Priority calculatePriority(QueueItem request, long now) {
        List<String> factors = new ArrayList<>();
        int score = 0;

        int tier = request.clientTier().priorityWeight();
        score += tier;
        factors.add("tier:" + request.clientTier().wireName() + "(" + tier + ")");

        int urgency = request.urgency().priorityWeight();
        score += urgency;
        factors.add("urgency:" + request.urgency().wireName() + "(" + urgency + ")");

        long waited = request.waitedMillis();
        if (request.hasBeenQueued()) waited = Math.max(waited, now - request.firstEnqueuedAt());
        int ageBoost = (int) Math.min(20, (waited / 60_000L) / 5);
        if (ageBoost > 0) {
            score += ageBoost;
            factors.add("wait:" + ageBoost);
        }

        int fairnessScore = fairnessScore(request.clientId(), now);
        score += fairnessScore;
        factors.add("fairness:" + fairnessScore);

        if (request.slaDeadline() != null) {
            long toDeadline = request.slaDeadline() - now;
            if (toDeadline < 3_600_000L) {
                score += 10;
                factors.add("sla:10");
            } else if (toDeadline < 86_400_000L) {
                score += 5;
                factors.add("sla:5");
            }
        }

        if (request.priorityBoost() > 0) {
            score += request.priorityBoost();
            factors.add("retry:" + request.priorityBoost());
        }
        return new Priority(score, factors);
    }

    /**
     * Longest pool wait across the request's resources plus one second per queued request it would run behind,
     * that is every queued request with the same or a higher priority. Work of lower priority is overtaken and
     * does not delay it.
     */
    public synchronized long calculateWaitTime(QueueItem request, int priority) {
        long maxWait = 0;
        for (String type : request.requirements().types()) {
            Availability a = pool.checkAvailability(type, request.requirements().amount(type));
            maxWait = Math.max(maxWait, a.waitTimeMillis());
        }
        return saturatedAdd(maxWait, queuedAtOrAbove(priority) * QUEUE_DEPTH_PENALTY_MILLIS);
    }

    public WaitClass selectQueue(long estimatedWaitMillis) {
        return WaitClass.forWait(estimatedWaitMillis);
    }

    /**
     * Removes and returns the next request to run, or empty if nothing is runnable. A starved request that can run
     * wins over everything, oldest first; otherwise the first runnable queue head in wait-class order.
     */
    public synchronized Optional<QueueItem> getNextExecutable() {
        long now = clock.millis();
        List<QueueItem> starved = new ArrayList<>();
        for (RequestQueue q : queues.values()) starved.addAll(q.starved(now, starvationThresholdMillis));
        starved.sort(Comparator.comparingLong(QueueItem::firstEnqueuedAt));
        for (QueueItem item : starved) {
            if (canExecute(item)) {
                removeQueued(item.requestId());
                log.info("Starved request {} released after {}ms", item.requestId(), now - item.firstEnqueuedAt());
                return Optional.of(item);
            }
        }

        for (WaitClass w : WaitClass.values()) {
            if (w == WaitClass.DEFERRED) continue;
            RequestQueue q = queues.get(w);
            QueueItem head = q.peek();
            if (head != null && canExecute(head)) return Optional.of(q.poll());
        }
        RequestQueue deferred = queues.get(WaitClass.DEFERRED);
        QueueItem head = deferred.peek();
        if (head != null && canExecute(head)) return Optional.of(deferred.poll());
        return Optional.empty();
    }

    /**
     * True if every resource is available now or within a second without breaking its family quota, and the client
     * is under its tier's cap on concurrently executing requests.
     */
    public synchronized boolean canExecute(QueueItem request) {
        for (String type : request.requirements().types()) {
            double amount = request.requirements().amount(type);
            if (!pool.withinQuota(type, amount)) return false;
            Availability a = pool.checkAvailability(type, amount);
            if (!a.available() && a.waitTimeMillis() > EXECUTABLE_WAIT_MILLIS) return false;
        }
        return executingCount(request.clientId()) < request.clientTier().maxConcurrent();
    }

    public synchronized void markExecuting(QueueItem request) {
        executing.put(request.requestId(), request);
    }

    public synchronized void markCompleted(String requestId) {
        executing.remove(requestId);
    }

    public synchronized int executingCount() { return executing.size(); }

    public synchronized int executingCount(String clientId) {
        int n = 0;
        for (QueueItem item : executing.values()) {
            if (item.clientId().equals(clientId)) n++;
        }
        return n;
    }

    /** Cancels a queued request. Returns false if it is not queued, so a second call is a no-op. */
    public synchronized boolean removeFromQueue(String requestId) {
        if (!removeQueued(requestId)) return false;
        store.updateQueueStatus(requestId, "cancelled", null, clock.millis());
        return true;
    }

    public synchronized Optional<QueuePosition> position(String requestId) {
        for (RequestQueue q : queues.values()) {
            int i = q.position(requestId);
            if (i >= 0) return Optional.of(new QueuePosition(requestId, q.waitClass(), i, q.get(i).priority()));
        }
        return Optional.empty();
    }

    public synchronized int depth(WaitClass waitClass) { return queues.get(waitClass).size(); }

    public synchronized int totalDepth() {
        int total = 0;
        for (RequestQueue q : queues.values()) total += q.size();
        return total;
    }

    private int queuedAtOrAbove(int priority) {
        int n = 0;
        for (RequestQueue q : queues.values()) n += q.countAtOrAbove(priority);
        return n;
    }

    public synchronized QueueStatus getQueueStatus() {
        long now = clock.millis();
        Map<String, QueueStatus.Depth> depths = new LinkedHashMap<>();
        for (RequestQueue q : queues.values()) {
            QueueItem head = q.peek();
            depths.put(q.waitClass().queueName(), new QueueStatus.Depth(q.size(),
                    head == null ? null : head.enqueuedAt(), q.starved(now, starvationThresholdMillis).size()));
        }
        return new QueueStatus(depths, executing.size(), totalDepth());
    }

    public synchronized void saveState() {
        Map<String, List<QueueItem>> state = new LinkedHashMap<>();
        queues.forEach((w, q) -> state.put(w.queueName(), q.snapshot()));
        try {
            checkpoints.put(QUEUE_STATE_KEY, json.writeValueAsString(state));
            checkpoints.put(FAIRNESS_STATE_KEY, json.writeValueAsString(fairness));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not serialize queue state", e);
        }
    }

    /** Restores queues and fairness windows. A missing or unreadable checkpoint leaves the queues empty. */
    public synchronized void loadState() {
        try {
            Optional<String> queueJson = checkpoints.get(QUEUE_STATE_KEY);
            if (queueJson.isPresent()) {
                Map<String, List<QueueItem>> state = json.readValue(queueJson.get(),
                        new TypeReference<Map<String, List<QueueItem>>>() {});
                state.forEach((name, items) -> {
                    for (WaitClass w : WaitClass.values()) {
                        if (w.queueName().equals(name)) queues.get(w).replaceAll(items);
                    }
                });
            }
            Optional<String> fairnessJson = checkpoints.get(FAIRNESS_STATE_KEY);
            if (fairnessJson.isPresent()) {
                Map<String, FairnessWindow> state = json.readValue(fairnessJson.get(),
                        new TypeReference<Map<String, FairnessWindow>>() {});
                fairness.clear();
                fairness.putAll(state);
            }
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Error loading queue state", e);
        }
    }

    boolean isStarving(QueueItem request, long now) {
        return request.hasBeenQueued() && now - request.firstEnqueuedAt() > starvationThresholdMillis;
    }

    int fairnessScore(String clientId, long now) {
        FairnessWindow w = currentWindow(clientId, now);
        return (int) Math.max(0, 10 - w.requests() / 10);
    }

    private void recordRequest(String clientId, long now) {
        FairnessWindow w = currentWindow(clientId, now);
        fairness.put(clientId, new FairnessWindow(w.requests() + 1, w.lastReset()));
    }

    private FairnessWindow currentWindow(String clientId, long now) {
        FairnessWindow w = fairness.get(clientId);
        if (w == null || now - w.lastReset() > FAIRNESS_WINDOW_MILLIS) {
            w = new FairnessWindow(0, now);
            fairness.put(clientId, w);
        }
        return w;
    }

    private boolean removeQueued(String requestId) {
        for (RequestQueue q : queues.values()) {
            if (q.remove(requestId)) return true;
        }
        return false;
    }

    private static long saturatedAdd(long a, long b) {
        long r = a + b;
        return ((a ^ r) & (b ^ r)) < 0 ? Long.MAX_VALUE : r;
    }

    /** Requests a client made since {@code lastReset}; reset hourly. */
    public record FairnessWindow(long requests, long lastReset) {
        @JsonCreator
        public FairnessWindow(@JsonProperty("requests") long requests, @JsonProperty("lastReset") long lastReset) {
            this.requests = requests;
            this.lastReset = lastReset;
        }
    }
}

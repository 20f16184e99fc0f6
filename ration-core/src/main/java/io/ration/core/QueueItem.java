package io.ration.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A request waiting for execution. Immutable: requeue and retry produce a new item.
 *
 * <p>{@code enqueuedAt} is the time the item entered its current queue; {@code firstEnqueuedAt} is the time the
 * request first entered the system and survives requeues and retries.
 */
public record QueueItem(String requestId,
                        String clientId,
                        ClientTier clientTier,
                        String templateName,
                        ResourceRequirements requirements,
                        Urgency urgency,
                        int priority,
                        String priorityReason,
                        int priorityBoost,
                        long enqueuedAt,
                        long firstEnqueuedAt,
                        long waitedMillis,
                        int retryCount,
                        int requeueCount,
                        int maxRetries,
                        Long slaDeadline,
                        double estimatedCost,
                        WorkPayload payload) {

    public static final int DEFAULT_MAX_RETRIES = 3;

    @JsonCreator
    public QueueItem(@JsonProperty("requestId") String requestId,
                     @JsonProperty("clientId") String clientId,
                     @JsonProperty("clientTier") ClientTier clientTier,
                     @JsonProperty("templateName") String templateName,
                     @JsonProperty("requirements") ResourceRequirements requirements,
                     @JsonProperty("urgency") Urgency urgency,
                     @JsonProperty("priority") int priority,
                     @JsonProperty("priorityReason") String priorityReason,
                     @JsonProperty("priorityBoost") int priorityBoost,
                     @JsonProperty("enqueuedAt") long enqueuedAt,
                     @JsonProperty("firstEnqueuedAt") long firstEnqueuedAt,
                     @JsonProperty("waitedMillis") long waitedMillis,
                     @JsonProperty("retryCount") int retryCount,
                     @JsonProperty("requeueCount") int requeueCount,
                     @JsonProperty("maxRetries") int maxRetries,
                     @JsonProperty("slaDeadline") Long slaDeadline,
                     @JsonProperty("estimatedCost") double estimatedCost,
                     @JsonProperty("payload") WorkPayload payload) {
        this.requestId = Objects.requireNonNull(requestId, "requestId");
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.clientTier = clientTier == null ? ClientTier.BASIC : clientTier;
        this.templateName = templateName;
        this.requirements = requirements == null ? ResourceRequirements.none() : requirements;
        this.urgency = urgency == null ? Urgency.NORMAL : urgency;
        this.priority = priority;
        this.priorityReason = priorityReason;
        this.priorityBoost = Math.max(0, priorityBoost);
        this.enqueuedAt = enqueuedAt;
        this.firstEnqueuedAt = firstEnqueuedAt;
        this.waitedMillis = Math.max(0, waitedMillis);
        this.retryCount = Math.max(0, retryCount);
        this.requeueCount = Math.max(0, requeueCount);
        this.maxRetries = maxRetries < 0 ? DEFAULT_MAX_RETRIES : maxRetries;
        this.slaDeadline = slaDeadline;
        this.estimatedCost = Math.max(0, estimatedCost);
        this.payload = payload == null ? WorkPayload.empty() : payload;
    }

    public static Builder builder(String requestId, String clientId) { return new Builder(requestId, clientId); }

    /** Attempt number recorded against execution records; retries start a new attempt, requeues do not. */
    public int attempt() { return retryCount; }

    public boolean hasBeenQueued() { return firstEnqueuedAt > 0; }

    /** Stamps the queue placement computed by the queue manager. */
    public QueueItem placed(int newPriority, String reason, long now) {
        long first = firstEnqueuedAt > 0 ? firstEnqueuedAt : now;
        return new QueueItem(requestId, clientId, clientTier, templateName, requirements, urgency, newPriority, reason,
                priorityBoost, now, first, waitedMillis, retryCount, requeueCount, maxRetries, slaDeadline,
                estimatedCost, payload);
    }

    /** Same attempt, put back because resources could not be reserved. */
    public QueueItem requeued(long additionalWaitMillis) {
        return new QueueItem(requestId, clientId, clientTier, templateName, requirements, urgency, priority,
                priorityReason, priorityBoost, enqueuedAt, firstEnqueuedAt,
                saturatedAdd(waitedMillis, Math.max(0, additionalWaitMillis)), retryCount, requeueCount + 1,
                maxRetries, slaDeadline, estimatedCost, payload);
    }

    /** Next attempt after an executor failure, boosted so it does not starve behind fresh work. */
    public QueueItem retried(int boost) {
        return new QueueItem(requestId, clientId, clientTier, templateName, requirements, urgency, priority,
                priorityReason, priorityBoost + Math.max(0, boost), enqueuedAt, firstEnqueuedAt, waitedMillis,
                retryCount + 1, 0, maxRetries, slaDeadline, estimatedCost, payload);
    }

    public QueueItem withPayload(WorkPayload newPayload) {
        return new QueueItem(requestId, clientId, clientTier, templateName, requirements, urgency, priority,
                priorityReason, priorityBoost, enqueuedAt, firstEnqueuedAt, waitedMillis, retryCount, requeueCount,
                maxRetries, slaDeadline, estimatedCost, newPayload);
    }

    public QueueItem withEstimatedCost(double cost) {
        return new QueueItem(requestId, clientId, clientTier, templateName, requirements, urgency, priority,
                priorityReason, priorityBoost, enqueuedAt, firstEnqueuedAt, waitedMillis, retryCount, requeueCount,
                maxRetries, slaDeadline, cost, payload);
    }

    private static long saturatedAdd(long a, long b) {
        long r = a + b;
        return r < 0 ? Long.MAX_VALUE : r;
    }

    public static final class Builder {
        private final String requestId;
        private final String clientId;
        private ClientTier clientTier = ClientTier.STANDARD;
        private String templateName;
        private ResourceRequirements requirements = ResourceRequirements.none();
        private Urgency urgency = Urgency.NORMAL;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Long slaDeadline;
        private double estimatedCost;
        private WorkPayload payload = WorkPayload.empty();

        private Builder(String requestId, String clientId) {
            this.requestId = requestId;
            this.clientId = clientId;
        }

        public Builder tier(ClientTier t) { this.clientTier = t; return this; }
        public Builder template(String name) { this.templateName = name; return this; }
        public Builder requirements(ResourceRequirements r) { this.requirements = r; return this; }
        public Builder urgency(Urgency u) { this.urgency = u; return this; }
        public Builder maxRetries(int n) { this.maxRetries = n; return this; }
        public Builder slaDeadline(Long epochMillis) { this.slaDeadline = epochMillis; return this; }
        public Builder estimatedCost(double usd) { this.estimatedCost = usd; return this; }
        public Builder payload(WorkPayload p) { this.payload = p; return this; }

        public QueueItem build() {
            return new QueueItem(requestId, clientId, clientTier, templateName, requirements, urgency, 0, null, 0,
                    0L, 0L, 0L, 0, 0, maxRetries, slaDeadline, estimatedCost, payload);
        }
    }
}

package io.ration.pool;

import com.codahale.metrics.Meter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ration.core.ClientTier;
import io.ration.core.Urgency;
import io.ration.metrics.Metrics;
import io.ration.ratelimit.Sleeper;
import io.ration.ratelimit.SlidingWindowQuota;
import io.ration.ratelimit.TokenBucket;
import io.ration.store.KeyValueStore;
import io.ration.store.SchedulerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of metered resources. Each resource has a shared bucket, a smaller reserved bucket for urgent work,
 * optional per-client dedicated buckets and an optional sliding-window family quota.
 *
 * <p>Allocation is the single writer and is serialized on the pool; a refill wait is never slept under that lock. {@link #checkAvailability} and
 * {@link #getStatus} read without that lock and may be stale by the time a reservation is attempted.
 */
public class ResourcePool {
    private static final Logger log = LoggerFactory.getLogger(ResourcePool.class);

    static final String POOL_STATE_KEY = "pool-state";
    static final String QUOTA_STATE_KEY = "quota-state";
    private static final String DEDICATED_PREFIX = "dedicated:";

    private final Map<String, ResourceDescriptor> descriptors = new LinkedHashMap<>();
    private final Map<String, Buckets> pools = new LinkedHashMap<>();
    private final List<QuotaDefinition> quotaDefinitions;
    private final Map<String, SlidingWindowQuota> quotas = new ConcurrentHashMap<>();
    private final Map<String, TokenBucket> dedicated = new ConcurrentHashMap<>();
    private final Map<String, ResourceAllocation> active = new ConcurrentHashMap<>();

    private final SchedulerStore store;
    private final KeyValueStore checkpoints;
    private final ObjectMapper json;
    private final Clock clock;
    private final Sleeper sleeper;
    private final long maxBucketWaitMillis;
    private final Meter allocated;
    private final Meter declined;

    public ResourcePool(Collection<ResourceDescriptor> descriptors,
                        Collection<QuotaDefinition> quotaDefinitions,
                        SchedulerStore store,
                        KeyValueStore checkpoints,
                        ObjectMapper json,
                        Metrics metrics,
                        Clock clock,
                        Sleeper sleeper,
                        long maxBucketWaitMillis) {
        this.store = Objects.requireNonNull(store);
        this.checkpoints = Objects.requireNonNull(checkpoints);
        this.json = Objects.requireNonNull(json);
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.sleeper = sleeper == null ? Sleeper.system() : sleeper;
        this.maxBucketWaitMillis = maxBucketWaitMillis;
        this.allocated = metrics.meter("pool.allocation.success");
        this.declined = metrics.meter("pool.allocation.declined");
        for (ResourceDescriptor d : descriptors) {
            this.descriptors.put(d.resourceType(), d);
            this.pools.put(d.resourceType(), new Buckets(
                    bucket(d.capacity(), d.refillRatePerSecond()),
                    bucket(d.reservedCapacity(), d.reservedRefillRatePerSecond())));
        }
        this.quotaDefinitions = List.copyOf(quotaDefinitions);
        for (QuotaDefinition q : this.quotaDefinitions) {
            quotas.put(q.name(), new SlidingWindowQuota(q.windowMillis(), q.limit(), this.clock));
        }
    }

    public boolean isKnown(String resourceType) { return descriptors.containsKey(resourceType); }

    public Optional<ResourceDescriptor> descriptor(String resourceType) {
        return Optional.ofNullable(descriptors.get(resourceType));
    }

    public Collection<ResourceDescriptor> descriptors() { return descriptors.values(); }

    /**
     * Reserves {@code amount} of one resource. The family quota is checked before any bucket is touched; then the
     * client's dedicated bucket (enterprise), the reserved bucket (urgent), and finally the shared bucket if its
     * refill wait is within what the request's urgency accepts. That wait happens outside the pool lock, after which
     * the whole allocation is tried once more without waiting.
     */
    public AllocationResult allocate(AllocationRequest request) throws InterruptedException {
        Attempt first = tryAllocate(request, true);
        if (first.waitMillis() <= 0) return first.result();
        log.debug("Waiting {}ms for {} of {} for {}", first.waitMillis(), request.amount(), request.resourceType(),
                request.requestId());
        sleeper.sleep(first.waitMillis());
        return tryAllocate(request, false).result();
    }

    private synchronized Attempt tryAllocate(AllocationRequest request, boolean mayWait) {
        String type = request.resourceType();
        Buckets pool = pools.get(type);
        if (pool == null) throw new IllegalArgumentException("Unknown resource type: " + type);
        double amount = request.amount();

        QuotaDefinition quotaDef = quotaFor(type).orElse(null);
        SlidingWindowQuota quota = quotaDef == null ? null : quotas.get(quotaDef.name());
        if (quota != null && !quota.canConsume(amount)) {
            declined.mark();
            log.debug("Quota {} refused {} of {} for {}", quotaDef.name(), amount, type, request.requestId());
            return Attempt.done(AllocationResult.quotaExceeded(type, quota.getResetTime()));
        }

        PoolType from = null;
        TokenBucket source = null;
        if (request.clientTier() == ClientTier.ENTERPRISE) {
            TokenBucket own = dedicatedBucket(request.clientId(), type);
            if (own != null && own.tryConsume(amount)) {
                from = PoolType.DEDICATED;
                source = own;
            }
        }
        if (from == null && request.urgency() == Urgency.URGENT && pool.reserved.tryConsume(amount)) {
            from = PoolType.RESERVED;
            source = pool.reserved;
        }
        long waitTime = 0;
        if (from == null) {
            waitTime = pool.shared.getWaitTime(amount);
            if (waitTime == 0 && pool.shared.tryConsume(amount)) {
                from = PoolType.SHARED;
                source = pool.shared;
            } else if (mayWait && waitTime > 0
                    && waitTime <= Math.min(request.urgency().maxWaitMillis(), maxBucketWaitMillis)) {
                return Attempt.waitFor(waitTime);
            }
        }
        if (from == null) {
            declined.mark();
            return Attempt.done(AllocationResult.insufficient(type, waitTime, pool.shared.getAvailable()));
        }

        if (quota != null && !quota.consume(amount)) {
            source.refund(amount);
            declined.mark();
            return Attempt.done(AllocationResult.quotaExceeded(type, quota.getResetTime()));
        }

        ResourceAllocation allocation = new ResourceAllocation(
                UUID.randomUUID().toString(), request.requestId(), request.clientId(), type, amount, from,
                clock.millis(), calculateCost(type, amount), quotaDef == null ? null : quotaDef.name());
        try {
            store.recordAllocation(allocation);
        } catch (RuntimeException e) {
            source.refund(amount);
            if (quota != null) quota.refund(amount);
            throw e;
        }
        active.put(allocation.allocationId(), allocation);
        allocated.mark();
        return Attempt.done(AllocationResult.success(allocation));
    }

    /**
     * True if the resource's family quota, if any, still has room for {@code amount}. Requests that would be refused
     * by the quota are not worth dequeuing until the window moves.
     */
    public boolean withinQuota(String resourceType, double amount) {
        QuotaDefinition def = quotaFor(resourceType).orElse(null);
        if (def == null) return true;
        SlidingWindowQuota quota = quotas.get(def.name());
        return quota == null || quota.canConsume(amount);
    }

    /**
     * Bookkeeping release once the work that used the allocation is over. Tokens are not returned: the capacity
     * was occupied for the duration.
     */
    public void release(ResourceAllocation allocation) {
        if (active.remove(allocation.allocationId()) == null) return;
        store.markAllocationReleased(allocation.allocationId(), clock.millis(), false);
    }

    /**
     * Undoes an allocation whose capacity was never used, returning the tokens to the bucket they came from and
     * removing the amount from the family quota.
     */
    public void rollback(ResourceAllocation allocation) {
        if (active.remove(allocation.allocationId()) == null) return;
        TokenBucket source = switch (allocation.fromPool()) {
            case SHARED -> pools.get(allocation.resourceType()).shared;
            case RESERVED -> pools.get(allocation.resourceType()).reserved;
            case DEDICATED -> dedicated.get(dedicatedKey(allocation.clientId(), allocation.resourceType()));
        };
        if (source != null) source.refund(allocation.amountAllocated());
        if (allocation.quotaName() != null) {
            SlidingWindowQuota quota = quotas.get(allocation.quotaName());
            if (quota != null) quota.refund(allocation.amountAllocated());
        }
        store.markAllocationReleased(allocation.allocationId(), clock.millis(), true);
    }

    /** Side-effect-free twin of the shared-bucket step of {@link #allocate}. */
    public Availability checkAvailability(String resourceType, double amount) {
        Buckets pool = pools.get(resourceType);
        if (pool == null) return Availability.unknown();
        long shared = pool.shared.getAvailable();
        long reserved = pool.reserved.getAvailable();
        if (shared + reserved >= amount) {
            return new Availability(true, 0, shared, reserved, true);
        }
        return new Availability(false, pool.shared.getWaitTime(amount), shared, reserved, true);
    }

    public double calculateCost(String resourceType, double amount) {
        ResourceDescriptor d = descriptors.get(resourceType);
        return d == null ? 0 : d.costPerUnit().estimate(amount);
    }

    public Map<String, PoolStatus> getStatus() {
        Map<String, PoolStatus> status = new LinkedHashMap<>();
        pools.forEach((type, b) -> status.put(type, new PoolStatus(type,
                PoolStatus.BucketStatus.of(b.shared.getAvailable(), b.shared.capacity()),
                PoolStatus.BucketStatus.of(b.reserved.getAvailable(), b.reserved.capacity()))));
        return status;
    }

    public int activeAllocationCount() { return active.size(); }

    public List<ResourceAllocation> activeAllocations(String requestId) {
        List<ResourceAllocation> out = new ArrayList<>();
        for (ResourceAllocation a : active.values()) {
            if (a.requestId().equals(requestId)) out.add(a);
        }
        return out;
    }

    public Optional<SlidingWindowQuota> quota(String name) { return Optional.ofNullable(quotas.get(name)); }

    Optional<QuotaDefinition> quotaFor(String resourceType) {
        for (QuotaDefinition q : quotaDefinitions) {
            if (q.covers(resourceType)) return Optional.of(q);
        }
        return Optional.empty();
    }

    /** Checkpoints every bucket and quota window to the key-value store. */
    public synchronized void saveState() {
        Map<String, Map<String, TokenBucket.State>> poolState = new LinkedHashMap<>();
        pools.forEach((type, b) -> {
            Map<String, TokenBucket.State> s = new LinkedHashMap<>();
            s.put("shared", b.shared.exportState());
            s.put("reserved", b.reserved.exportState());
            poolState.put(type, s);
        });
        dedicated.forEach((key, bucket) -> poolState.put(DEDICATED_PREFIX + key, Map.of("shared", bucket.exportState())));
        Map<String, SlidingWindowQuota.State> quotaState = new LinkedHashMap<>();
        quotas.forEach((name, q) -> quotaState.put(name, q.exportState()));
        try {
            checkpoints.put(POOL_STATE_KEY, json.writeValueAsString(poolState));
            checkpoints.put(QUOTA_STATE_KEY, json.writeValueAsString(quotaState));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not serialize pool state", e);
        }
    }

    /**
     * Restores buckets and quota windows from the last checkpoint, applying the refill accrued since.
     * A missing or unreadable checkpoint leaves the pool at its configured initial state.
     */
    public synchronized void loadState() {
        try {
            Optional<String> poolJson = checkpoints.get(POOL_STATE_KEY);
            if (poolJson.isPresent()) {
                Map<String, Map<String, TokenBucket.State>> state = json.readValue(poolJson.get(),
                        new TypeReference<Map<String, Map<String, TokenBucket.State>>>() {});
                state.forEach((name, s) -> {
                    if (name.startsWith(DEDICATED_PREFIX)) {
                        TokenBucket.State shared = s.get("shared");
                        if (shared != null) dedicated.put(name.substring(DEDICATED_PREFIX.length()), restore(shared));
                        return;
                    }
                    Buckets b = pools.get(name);
                    if (b == null) return;
                    if (s.get("shared") != null) b.shared = restore(s.get("shared"));
                    if (s.get("reserved") != null) b.reserved = restore(s.get("reserved"));
                });
            }
            Optional<String> quotaJson = checkpoints.get(QUOTA_STATE_KEY);
            if (quotaJson.isPresent()) {
                Map<String, SlidingWindowQuota.State> state = json.readValue(quotaJson.get(),
                        new TypeReference<Map<String, SlidingWindowQuota.State>>() {});
                for (QuotaDefinition def : quotaDefinitions) {
                    SlidingWindowQuota.State s = state.get(def.name());
                    if (s == null) continue;
                    quotas.put(def.name(), SlidingWindowQuota.fromState(
                            new SlidingWindowQuota.State(def.windowMillis(), def.limit(), s.window()), clock));
                }
            }
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Error loading pool state, starting from configured capacity", e);
        }
    }

    private TokenBucket restore(TokenBucket.State state) {
        return TokenBucket.fromState(state, clock, sleeper, maxBucketWaitMillis);
    }

    private TokenBucket bucket(double capacity, double refill) {
        return new TokenBucket(capacity, refill, clock, sleeper, maxBucketWaitMillis);
    }

    private TokenBucket dedicatedBucket(String clientId, String resourceType) {
        String key = dedicatedKey(clientId, resourceType);
        TokenBucket existing = dedicated.get(key);
        if (existing != null) return existing;
        Optional<DedicatedPoolConfig> config = store.findDedicatedPool(clientId, resourceType);
        if (config.isEmpty()) return null;
        TokenBucket created = bucket(config.get().capacity(), config.get().refillRatePerSecond());
        dedicated.put(key, created);
        return created;
    }

    private static String dedicatedKey(String clientId, String resourceType) {
        return clientId + ":" + resourceType;
    }

    /** Either a finished allocation outcome or how long to wait before the one retry. */
    private record Attempt(AllocationResult result, long waitMillis) {
        static Attempt done(AllocationResult result) { return new Attempt(result, 0); }
        static Attempt waitFor(long millis) { return new Attempt(null, millis); }
    }

    private static final class Buckets {
        volatile TokenBucket shared;
        volatile TokenBucket reserved;

        Buckets(TokenBucket shared, TokenBucket reserved) {
            this.shared = shared;
            this.reserved = reserved;
        }
    }
}

package io.ration.service;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.ration.admission.AdmissionService;
import io.ration.client.ClientRegistry;
import io.ration.client.HttpClientRegistry;
import io.ration.config.PoolDefaults;
import io.ration.config.SchedulerConfig;
import io.ration.cost.CostTracker;
import io.ration.cost.PriceTable;
import io.ration.executor.HttpWorkerExecutor;
import io.ration.executor.Outbound;
import io.ration.executor.WorkerExecutor;
import io.ration.metrics.Metrics;
import io.ration.notify.HttpNotifier;
import io.ration.notify.LoggingNotifier;
import io.ration.notify.Notifier;
import io.ration.optimize.ModelDowngradeOptimizer;
import io.ration.optimize.OffPeakOptimizer;
import io.ration.optimize.RequestOptimizer;
import io.ration.pool.ResourcePool;
import io.ration.queue.QueueManager;
import io.ration.ratelimit.Sleeper;
import io.ration.retry.BoostingRetryPolicy;
import io.ration.retry.RetryPolicy;
import io.ration.scheduler.Scheduler;
import io.ration.store.JdbcKeyValueStore;
import io.ration.store.JdbcSchedulerStore;
import io.ration.store.Json;
import io.ration.store.KeyValueStore;
import io.ration.store.SchedulerStore;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

public class SchedulerModule extends AbstractModule {
    private static final Duration CALLBACK_TIMEOUT = Duration.ofSeconds(5);

    private final SchedulerConfig config;

    public SchedulerModule(SchedulerConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(SchedulerConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton Clock clock() { return Clock.systemUTC(); }

    @Provides @Singleton ObjectMapper objectMapper() { return Json.mapper(); }

    @Provides @Singleton PriceTable priceTable() { return PriceTable.defaults(); }

    @Provides @Singleton SchedulerStore schedulerStore() {
        JdbcSchedulerStore store = new JdbcSchedulerStore(config.jdbcUrl(), config.jdbcUser(), config.jdbcPassword());
        store.initSchema();
        return store;
    }

    @Provides @Singleton KeyValueStore keyValueStore(SchedulerStore store, Clock clock) {
        // the relational store owns the schema, so it is created first
        return new JdbcKeyValueStore(config.jdbcUrl(), config.jdbcUser(), config.jdbcPassword(), clock);
    }

    @Provides @Singleton ResourcePool resourcePool(SchedulerStore store, KeyValueStore kv, ObjectMapper json, Metrics metrics, Clock clock) {
        return new ResourcePool(PoolDefaults.resources(), PoolDefaults.quotas(), store, kv, json, metrics, clock,
                Sleeper.system(), config.bucketMaxWaitMillis());
    }

    @Provides @Singleton QueueManager queueManager(ResourcePool pool, SchedulerStore store, KeyValueStore kv, ObjectMapper json, Metrics metrics, Clock clock) {
        return new QueueManager(pool, store, kv, json, metrics, clock, config.starvationThresholdMillis(), config.starvationBoost());
    }

    @Provides @Singleton ClientRegistry clientRegistry(ObjectMapper json) {
        if (config.registryUri() == null) return ClientRegistry.defaults();
        return new HttpClientRegistry(Outbound.client(), config.registryUri(), CALLBACK_TIMEOUT, json);
    }

    @Provides @Singleton Notifier notifier(ObjectMapper json) {
        if (config.notifyUri() == null) return new LoggingNotifier();
        return new HttpNotifier(Outbound.client(), config.notifyUri(), CALLBACK_TIMEOUT, json);
    }

    @Provides @Singleton WorkerExecutor workerExecutor(ObjectMapper json, PriceTable prices) {
        return new HttpWorkerExecutor(Outbound.client(), config.workerUri(), json, prices);
    }

    @Provides @Singleton RequestOptimizer requestOptimizer(PriceTable prices, Clock clock) {
        return RequestOptimizer.chain(List.of(new ModelDowngradeOptimizer(prices), new OffPeakOptimizer(clock)));
    }

    @Provides @Singleton RetryPolicy retryPolicy() {
        return new BoostingRetryPolicy(config.maxRetries(), config.retryPriorityBoost());
    }

    @Provides @Singleton CostTracker costTracker(SchedulerStore store, KeyValueStore kv, ObjectMapper json, ClientRegistry registry, PriceTable prices, Clock clock) {
        return new CostTracker(store, kv, json, registry, prices, clock);
    }

    @Provides @Singleton Scheduler scheduler(QueueManager queue, ResourcePool pool, CostTracker costs, RequestOptimizer optimizer,
                                             WorkerExecutor executor, Notifier notifier, SchedulerStore store, RetryPolicy retry,
                                             Metrics metrics, Clock clock) {
        return new Scheduler(queue, pool, costs, optimizer, executor, notifier, store, retry, metrics, clock, config);
    }

    @Provides @Singleton AdmissionService admissionService(ResourcePool pool, QueueManager queue, CostTracker costs,
                                                           Scheduler scheduler, SchedulerStore store, Clock clock) {
        return new AdmissionService(pool, queue, costs, scheduler, store, clock);
    }
}

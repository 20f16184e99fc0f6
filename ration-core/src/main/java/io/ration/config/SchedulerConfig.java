package io.ration.config;

import java.net.URI;
import java.time.Duration;

/**
 * Runtime settings. Each value comes from a {@code ration.*} system property, then a {@code RATION_*} environment
 * variable, then the default.
 */
public record SchedulerConfig(
        String jdbcUrl,
        String jdbcUser,
        String jdbcPassword,
        URI workerUri,
        URI registryUri,
        URI notifyUri,
        long starvationThresholdMillis,
        int maxRequeues,
        int maxRetries,
        int retryPriorityBoost,
        int starvationBoost,
        Duration executorTimeout,
        long idlePollMillis,
        long maintenanceIntervalMillis,
        int dispatchThreads,
        double defaultEstimatedCost,
        long bucketMaxWaitMillis
) {
    public static final long DEFAULT_STARVATION_THRESHOLD_MILLIS = 600_000L;
    public static final int DEFAULT_MAX_REQUEUES = 10;

    public static SchedulerConfig defaults() {
        return new SchedulerConfig("jdbc:h2:mem:ration;DB_CLOSE_DELAY=-1", null, null,
                URI.create("http://127.0.0.1:8081"), null, null,
                DEFAULT_STARVATION_THRESHOLD_MILLIS, DEFAULT_MAX_REQUEUES, 3, 10, 10,
                Duration.ofSeconds(30), 100, 30_000, 8, 0.10, 300_000);
    }

    public static SchedulerConfig fromEnv() {
        String url = value("ration.jdbc.url", "RATION_JDBC_URL", "jdbc:h2:./data/ration;AUTO_SERVER=TRUE");
        String user = value("ration.jdbc.user", "RATION_JDBC_USER", null);
        String password = value("ration.jdbc.password", "RATION_JDBC_PASSWORD", null);
        URI worker = URI.create(value("ration.worker.uri", "RATION_WORKER_URI", "http://127.0.0.1:8081"));
        URI registry = uri(value("ration.registry.uri", "RATION_REGISTRY_URI", null));
        URI notify = uri(value("ration.notify.uri", "RATION_NOTIFY_URI", null));
        long starvation = Long.parseLong(value("ration.starvation.ms", "RATION_STARVATION_MS", String.valueOf(DEFAULT_STARVATION_THRESHOLD_MILLIS)));
        int requeues = Integer.parseInt(value("ration.requeues.max", "RATION_REQUEUES_MAX", String.valueOf(DEFAULT_MAX_REQUEUES)));
        int retries = Integer.parseInt(value("ration.retries.max", "RATION_RETRIES_MAX", "3"));
        int retryBoost = Integer.parseInt(value("ration.retries.boost", "RATION_RETRIES_BOOST", "10"));
        int starvationBoost = Integer.parseInt(value("ration.starvation.boost", "RATION_STARVATION_BOOST", "10"));
        Duration timeout = Duration.ofMillis(Long.parseLong(value("ration.executor.timeout.ms", "RATION_EXECUTOR_TIMEOUT_MS", "30000")));
        long idle = Long.parseLong(value("ration.idle.ms", "RATION_IDLE_MS", "100"));
        long maintenance = Long.parseLong(value("ration.maintenance.ms", "RATION_MAINTENANCE_MS", "30000"));
        int threads = Integer.parseInt(value("ration.dispatch.threads", "RATION_DISPATCH_THREADS", "8"));
        double cost = Double.parseDouble(value("ration.cost.default", "RATION_COST_DEFAULT", "0.10"));
        long bucketWait = Long.parseLong(value("ration.bucket.wait.ms", "RATION_BUCKET_WAIT_MS", "300000"));
        return new SchedulerConfig(url, user, password, worker, registry, notify, starvation, requeues, retries,
                retryBoost, starvationBoost, timeout, idle, maintenance, threads, cost, bucketWait);
    }

    public SchedulerConfig withJdbcUrl(String url) {
        return new SchedulerConfig(url, jdbcUser, jdbcPassword, workerUri, registryUri, notifyUri,
                starvationThresholdMillis, maxRequeues, maxRetries, retryPriorityBoost, starvationBoost,
                executorTimeout, idlePollMillis, maintenanceIntervalMillis, dispatchThreads, defaultEstimatedCost,
                bucketMaxWaitMillis);
    }

    public SchedulerConfig withWorkerUri(URI uri) {
        return new SchedulerConfig(jdbcUrl, jdbcUser, jdbcPassword, uri, registryUri, notifyUri,
                starvationThresholdMillis, maxRequeues, maxRetries, retryPriorityBoost, starvationBoost,
                executorTimeout, idlePollMillis, maintenanceIntervalMillis, dispatchThreads, defaultEstimatedCost,
                bucketMaxWaitMillis);
    }

    private static String value(String property, String env, String def) {
        return System.getProperty(property, System.getenv().getOrDefault(env, def));
    }

    private static URI uri(String s) {
        return (s == null || s.isBlank()) ? null : URI.create(s);
    }
}

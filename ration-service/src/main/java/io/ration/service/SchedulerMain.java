package io.ration.service;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.ration.config.SchedulerConfig;
import io.ration.pool.ResourcePool;
import io.ration.queue.QueueManager;
import io.ration.queue.QueueStatus;
import io.ration.scheduler.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.net.URI;
import java.util.concurrent.Callable;

/**
 * Runs the scheduler until the process is stopped. Settings come from {@link SchedulerConfig#fromEnv()}, with the
 * options below taking precedence.
 */
@CommandLine.Command(name = "ration-scheduler", mixinStandardHelpOptions = true, description = "Run the admission and scheduling loop")
public final class SchedulerMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(SchedulerMain.class);

    @CommandLine.Option(names = {"-d", "--jdbc-url"}, description = "JDBC URL of the relational store")
    String jdbcUrl;

    @CommandLine.Option(names = {"-w", "--worker-uri"}, description = "Base URI of the worker service")
    URI workerUri;

    @CommandLine.Option(names = {"-m", "--metrics-every"}, description = "Seconds between metric log lines; 0 disables", defaultValue = "60")
    int metricsEverySeconds;

    public static void main(String[] args) {
        int code = new CommandLine(new SchedulerMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        SchedulerConfig cfg = SchedulerConfig.fromEnv();
        if (jdbcUrl != null) cfg = cfg.withJdbcUrl(jdbcUrl);
        if (workerUri != null) cfg = cfg.withWorkerUri(workerUri);

        Injector injector = Guice.createInjector(new SchedulerModule(cfg));
        ResourcePool pool = injector.getInstance(ResourcePool.class);
        QueueManager queue = injector.getInstance(QueueManager.class);
        Scheduler scheduler = injector.getInstance(Scheduler.class);
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);

        pool.loadState();
        queue.loadState();
        scheduler.start();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.close();
            scheduler.runMaintenance();
        }, "scheduler-shutdown"));

        if (metricsEverySeconds > 0) {
            Thread printer = new Thread(() -> logMetricsEvery(registry, queue, scheduler, metricsEverySeconds * 1000L), "metrics-printer");
            printer.setDaemon(true);
            printer.start();
        }
        Thread.currentThread().join();
        return 0;
    }

    private static void logMetricsEvery(MetricRegistry r, QueueManager queue, Scheduler scheduler, long millis) {
        while (scheduler.isRunning()) {
            QueueStatus status = queue.getQueueStatus();
            log.info("dispatched={} completed={} failed={} retried={} requeued={} budgetDenied={} | queued={} executing={} starved={} inflight={}",
                    r.counter("scheduler.dispatched").getCount(),
                    r.counter("scheduler.completed").getCount(),
                    r.counter("scheduler.failed").getCount(),
                    r.counter("scheduler.retried").getCount(),
                    r.counter("scheduler.requeued").getCount(),
                    r.counter("scheduler.budget.denied").getCount(),
                    status.total(), status.executing(), status.starved(), scheduler.inFlightCount());
            try { Thread.sleep(millis); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); return; }
        }
    }
}

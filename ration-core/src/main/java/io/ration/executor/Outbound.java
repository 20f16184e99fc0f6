package io.ration.executor;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Outbound HTTP isolation: one client on a small daemon pool, shared by the worker executor, registry and notifier.
 */
public final class Outbound {
    private static final ExecutorService EXEC =
            Executors.newFixedThreadPool(Integer.getInteger("ration.iohttp", 8), r -> {
                Thread t = new Thread(r, "http-async"); t.setDaemon(true); return t;
            });
    private static final HttpClient CLIENT = HttpClient.newBuilder()
            .executor(EXEC)
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    private Outbound() {}

    public static HttpClient client() { return CLIENT; }
}

package io.ration.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpServer;
import io.ration.core.QueueItem;
import io.ration.cost.BudgetDecision;
import io.ration.error.FailureReason;
import io.ration.executor.Outbound;
import io.ration.store.Json;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

public class HttpNotifierTest {
    HttpServer server;
    HttpNotifier notifier;
    final Map<String, String> received = new ConcurrentHashMap<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/internal", exchange -> {
            String path = exchange.getRequestURI().getPath();
            received.put(path, new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            int status = path.endsWith("/exceeded") ? 500 : 204;
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
        });
        server.start();
        URI base = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
        notifier = new HttpNotifier(Outbound.client(), base, Duration.ofSeconds(2), Json.mapper());
    }

    @AfterEach
    void stopServer() { server.stop(0); }

    private static QueueItem item() {
        return QueueItem.builder("r1", "acme").template("digest").build().retried(10).requeued(500);
    }

    @Test
    void completion_posts_result_and_cost() throws Exception {
        JsonNode output = Json.mapper().readTree("{\"summary\":\"ok\"}");

        NotificationResult result = notifier.notifyCompletion(item(), output, 0.25);

        assertTrue(result.delivered());
        JsonNode body = Json.mapper().readTree(received.get(HttpNotifier.COMPLETE_PATH));
        assertEquals("r1", body.path("requestId").asText());
        assertEquals("ok", body.path("result").path("summary").asText());
        assertEquals(0.25, body.path("cost").asDouble(), 1e-9);
    }

    @Test
    void failure_reports_reason_and_attempts() throws Exception {
        NotificationResult result = notifier.notifyFailure(item(), FailureReason.EXECUTOR_TIMEOUT, "too slow");

        assertTrue(result.delivered());
        JsonNode body = Json.mapper().readTree(received.get(HttpNotifier.FAILED_PATH));
        assertEquals("executor_timeout", body.path("reason").asText());
        assertEquals(2, body.path("attempts").asInt());
        assertEquals(1, body.path("requeues").asInt());
    }

    @Test
    void error_status_is_reported_not_thrown() {
        NotificationResult result = notifier.notifyBudgetExceeded(item(), BudgetDecision.of(1.0, 0.9, 0.5));

        assertFalse(result.delivered());
        assertEquals(NotificationResult.Status.FAILED, result.status());
        assertTrue(received.containsKey(HttpNotifier.BUDGET_PATH));
    }

    @Test
    void unreachable_endpoint_is_reported_not_thrown() {
        HttpNotifier nowhere = new HttpNotifier(Outbound.client(), URI.create("http://127.0.0.1:1"),
                Duration.ofSeconds(1), Json.mapper());

        NotificationResult result = nowhere.notifyFailure(item(), FailureReason.CANCELLED, "gone");

        assertEquals(NotificationResult.Status.FAILED, result.status());
    }
}

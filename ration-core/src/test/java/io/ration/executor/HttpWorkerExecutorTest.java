package io.ration.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.ration.core.WorkPayload;
import io.ration.cost.PriceTable;
import io.ration.cost.TokenUsage;
import io.ration.error.ExecutorFailureException;
import io.ration.error.FailureReason;
import io.ration.store.Json;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class HttpWorkerExecutorTest {
    HttpServer server;
    HttpWorkerExecutor executor;
    final AtomicReference<String> lastBody = new AtomicReference<>();
    final AtomicReference<String> lastRequestId = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/api/execute", ex -> respond(ex, 200, "{\"success\":true,\"output\":{\"summary\":\"ok\"},"
                + "\"model\":\"gpt-4\",\"duration\":120,\"cached\":true,"
                + "\"usage\":{\"tokens\":{\"input\":300,\"output\":100},\"emails\":2},"
                + "\"storage\":{\"kv\":{\"reads\":4,\"writes\":1}}}"));
        server.createContext("/fails", ex -> respond(ex, 200, "{\"success\":false,\"error\":\"model overloaded\"}"));
        server.createContext("/broken", ex -> respond(ex, 503, "unavailable"));
        server.createContext("/slow", ex -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(ex, 200, "{}");
        });
        server.start();
        URI base = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
        executor = new HttpWorkerExecutor(Outbound.client(), base, Json.mapper(), PriceTable.defaults())
                .route("flaky", base.resolve("/fails"))
                .route("down", base.resolve("/broken"))
                .route("slow", base.resolve("/slow"));
    }

    @AfterEach
    void stopServer() { server.stop(0); }

    private void respond(HttpExchange exchange, int status, String body) throws IOException {
        lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        lastRequestId.set(exchange.getRequestHeaders().getFirst("X-Request-ID"));
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static WorkerRequest request(String template, long timeoutMillis) {
        WorkPayload payload = new WorkPayload("summarize", Map.of("text", "hello"), null, null, timeoutMillis, "gpt-4");
        return new WorkerRequest("r1", "acme", 70, template, payload, timeoutMillis);
    }

    private static Throwable failureOf(Executable call) {
        return assertThrows(ExecutionException.class, call).getCause();
    }

    @Test
    void posts_payload_and_parses_usage() throws Exception {
        WorkerResponse resp = executor.execute(request("digest", 2_000)).get(5, TimeUnit.SECONDS);

        assertEquals("ok", resp.output().path("summary").asText());
        assertEquals("gpt-4", resp.model());
        assertTrue(resp.cached());
        assertEquals(120, resp.durationMillis());
        assertEquals(new TokenUsage(300, 100), resp.usage().api().get("openai").get("gpt-4"));
        assertEquals(2, resp.usage().emails());
        assertEquals(120, resp.usage().cpuMillis());
        assertEquals(1, resp.usage().invocations());
        assertEquals(4, resp.usage().storage().get("kv").reads());

        assertEquals("r1", lastRequestId.get());
        JsonNode sent = Json.mapper().readTree(lastBody.get());
        assertEquals("summarize", sent.path("action").asText());
        assertEquals("hello", sent.path("input").path("text").asText());
        assertEquals("gpt-4", sent.path("model").asText());
    }

    @Test
    void worker_reported_failure_fails_the_future() {
        Throwable cause = failureOf(() -> executor.execute(request("flaky", 2_000)).get(5, TimeUnit.SECONDS));

        ExecutorFailureException failure = assertInstanceOf(ExecutorFailureException.class, cause);
        assertEquals(FailureReason.EXECUTOR_FAILURE, failure.reason());
        assertTrue(failure.getMessage().contains("model overloaded"), failure.getMessage());
    }

    @Test
    void non_2xx_status_fails_the_future() {
        Throwable cause = failureOf(() -> executor.execute(request("down", 2_000)).get(5, TimeUnit.SECONDS));

        assertInstanceOf(ExecutorFailureException.class, cause);
        assertTrue(cause.getMessage().contains("503"), cause.getMessage());
    }

    @Test
    void slow_worker_times_out() {
        Throwable cause = failureOf(() -> executor.execute(request("slow", 200)).get(5, TimeUnit.SECONDS));

        ExecutorFailureException failure = assertInstanceOf(ExecutorFailureException.class, cause);
        assertEquals(FailureReason.EXECUTOR_TIMEOUT, failure.reason());
    }

    @Test
    void unreachable_worker_fails_with_executor_failure() {
        HttpWorkerExecutor nowhere = new HttpWorkerExecutor(Outbound.client(), URI.create("http://127.0.0.1:1"),
                Json.mapper(), PriceTable.defaults());

        Throwable cause = failureOf(() -> nowhere.execute(request("digest", 2_000)).get(5, TimeUnit.SECONDS));

        assertInstanceOf(ExecutorFailureException.class, cause);
    }
}

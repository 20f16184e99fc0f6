package io.ration.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ration.cost.PriceTable;
import io.ration.cost.StorageUsage;
import io.ration.cost.TokenUsage;
import io.ration.cost.UsageReport;
import io.ration.error.ExecutorFailureException;
import io.ration.error.FailureReason;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-blocking JSON-over-HTTP worker client using HttpClient.sendAsync. Requests go to the route registered for
 * the template, or to {@code {base}/api/execute}.
 */
public class HttpWorkerExecutor implements WorkerExecutor {
    static final String DEFAULT_MODEL = "gpt-3.5-turbo";

    private final HttpClient client;
    private final URI defaultUri;
    private final Map<String, URI> routes = new ConcurrentHashMap<>();
    private final ObjectMapper json;
    private final PriceTable prices;

    public HttpWorkerExecutor(HttpClient client, URI base, ObjectMapper json, PriceTable prices) {
        this.client = client;
        this.defaultUri = base.resolve("/api/execute");
        this.json = json;
        this.prices = prices;
    }

    public HttpWorkerExecutor route(String templateName, URI uri) {
        routes.put(templateName, uri);
        return this;
    }

    @Override
    public CompletableFuture<WorkerResponse> execute(WorkerRequest request) {
        URI uri = request.templateName() == null ? defaultUri : routes.getOrDefault(request.templateName(), defaultUri);
        HttpRequest req;
        try {
            req = HttpRequest.newBuilder(uri)
                    .timeout(Duration.ofMillis(request.timeoutMillis()))
                    .header("Content-Type", "application/json")
                    .header("X-Request-ID", request.requestId())
                    .header("X-Client-ID", request.clientId())
                    .header("X-Priority", String.valueOf(request.priority()))
                    .POST(HttpRequest.BodyPublishers.ofString(body(request)))
                    .build();
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new ExecutorFailureException("Unserializable payload for " + request.requestId(), e));
        }
        return client.sendAsync(req, HttpResponse.BodyHandlers.ofString())
                .handle((resp, err) -> {
                    if (err != null) throw new CompletionException(translate(request, err));
                    return parse(request, resp);
                });
    }

    private String body(WorkerRequest request) throws JsonProcessingException {
        ObjectNode body = json.createObjectNode();
        body.put("action", request.payload().action());
        body.set("input", json.valueToTree(request.payload().input()));
        body.set("params", json.valueToTree(request.payload().params()));
        body.set("config", json.valueToTree(request.payload().config()));
        body.put("timeout", request.timeoutMillis());
        if (request.payload().model() != null) body.put("model", request.payload().model());
        return json.writeValueAsString(body);
    }

    private WorkerResponse parse(WorkerRequest request, HttpResponse<String> resp) {
        if (resp.statusCode() / 100 != 2) {
            throw new ExecutorFailureException("Worker error " + resp.statusCode() + " for " + request.requestId() + ": " + resp.body());
        }
        JsonNode root;
        try {
            root = json.readTree(resp.body());
        } catch (JsonProcessingException e) {
            throw new ExecutorFailureException("Unreadable worker response for " + request.requestId(), e);
        }
        if (root.has("success") && !root.get("success").asBoolean()) {
            throw new ExecutorFailureException("Worker reported failure for " + request.requestId() + ": "
                    + root.path("error").asText("unknown error"));
        }
        String model = root.hasNonNull("model") ? root.get("model").asText()
                : request.payload().model() != null ? request.payload().model() : DEFAULT_MODEL;
        JsonNode output = root.has("output") ? root.get("output") : root;
        long duration = root.path("duration").asLong(0);
        boolean cached = root.path("cached").asBoolean(false) || root.path("cache_hit").asBoolean(false);
        return new WorkerResponse(output, usage(root, model, duration), duration, cached, model);
    }

    /**
     * Tokens are billed to the reported model; duration becomes CPU time plus one invocation; storage is passed
     * through per storage class.
     */
    UsageReport usage(JsonNode root, String model, long duration) {
        UsageReport.Builder b = UsageReport.builder();
        JsonNode usage = root.path("usage");
        JsonNode tokens = usage.path("tokens");
        if (tokens.isObject()) {
            String provider = prices.providerOf(model).orElse("openai");
            b.tokens(provider, model, new TokenUsage(tokens.path("input").asLong(0), tokens.path("output").asLong(0)));
        }
        b.emails(usage.path("emails").asLong(0));
        b.sms(usage.path("sms").asLong(0));
        if (duration > 0) {
            b.cpuMillis(duration);
            b.invocations(1);
        }
        JsonNode storage = root.path("storage");
        if (storage.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = storage.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                JsonNode ops = e.getValue();
                b.storage(e.getKey(), new StorageUsage(ops.path("reads").asLong(0), ops.path("writes").asLong(0),
                        ops.path("storage_gb_hours").asDouble(0)));
            }
        }
        return b.build();
    }

    private static ExecutorFailureException translate(WorkerRequest request, Throwable err) {
        Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
        if (cause instanceof HttpTimeoutException) {
            return new ExecutorFailureException(FailureReason.EXECUTOR_TIMEOUT,
                    "Worker timed out after " + request.timeoutMillis() + "ms for " + request.requestId(), cause);
        }
        return new ExecutorFailureException("Worker unreachable for " + request.requestId(), cause);
    }
}

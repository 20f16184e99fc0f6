package io.ration.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ration.core.QueueItem;
import io.ration.cost.BudgetDecision;
import io.ration.error.FailureReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Posts JSON to the account service's internal endpoints. Delivery problems are logged and reported in the
 * result, never thrown.
 */
public class HttpNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(HttpNotifier.class);

    static final String COMPLETE_PATH = "/internal/request/complete";
    static final String FAILED_PATH = "/internal/request/failed";
    static final String BUDGET_PATH = "/internal/budget/exceeded";

    private final HttpClient client;
    private final URI base;
    private final Duration timeout;
    private final ObjectMapper json;

    public HttpNotifier(HttpClient client, URI base, Duration timeout, ObjectMapper json) {
        this.client = client;
        this.base = base;
        this.timeout = timeout == null ? Duration.ofSeconds(5) : timeout;
        this.json = json;
    }

    @Override
    public NotificationResult notifyCompletion(QueueItem item, JsonNode output, double costUsd) {
        ObjectNode body = json.createObjectNode();
        body.put("requestId", item.requestId());
        body.put("clientId", item.clientId());
        body.set("result", output);
        body.put("cost", costUsd);
        return post(COMPLETE_PATH, body);
    }

    @Override
    public NotificationResult notifyFailure(QueueItem item, FailureReason reason, String message) {
        ObjectNode body = json.createObjectNode();
        body.put("requestId", item.requestId());
        body.put("clientId", item.clientId());
        body.put("reason", reason.code());
        body.put("error", message);
        body.put("attempts", item.retryCount() + 1);
        body.put("requeues", item.requeueCount());
        return post(FAILED_PATH, body);
    }

    @Override
    public NotificationResult notifyBudgetExceeded(QueueItem item, BudgetDecision decision) {
        ObjectNode body = json.createObjectNode();
        body.put("requestId", item.requestId());
        body.put("clientId", item.clientId());
        body.set("budgetInfo", json.valueToTree(decision));
        return post(BUDGET_PATH, body);
    }

    private NotificationResult post(String path, ObjectNode body) {
        try {
            HttpRequest req = HttpRequest.newBuilder(base.resolve(path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("X-Worker-ID", "resource-manager")
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                    .build();
            HttpResponse<Void> resp = client.send(req, HttpResponse.BodyHandlers.discarding());
            if (resp.statusCode() / 100 != 2) {
                log.warn("Notification to {} answered {}", path, resp.statusCode());
                return NotificationResult.failed("status " + resp.statusCode());
            }
            return NotificationResult.notified();
        } catch (IOException e) {
            log.warn("Notification to {} failed: {}", path, e.toString());
            return NotificationResult.failed(e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return NotificationResult.failed("interrupted");
        }
    }
}

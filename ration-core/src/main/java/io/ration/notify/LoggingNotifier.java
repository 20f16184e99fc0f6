package io.ration.notify;

import com.fasterxml.jackson.databind.JsonNode;
import io.ration.core.QueueItem;
import io.ration.cost.BudgetDecision;
import io.ration.error.FailureReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Used when no notification endpoint is configured. */
public class LoggingNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public NotificationResult notifyCompletion(QueueItem item, JsonNode output, double costUsd) {
        log.info("Request {} for client {} completed, cost ${}", item.requestId(), item.clientId(), costUsd);
        return NotificationResult.skipped("no notification endpoint");
    }

    @Override
    public NotificationResult notifyFailure(QueueItem item, FailureReason reason, String message) {
        log.info("Request {} for client {} failed ({}) after {} attempts: {}", item.requestId(), item.clientId(),
                reason.code(), item.retryCount() + 1, message);
        return NotificationResult.skipped("no notification endpoint");
    }

    @Override
    public NotificationResult notifyBudgetExceeded(QueueItem item, BudgetDecision decision) {
        log.info("Client {} over budget: remaining ${}, required ${}", item.clientId(), decision.remaining(), decision.required());
        return NotificationResult.skipped("no notification endpoint");
    }
}

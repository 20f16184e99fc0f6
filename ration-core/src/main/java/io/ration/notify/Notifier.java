package io.ration.notify;

import com.fasterxml.jackson.databind.JsonNode;
import io.ration.core.QueueItem;
import io.ration.cost.BudgetDecision;
import io.ration.error.FailureReason;

/** Tells the originating caller how its request ended. */
public interface Notifier {
    NotificationResult notifyCompletion(QueueItem item, JsonNode output, double costUsd);

    /** Terminal failure, with the attempts and requeues the request went through. */
    NotificationResult notifyFailure(QueueItem item, FailureReason reason, String message);

    NotificationResult notifyBudgetExceeded(QueueItem item, BudgetDecision decision);
}

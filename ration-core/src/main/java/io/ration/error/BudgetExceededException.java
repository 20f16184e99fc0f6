package io.ration.error;

import io.ration.cost.BudgetDecision;

/** Client-level budget gate refused the request. Terminal for the attempt. */
public class BudgetExceededException extends SchedulingException {
    private final String clientId;
    private final BudgetDecision decision;

    public BudgetExceededException(String clientId, BudgetDecision decision) {
        super(FailureReason.BUDGET_EXCEEDED, String.format(
                "Budget exceeded for client %s: remaining $%.4f, required $%.4f",
                clientId, decision.remaining(), decision.required()));
        this.clientId = clientId;
        this.decision = decision;
    }

    public String clientId() { return clientId; }
    public BudgetDecision decision() { return decision; }
}

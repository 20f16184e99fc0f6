package io.ration.cost;

/**
 * Admit or deny a request against its client's monthly budget. {@code used} is the cost already accumulated this
 * month and {@code required} the estimate being checked.
 */
public record BudgetDecision(boolean available, String reason, double budget, double used, double remaining, double required) {
    public static final String INSUFFICIENT_BUDGET = "insufficient_budget";

    public static BudgetDecision of(double budget, double used, double required) {
        double remaining = budget - used;
        if (used + required > budget) {
            return new BudgetDecision(false, INSUFFICIENT_BUDGET, budget, used, remaining, required);
        }
        return new BudgetDecision(true, null, budget, used, remaining, required);
    }

    public double afterExecution() { return remaining - required; }
}

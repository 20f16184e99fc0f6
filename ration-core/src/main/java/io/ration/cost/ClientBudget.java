package io.ration.cost;

import java.time.LocalDate;

/**
 * Running cost and request counters of one client for a day and its month.
 */
public record ClientBudget(String clientId,
                           LocalDate day,
                           double costToday,
                           double costMonth,
                           long requestsToday,
                           long requestsMonth,
                           double monthlyBudgetUsd) {

    public static ClientBudget empty(String clientId, LocalDate day) {
        return new ClientBudget(clientId, day, 0, 0, 0, 0, 0);
    }

    public ClientBudget withMonthlyBudget(double usd) {
        return new ClientBudget(clientId, day, costToday, costMonth, requestsToday, requestsMonth, usd);
    }

    public double remaining() { return monthlyBudgetUsd - costMonth; }
}

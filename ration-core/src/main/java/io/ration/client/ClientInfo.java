package io.ration.client;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.ration.core.ClientTier;

/** Account data held by the client registry. */
public record ClientInfo(String clientId, ClientTier tier, double monthlyBudgetUsd) {
    public static final double DEFAULT_MONTHLY_BUDGET = 100.0;

    @JsonCreator
    public static ClientInfo fromJson(@JsonProperty("clientId") @JsonAlias({"id", "client_id"}) String clientId,
                                      @JsonProperty("tier") @JsonAlias("subscription_tier") String tier,
                                      @JsonProperty("monthlyBudgetUsd") @JsonAlias("monthly_budget") Double budget) {
        return new ClientInfo(clientId,
                tier == null ? ClientTier.STANDARD : ClientTier.parse(tier),
                budget == null ? DEFAULT_MONTHLY_BUDGET : budget);
    }

    /** Conservative stand-in used when the registry cannot be reached. */
    public static ClientInfo defaults(String clientId) {
        return new ClientInfo(clientId, ClientTier.STANDARD, DEFAULT_MONTHLY_BUDGET);
    }
}

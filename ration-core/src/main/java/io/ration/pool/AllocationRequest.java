package io.ration.pool;

import io.ration.core.ClientTier;
import io.ration.core.Urgency;

public record AllocationRequest(String resourceType,
                                double amount,
                                String clientId,
                                ClientTier clientTier,
                                Urgency urgency,
                                String requestId) {
    public AllocationRequest {
        clientTier = clientTier == null ? ClientTier.BASIC : clientTier;
        urgency = urgency == null ? Urgency.NORMAL : urgency;
    }
}

package io.ration.cost;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Consumption reported after execution, grouped the way it is priced: tokens per provider and model, messages,
 * storage operations per storage class, and compute.
 */
public record UsageReport(Map<String, Map<String, TokenUsage>> api,
                          long emails,
                          long sms,
                          Map<String, StorageUsage> storage,
                          long invocations,
                          long cpuMillis) {

    public UsageReport {
        Map<String, Map<String, TokenUsage>> copy = new LinkedHashMap<>();
        if (api != null) api.forEach((provider, models) -> copy.put(provider, Map.copyOf(models)));
        api = Map.copyOf(copy);
        storage = storage == null ? Map.of() : Map.copyOf(storage);
    }

    public static UsageReport empty() { return builder().build(); }

    public static Builder builder() { return new Builder(); }

    public boolean isEmpty() {
        return api.isEmpty() && emails == 0 && sms == 0 && storage.isEmpty() && invocations == 0 && cpuMillis == 0;
    }

    public static final class Builder {
        private final Map<String, Map<String, TokenUsage>> api = new LinkedHashMap<>();
        private final Map<String, StorageUsage> storage = new LinkedHashMap<>();
        private long emails;
        private long sms;
        private long invocations;
        private long cpuMillis;

        public Builder tokens(String provider, String model, TokenUsage usage) {
            api.computeIfAbsent(provider, p -> new LinkedHashMap<>()).put(model, usage);
            return this;
        }

        public Builder emails(long n) { this.emails = n; return this; }
        public Builder sms(long n) { this.sms = n; return this; }
        public Builder storage(String type, StorageUsage usage) { storage.put(type, usage); return this; }
        public Builder invocations(long n) { this.invocations = n; return this; }
        public Builder cpuMillis(long ms) { this.cpuMillis = ms; return this; }

        public UsageReport build() {
            return new UsageReport(api, emails, sms, storage, invocations, cpuMillis);
        }
    }
}

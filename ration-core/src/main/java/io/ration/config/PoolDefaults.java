package io.ration.config;

import io.ration.pool.QuotaDefinition;
import io.ration.pool.ResourceDescriptor;
import io.ration.pool.UnitPrice;

import java.util.List;

/** Built-in resource registry and sliding-window families. */
public final class PoolDefaults {
    private static final long DAY_MILLIS = 86_400_000L;

    private PoolDefaults() {}

    public static List<ResourceDescriptor> resources() {
        return List.of(
                new ResourceDescriptor("openai-gpt4", "GPT-4", "openai", 10_000, 166, 1_000, 16,
                        UnitPrice.perThousand(0.03, 0.06)),
                new ResourceDescriptor("openai-gpt35", "GPT-3.5 Turbo", "openai", 90_000, 1_500, 9_000, 150,
                        UnitPrice.perThousand(0.0015, 0.002)),
                new ResourceDescriptor("anthropic-claude", "Claude 3 Sonnet", "anthropic", 40_000, 666, 4_000, 66,
                        UnitPrice.perThousand(0.003, 0.015)),
                new ResourceDescriptor("email", "Email", "sendgrid", 1_000, 16, 100, 1.6, UnitPrice.flat(0.0001)),
                new ResourceDescriptor("sms", "SMS", "twilio", 500, 8, 50, 0.8, UnitPrice.flat(0.0075)),
                ResourceDescriptor.of("database", "Database", "d1", 50_000, 833, UnitPrice.free()),
                ResourceDescriptor.of("storage-kv", "KV Storage", "kv", 100_000, 1_666, UnitPrice.flat(0.0000005)));
    }

    public static List<QuotaDefinition> quotas() {
        return List.of(
                new QuotaDefinition("openai-daily", "openai", DAY_MILLIS, 1_000_000),
                new QuotaDefinition("email-daily", "email", DAY_MILLIS, 100_000),
                new QuotaDefinition("storage-monthly", "storage", 30 * DAY_MILLIS, 10_737_418_240.0));
    }
}

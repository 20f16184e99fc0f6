package io.ration.cost;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What one run of a pipeline template is expected to consume: estimated tokens per API provider, messages and
 * compute time.
 */
public record TemplateRequirements(Map<String, Long> apiTokens, long emails, long sms, long computeMillis) {
    public static final long DEFAULT_TOKENS = 1000;

    @JsonCreator
    public TemplateRequirements(@JsonProperty("apiTokens") Map<String, Long> apiTokens,
                                @JsonProperty("emails") long emails,
                                @JsonProperty("sms") long sms,
                                @JsonProperty("computeMillis") long computeMillis) {
        this.apiTokens = apiTokens == null ? Map.of() : Map.copyOf(new LinkedHashMap<>(apiTokens));
        this.emails = Math.max(0, emails);
        this.sms = Math.max(0, sms);
        this.computeMillis = Math.max(0, computeMillis);
    }

    /** Used when a template has no stored requirements. */
    public static TemplateRequirements defaults() {
        return new TemplateRequirements(Map.of("openai", DEFAULT_TOKENS), 0, 0, 5000);
    }

    public long tokensFor(String provider) {
        Long t = apiTokens.get(provider);
        return t == null || t <= 0 ? DEFAULT_TOKENS : t;
    }
}

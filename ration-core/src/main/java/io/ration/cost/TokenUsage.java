package io.ration.cost;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public record TokenUsage(long input, long output) {
    @JsonCreator
    public TokenUsage(@JsonProperty("input") long input, @JsonProperty("output") long output) {
        this.input = Math.max(0, input);
        this.output = Math.max(0, output);
    }

    /** Splits an unknown total with the pre-flight 60/40 heuristic. */
    public static TokenUsage estimated(long total) {
        long in = Math.round(total * 0.6);
        return new TokenUsage(in, total - in);
    }

    public long total() { return input + output; }
}

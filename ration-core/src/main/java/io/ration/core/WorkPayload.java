package io.ration.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * What the downstream worker is asked to do. Opaque to the scheduler apart from the model hint and timeout.
 * A {@code timeoutMillis} of zero leaves the timeout to the scheduler's configuration.
 */
public record WorkPayload(String action,
                          Map<String, Object> input,
                          Map<String, Object> params,
                          Map<String, Object> config,
                          long timeoutMillis,
                          String model) {
    @JsonCreator
    public WorkPayload(@JsonProperty("action") String action,
                       @JsonProperty("input") Map<String, Object> input,
                       @JsonProperty("params") Map<String, Object> params,
                       @JsonProperty("config") Map<String, Object> config,
                       @JsonProperty("timeoutMillis") long timeoutMillis,
                       @JsonProperty("model") String model) {
        this.action = action == null || action.isBlank() ? "process" : action;
        this.input = input == null ? Map.of() : input;
        this.params = params == null ? Map.of() : params;
        this.config = config == null ? Map.of() : config;
        this.timeoutMillis = Math.max(0, timeoutMillis);
        this.model = model;
    }

    public static WorkPayload empty() { return new WorkPayload("process", null, null, null, 0, null); }

    public long timeoutOr(long fallbackMillis) {
        return timeoutMillis > 0 ? timeoutMillis : fallbackMillis;
    }

    public WorkPayload withModel(String newModel) {
        return new WorkPayload(action, input, params, config, timeoutMillis, newModel);
    }
}

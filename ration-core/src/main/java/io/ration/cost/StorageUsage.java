package io.ration.cost;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public record StorageUsage(long reads, long writes, double gbHours) {
    @JsonCreator
    public StorageUsage(@JsonProperty("reads") long reads,
                        @JsonProperty("writes") long writes,
                        @JsonProperty("gbHours") @JsonAlias("storage_gb_hours") double gbHours) {
        this.reads = Math.max(0, reads);
        this.writes = Math.max(0, writes);
        this.gbHours = Math.max(0, gbHours);
    }
}

package io.ration.queue;

import java.util.Map;

public record QueueStatus(Map<String, Depth> queues, int executing, int total) {

    /** {@code oldestEnqueuedAt} is the head's enqueue time, or null for an empty queue. */
    public record Depth(int depth, Long oldestEnqueuedAt, int starved) {}

    public QueueStatus {
        queues = Map.copyOf(queues);
    }

    public int starved() {
        int n = 0;
        for (Depth d : queues.values()) n += d.starved();
        return n;
    }
}

package io.ration.queue;

public record QueuePosition(String requestId, WaitClass queue, int position, int priority) {
}

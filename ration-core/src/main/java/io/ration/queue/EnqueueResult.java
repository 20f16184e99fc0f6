package io.ration.queue;

/** Where a request was placed and when it is expected to start. */
public record EnqueueResult(String requestId,
                            WaitClass queue,
                            int position,
                            long estimatedWaitMillis,
                            long estimatedStart,
                            int priority,
                            String priorityReason) {

    public String queueName() { return queue.queueName(); }
}
